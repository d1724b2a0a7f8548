package com.fastalert.core.notify;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * multipart/form-data 请求体
 */
public final class MultipartBody {

    private final String boundary;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private boolean closed;

    public MultipartBody(String boundary) {
        if (boundary == null || boundary.isEmpty()) {
            throw new IllegalArgumentException("boundary is required");
        }
        this.boundary = boundary;
    }

    public MultipartBody field(String name, String value) {
        startPart("form-data; name=\"" + escape(name) + "\"", null);
        write(value.getBytes(StandardCharsets.UTF_8));
        write("\r\n");
        return this;
    }

    public MultipartBody file(String field, String fileName, byte[] content) {
        startPart("form-data; name=\"" + escape(field) + "\"; filename=\"" + escape(fileName) + "\"", "application/octet-stream");
        write(content);
        write("\r\n");
        return this;
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public byte[] build() {
        if (!closed) {
            write("--" + boundary + "--\r\n");
            closed = true;
        }
        return out.toByteArray();
    }

    private void startPart(String disposition, String contentType) {
        if (closed) {
            throw new IllegalStateException("multipart body already built");
        }
        write("--" + boundary + "\r\n");
        write("Content-Disposition: " + disposition + "\r\n");
        if (contentType != null) {
            write("Content-Type: " + contentType + "\r\n");
        }
        write("\r\n");
    }

    private void write(String s) {
        write(s.getBytes(StandardCharsets.UTF_8));
    }

    private void write(byte[] b) {
        out.write(b, 0, b.length);
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
