package com.fastalert.core.spi.transport;

import java.nio.charset.StandardCharsets;

/**
 * HTTP 响应
 */
public class WebhookResponse {

    private final int status;

    private final byte[] body;

    public WebhookResponse(int status, byte[] body) {
        this.status = status;
        this.body = body == null ? new byte[0] : body;
    }

    public static WebhookResponse ok(String body) {
        return new WebhookResponse(200, body.getBytes(StandardCharsets.UTF_8));
    }

    public int status() {
        return status;
    }

    public byte[] body() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }
}
