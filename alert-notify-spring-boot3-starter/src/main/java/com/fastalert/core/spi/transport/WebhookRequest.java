package com.fastalert.core.spi.transport;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 一次 HTTP 调用的完整描述
 * basic auth 与 bearer token 互斥
 */
@Getter
@Builder(toBuilder = true)
public class WebhookRequest {

    private final String url;

    @Builder.Default
    private final String method = "POST";

    @Singular
    private final Map<String, String> headers;

    private final byte[] body;

    private final String user;

    private final String password;

    private final String bearerToken;

    public byte[] getBody() {
        return body == null ? new byte[0] : body;
    }

    public boolean hasBasicAuth() {
        return user != null && !user.isEmpty() && password != null && !password.isEmpty();
    }

    public String bodyAsString() {
        return new String(getBody(), StandardCharsets.UTF_8);
    }

    public static class WebhookRequestBuilder {
        private byte[] body;

        public WebhookRequestBuilder body(byte[] body) {
            this.body = body;
            return this;
        }

        public WebhookRequestBuilder body(String body) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
            return this;
        }
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
