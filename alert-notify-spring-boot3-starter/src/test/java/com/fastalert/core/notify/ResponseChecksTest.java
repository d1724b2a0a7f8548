package com.fastalert.core.notify;

import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.exception.NotifyException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseChecksTest {

    private static WebhookResponse response(int status, String body) {
        return new WebhookResponse(status, body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldPassThrough2xx() throws Exception {
        WebhookResponse ok = response(204, "");

        assertThat(ResponseChecks.defaults().check(ok)).isSameAs(ok);
    }

    @Test
    void shouldTreatEveryErrorAsRetryableByDefault() {
        assertThatThrownBy(() -> ResponseChecks.defaults().check(response(400, "bad payload")))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isTrue())
                .hasMessage("unexpected status code 400: bad payload");
    }

    @Test
    void shouldOnlyRetryServerErrorsAndListedCodes() {
        ResponseChecks checks = ResponseChecks.retryOn(429);

        assertThat(checks.isRetryable(503)).isTrue();
        assertThat(checks.isRetryable(429)).isTrue();
        assertThat(checks.isRetryable(400)).isFalse();
        assertThat(checks.isRetryable(404)).isFalse();
    }

    @Test
    void shouldTruncateLongBodiesInErrorMessage() {
        String body = "x".repeat(2000);

        assertThatThrownBy(() -> ResponseChecks.defaults().check(response(500, body)))
                .satisfies(e -> assertThat(e.getMessage()).hasSizeLessThan(600).startsWith("unexpected status code 500: xxx"));
    }
}
