package com.fastalert.core.notify;

import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.core.template.Truncations;
import com.fastalert.exception.NotifyException;

import java.util.HashSet;
import java.util.Set;

/**
 * HTTP 状态码判定
 * 默认所有非 2xx 均可重试; retryOn 模式下只有 5xx 与指定状态码可重试, 其余 4xx 视为永久拒绝
 */
public final class ResponseChecks {

    private static final int MAX_BODY_IN_ERROR = 512;

    private static final ResponseChecks DEFAULTS = new ResponseChecks(true, Set.of());

    private final boolean allRetryable;

    private final Set<Integer> retryCodes;

    private ResponseChecks(boolean allRetryable, Set<Integer> retryCodes) {
        this.allRetryable = allRetryable;
        this.retryCodes = retryCodes;
    }

    public static ResponseChecks defaults() {
        return DEFAULTS;
    }

    public static ResponseChecks retryOn(int... codes) {
        Set<Integer> set = new HashSet<>();
        for (int c : codes) {
            set.add(c);
        }
        return new ResponseChecks(false, set);
    }

    public boolean isRetryable(int status) {
        return allRetryable || status >= 500 || retryCodes.contains(status);
    }

    public WebhookResponse check(WebhookResponse response) throws NotifyException {
        if (response.is2xx()) {
            return response;
        }
        String body = Truncations.inRunes(response.bodyAsString(), MAX_BODY_IN_ERROR).value();
        throw new NotifyException(String.format("unexpected status code %d: %s", response.status(), body),
                isRetryable(response.status()));
    }
}
