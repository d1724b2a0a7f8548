package com.fastalert.core.notify;

/**
 * 一次通知的结果, 成功时 error 为空
 */
public final class NotifyResult {

    private static final NotifyResult SUCCESS = new NotifyResult(false, null);

    private final boolean retryable;

    private final Throwable error;

    private NotifyResult(boolean retryable, Throwable error) {
        this.retryable = retryable;
        this.error = error;
    }

    public static NotifyResult success() {
        return SUCCESS;
    }

    public static NotifyResult failure(boolean retryable, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("failure requires an error");
        }
        return new NotifyResult(retryable, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "NotifyResult{success}" : "NotifyResult{retryable=" + retryable + ", error=" + error.getMessage() + "}";
    }
}
