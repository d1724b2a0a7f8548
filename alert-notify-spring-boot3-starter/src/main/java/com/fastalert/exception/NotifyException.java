package com.fastalert.exception;

/**
 * 投递失败, 携带是否可重试
 */
public class NotifyException extends Exception {

    private final boolean retryable;

    public NotifyException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public NotifyException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static NotifyException retryable(String message) {
        return new NotifyException(message, true);
    }

    public static NotifyException retryable(String message, Throwable cause) {
        return new NotifyException(message, true, cause);
    }

    public static NotifyException permanent(String message) {
        return new NotifyException(message, false);
    }

    public static NotifyException permanent(String message, Throwable cause) {
        return new NotifyException(message, false, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
