package com.fastalert.exception;

/**
 * 接收器配置不合法
 */
public class ReceiverConfigException extends RuntimeException {

    public ReceiverConfigException(String message) {
        super(message);
    }

    public ReceiverConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
