package com.fastalert.exception;

/**
 * 接收器初始化失败, 在任何 notify 调用之前抛出
 */
public class ReceiverInitException extends RuntimeException {

    private final String receiverName;

    private final String receiverType;

    private final String reason;

    public ReceiverInitException(String receiverName, String receiverType, String reason, Throwable cause) {
        super(format(receiverName, receiverType, reason, cause), cause);
        this.receiverName = receiverName;
        this.receiverType = receiverType;
        this.reason = reason;
    }

    private static String format(String name, String type, String reason, Throwable cause) {
        String msg = String.format("failed to validate receiver \"%s\" of type \"%s\": %s", name, type, reason);
        if (cause != null && cause.getMessage() != null && !cause.getMessage().equals(reason)) {
            msg += ": " + cause.getMessage();
        }
        return msg;
    }

    public String getReceiverName() {
        return receiverName;
    }

    public String getReceiverType() {
        return receiverType;
    }

    public String getReason() {
        return reason;
    }
}
