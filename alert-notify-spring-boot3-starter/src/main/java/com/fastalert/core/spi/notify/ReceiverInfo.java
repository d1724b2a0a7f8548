package com.fastalert.core.spi.notify;

/**
 * 接收器元信息访问接口
 */
public interface ReceiverInfo {

    String name();

    String type();

    boolean disableResolve();
}
