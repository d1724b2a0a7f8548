package com.fastalert.core.spi.transport;

import software.amazon.awssdk.services.sns.SnsClient;

/**
 * 每次通知创建一个客户端, 用后关闭
 */
@FunctionalInterface
public interface SnsClientFactory {

    SnsClient newClient(SnsConnectSpec spec);
}
