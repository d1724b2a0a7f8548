package com.fastalert.core.spi.transport;

import java.io.IOException;

/**
 * 每次通知建立并释放一次连接
 */
public interface MqttClient {

    void connect(MqttConnectSpec spec) throws IOException;

    void publish(String topic, byte[] payload, int qos, boolean retain) throws IOException;

    void disconnect() throws IOException;
}
