package com.fastalert.core.transport;

import com.fastalert.core.spi.transport.MqttClient;
import com.fastalert.core.spi.transport.MqttClientFactory;

import java.time.Duration;

/**
 * 基于 Eclipse Paho 的 MQTT 客户端工厂
 */
public class PahoMqttClientFactory implements MqttClientFactory {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration connectTimeout;

    public PahoMqttClientFactory() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public PahoMqttClientFactory(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public MqttClient newClient() {
        return new PahoMqttClient(connectTimeout);
    }
}
