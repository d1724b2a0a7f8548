package com.fastalert.core.spi.transport;

@FunctionalInterface
public interface MqttClientFactory {

    MqttClient newClient();
}
