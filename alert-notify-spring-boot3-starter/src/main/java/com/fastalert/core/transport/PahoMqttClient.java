package com.fastalert.core.transport;

import com.fastalert.core.spi.transport.MqttClient;
import com.fastalert.core.spi.transport.MqttConnectSpec;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.io.IOException;
import java.time.Duration;

/**
 * 单次使用的 Paho 客户端, 不持久化会话
 */
@Slf4j
class PahoMqttClient implements MqttClient {

    private final Duration connectTimeout;

    private org.eclipse.paho.client.mqttv3.MqttClient client;

    PahoMqttClient(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void connect(MqttConnectSpec spec) throws IOException {
        if (client != null) {
            throw new IllegalStateException("already connected");
        }
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setConnectionTimeout((int) connectTimeout.getSeconds());
        if (spec.getUsername() != null && !spec.getUsername().isEmpty()) {
            options.setUserName(spec.getUsername());
        }
        if (spec.getPassword() != null && !spec.getPassword().isEmpty()) {
            options.setPassword(spec.getPassword().toCharArray());
        }

        String brokerUrl = spec.getBrokerUrl();
        if (spec.getTls() != null) {
            // Paho 只对 ssl:// 使用自定义 SocketFactory
            if (brokerUrl.startsWith("tcp://")) {
                brokerUrl = "ssl://" + brokerUrl.substring("tcp://".length());
            }
            options.setSocketFactory(TlsContexts.socketFactory(spec.getTls()));
            options.setHttpsHostnameVerificationEnabled(!spec.getTls().isInsecureSkipVerify());
        }

        try {
            org.eclipse.paho.client.mqttv3.MqttClient c =
                    new org.eclipse.paho.client.mqttv3.MqttClient(brokerUrl, spec.getClientId(), new MemoryPersistence());
            c.connect(options);
            client = c;
            log.debug("[Mqtt] connected broker={} clientId={}", brokerUrl, spec.getClientId());
        } catch (MqttException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retain) throws IOException {
        if (client == null) {
            throw new IllegalStateException("not connected");
        }
        try {
            client.publish(topic, payload, qos, retain);
        } catch (MqttException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void disconnect() throws IOException {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
        } catch (MqttException e) {
            throw new IOException(e.getMessage(), e);
        } finally {
            client = null;
        }
    }
}
