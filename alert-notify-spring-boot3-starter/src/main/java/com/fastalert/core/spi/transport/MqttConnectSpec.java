package com.fastalert.core.spi.transport;

import com.fastalert.core.receiver.TlsSettings;
import lombok.Builder;
import lombok.Getter;

/**
 * MQTT 连接参数
 */
@Getter
@Builder
public class MqttConnectSpec {

    private final String brokerUrl;

    private final String clientId;

    private final String username;

    private final String password;

    // 为空表示不启用 TLS, SNI 取 brokerUrl 的主机名
    private final TlsSettings tls;

    @Override
    public String toString() {
        return "MqttConnectSpec{brokerUrl=" + brokerUrl + ", clientId=" + clientId + "}";
    }
}
