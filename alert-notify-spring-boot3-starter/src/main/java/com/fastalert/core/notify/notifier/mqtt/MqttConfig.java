package com.fastalert.core.notify.notifier.mqtt;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.FlexibleNumber;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.receiver.TlsSettings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.ThreadLocalRandom;

@Getter
@Builder
public class MqttConfig {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_TEXT = "text";

    private final String brokerUrl;

    private final String clientId;

    private final String topic;

    private final String message;

    private final String messageFormat;

    private final String username;

    private final String password;

    private final int qos;

    private final boolean retain;

    // 为空表示不使用 TLS
    private final TlsSettings tls;

    public static MqttConfig parse(Settings s, DecryptFunction decrypt) {
        String brokerUrl = ConfigChecks.require(s.string("brokerUrl"), "MQTT broker URL must be specified");
        validateBrokerUrl(brokerUrl);
        String topic = ConfigChecks.require(s.string("topic"), "MQTT topic must be specified");

        String format = s.string("messageFormat", FORMAT_JSON);
        if (!FORMAT_JSON.equals(format) && !FORMAT_TEXT.equals(format)) {
            throw new ReceiverConfigException("Invalid message format, must be 'json' or 'text'");
        }

        FlexibleNumber rawQos = s.number("qos");
        long qos;
        try {
            qos = rawQos.asInt64(0);
        } catch (NumberFormatException e) {
            throw new ReceiverConfigException("Failed to parse QoS: " + rawQos.raw(), e);
        }
        if (qos < 0 || qos > 2) {
            throw new ReceiverConfigException("Invalid QoS level: " + qos + ". Must be 0, 1 or 2");
        }

        TlsSettings tls = s.has("tlsConfig") ? TlsSettings.parse(s.child("tlsConfig"), decrypt) : null;

        return MqttConfig.builder()
                .brokerUrl(brokerUrl)
                .clientId(s.string("clientId", "grafana_" + ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE)))
                .topic(topic)
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .messageFormat(format)
                .username(s.string("username"))
                .password(decrypt.decrypt("password", s.string("password")))
                .qos((int) qos)
                .retain(s.bool("retain"))
                .tls(tls)
                .build();
    }

    /**
     * scheme 只能是 tcp 或 ssl, 必须显式指定 1-65535 的端口
     */
    static void validateBrokerUrl(String raw) {
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw new ReceiverConfigException("Invalid MQTT broker URL: " + e.getMessage(), e);
        }
        if (!"tcp".equals(uri.getScheme()) && !"ssl".equals(uri.getScheme())) {
            throw new ReceiverConfigException("Invalid MQTT broker URL: Invalid scheme, must be 'tcp' or 'ssl'");
        }
        String authority = uri.getRawAuthority();
        if (authority == null || !authority.contains(":")) {
            throw new ReceiverConfigException("Invalid MQTT broker URL: Port must be specified");
        }
        String port = authority.substring(authority.lastIndexOf(':') + 1);
        long portNum;
        try {
            portNum = Long.parseLong(port);
        } catch (NumberFormatException e) {
            portNum = -1;
        }
        if (portNum < 1 || portNum > 65535) {
            throw new ReceiverConfigException("Invalid MQTT broker URL: Port must be a valid number between 1 and 65535");
        }
    }

    public boolean isJson() {
        return FORMAT_JSON.equals(messageFormat);
    }

    @Override
    public String toString() {
        return "MqttConfig{brokerUrl=" + brokerUrl + ", topic=" + topic + ", qos=" + qos + ", retain=" + retain + "}";
    }
}
