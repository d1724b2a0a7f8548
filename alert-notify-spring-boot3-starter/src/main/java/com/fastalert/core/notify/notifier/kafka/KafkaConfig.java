package com.fastalert.core.notify.notifier.kafka;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

/**
 * Kafka REST Proxy 配置, apiVersion 只能是 v2 或 v3
 */
@Getter
@Builder
public class KafkaConfig {

    public static final String API_V2 = "v2";
    public static final String API_V3 = "v3";

    private final String endpoint;

    private final String topic;

    private final String description;

    private final String details;

    private final String username;

    private final String password;

    // 凭据轮换时从该文件重新读取密码
    private final String passwordFilePath;

    private final String apiVersion;

    private final String clusterId;

    public static KafkaConfig parse(Settings s, DecryptFunction decrypt) {
        String endpoint = ConfigChecks.require(s.string("kafkaRestProxy"),
                "could not find kafka rest proxy endpoint property in settings");
        endpoint = stripTrailingSlashes(endpoint);
        String topic = ConfigChecks.require(s.string("kafkaTopic"), "could not find kafka topic property in settings");

        String apiVersion = s.string("apiVersion", API_V2);
        String clusterId = s.string("kafkaClusterId");
        if (API_V3.equals(apiVersion)) {
            ConfigChecks.require(clusterId, "kafka cluster id must be provided when using api version 3");
        } else if (!API_V2.equals(apiVersion)) {
            throw new ReceiverConfigException("unsupported api version: " + apiVersion);
        }

        String username = s.string("username");
        String passwordFilePath = s.string("passwordFilePath");
        if (!passwordFilePath.isEmpty() && username.isEmpty()) {
            throw new ReceiverConfigException("if a password file path is set, username must be provided");
        }

        return KafkaConfig.builder()
                .endpoint(endpoint)
                .topic(topic)
                .description(s.string("description", DefaultTemplates.TITLE))
                .details(s.string("details", DefaultTemplates.KAFKA_DETAILS))
                .username(username)
                .password(decrypt.decrypt("password", s.string("password")))
                .passwordFilePath(passwordFilePath)
                .apiVersion(apiVersion)
                .clusterId(clusterId)
                .build();
    }

    static String stripTrailingSlashes(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') {
            end--;
        }
        return s.substring(0, end);
    }

    public boolean isBasicAuth() {
        return !username.isEmpty();
    }

    /**
     * 只有能从文件刷新密码时, 失败后才值得重试
     */
    public boolean canRefreshPassword() {
        return isBasicAuth() && !passwordFilePath.isEmpty();
    }

    public boolean isV3() {
        return API_V3.equals(apiVersion);
    }

    @Override
    public String toString() {
        return "KafkaConfig{endpoint=" + endpoint + ", topic=" + topic + ", apiVersion=" + apiVersion + "}";
    }
}
