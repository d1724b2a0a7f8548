package com.fastalert.core.notify.notifier.sns;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.spi.transport.AwsAuthType;
import com.fastalert.core.spi.transport.SnsConnectSpec;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * AWS SNS 配置, topicArn / targetArn / phoneNumber 至少填一个
 */
@Getter
@Builder
public class SnsConfig {

    private final String apiUrl;

    private final String topicArn;

    private final String targetArn;

    private final String phoneNumber;

    private final String subject;

    private final String message;

    private final Map<String, String> attributes;

    private final SnsConnectSpec connect;

    public static SnsConfig parse(Settings s, DecryptFunction decrypt) {
        String topicArn = s.string("topic_arn");
        String targetArn = s.string("target_arn");
        String phoneNumber = s.string("phone_number");
        if (!topicArn.isEmpty() && !isArn(topicArn)) {
            throw new ReceiverConfigException("invalid topic ARN provided");
        }
        if (!targetArn.isEmpty() && !isArn(targetArn)) {
            throw new ReceiverConfigException("invalid target ARN provided");
        }
        if (topicArn.isEmpty() && targetArn.isEmpty() && phoneNumber.isEmpty()) {
            throw new ReceiverConfigException("must specify topicArn, targetArn, or phone number");
        }

        Settings sigv4 = s.child("sigv4");
        String region = sigv4.string("region");
        String accessKey = decrypt.decrypt("sigv4.access_key", sigv4.string("access_key"));
        String secretKey = decrypt.decrypt("sigv4.secret_key", sigv4.string("secret_key"));
        String profile = sigv4.string("profile");
        AwsAuthType authType = authType(sigv4.string("authType"), profile, accessKey, secretKey);
        String roleArn = sigv4.string("role_arn");
        if (authType == AwsAuthType.ASSUME_ROLE && roleArn.isEmpty()) {
            throw new ReceiverConfigException("role ARN must be provided for auth type " + authType.value());
        }

        String apiUrl = s.string("api_url", "https://sns." + region + ".amazonaws.com");
        return SnsConfig.builder()
                .apiUrl(apiUrl)
                .topicArn(topicArn)
                .targetArn(targetArn)
                .phoneNumber(phoneNumber)
                .subject(s.string("subject", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .attributes(s.stringMap("attributes"))
                .connect(SnsConnectSpec.builder()
                        .endpoint(apiUrl)
                        .region(region)
                        .authType(authType)
                        .accessKey(accessKey)
                        .secretKey(secretKey)
                        .sessionToken(decrypt.decrypt("sigv4.session_token", sigv4.string("session_token")))
                        .profile(profile)
                        .roleArn(roleArn)
                        .externalId(sigv4.string("externalId"))
                        .stsEndpoint(sigv4.string("endpoint"))
                        .build())
                .build();
    }

    /**
     * 未显式指定时, profile 优先于访问密钥, 两者都没有则走默认凭据链
     */
    static AwsAuthType authType(String explicit, String profile, String accessKey, String secretKey) {
        AwsAuthType type;
        if (!explicit.isEmpty()) {
            type = AwsAuthType.of(explicit);
        } else if (!profile.isEmpty()) {
            type = AwsAuthType.SHARED_CREDENTIALS;
        } else if (!accessKey.isEmpty() || !secretKey.isEmpty()) {
            type = AwsAuthType.KEYS;
        } else {
            type = AwsAuthType.DEFAULT;
        }
        if (type == AwsAuthType.KEYS && (accessKey.isEmpty() || secretKey.isEmpty())) {
            throw new ReceiverConfigException("must specify both access key and secret key");
        }
        return type;
    }

    // arn:partition:service:region:account-id:resource
    static boolean isArn(String s) {
        return s.startsWith("arn:") && s.split(":", 6).length == 6;
    }

    @Override
    public String toString() {
        return "SnsConfig{apiUrl=" + apiUrl + ", topicArn=" + topicArn + ", targetArn=" + targetArn + "}";
    }
}
