package com.fastalert.core.transport;

import com.fastalert.core.spi.transport.SnsClientFactory;
import com.fastalert.core.spi.transport.SnsConnectSpec;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.InstanceProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.SnsClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

import java.net.URI;

/**
 * 基于 AWS SDK v2 的 SNS 客户端工厂
 */
@Slf4j
public class AwsSnsClientFactory implements SnsClientFactory {

    static final String SESSION_NAME = "alert-notify-sns";

    @Override
    public SnsClient newClient(SnsConnectSpec spec) {
        log.debug("[Notify-sns] creating client {}", spec);
        AwsCredentialsProvider credentials = credentials(spec);
        SnsClientBuilder builder = SnsClient.builder().credentialsProvider(credentials);
        if (!spec.getRegion().isEmpty()) {
            builder.region(Region.of(spec.getRegion()));
        }
        if (!spec.getEndpoint().isEmpty()) {
            builder.endpointOverride(URI.create(spec.getEndpoint()));
        }
        return builder.build();
    }

    static AwsCredentialsProvider credentials(SnsConnectSpec spec) {
        AwsCredentialsProvider base = baseCredentials(spec);
        if (spec.getRoleArn().isEmpty()) {
            return base;
        }
        StsClientBuilder sts = StsClient.builder().credentialsProvider(base);
        if (!spec.getRegion().isEmpty()) {
            sts.region(Region.of(spec.getRegion()));
        }
        if (!spec.getStsEndpoint().isEmpty()) {
            sts.endpointOverride(URI.create(spec.getStsEndpoint()));
        }
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(sts.build())
                .refreshRequest(req -> {
                    req.roleArn(spec.getRoleArn()).roleSessionName(SESSION_NAME);
                    if (!spec.getExternalId().isEmpty()) {
                        req.externalId(spec.getExternalId());
                    }
                })
                .build();
    }

    private static AwsCredentialsProvider baseCredentials(SnsConnectSpec spec) {
        switch (spec.getAuthType()) {
            case KEYS:
                if (!spec.getSessionToken().isEmpty()) {
                    return StaticCredentialsProvider.create(
                            AwsSessionCredentials.create(spec.getAccessKey(), spec.getSecretKey(), spec.getSessionToken()));
                }
                return StaticCredentialsProvider.create(AwsBasicCredentials.create(spec.getAccessKey(), spec.getSecretKey()));
            case SHARED_CREDENTIALS:
                return spec.getProfile().isEmpty()
                        ? ProfileCredentialsProvider.create()
                        : ProfileCredentialsProvider.create(spec.getProfile());
            case EC2_IAM_ROLE:
                return InstanceProfileCredentialsProvider.create();
            default:
                return DefaultCredentialsProvider.create();
        }
    }
}
