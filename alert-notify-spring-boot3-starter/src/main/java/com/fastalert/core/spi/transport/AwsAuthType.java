package com.fastalert.core.spi.transport;

import com.fastalert.exception.ReceiverConfigException;

/**
 * AWS 凭据来源
 */
public enum AwsAuthType {

    DEFAULT("default"),
    SHARED_CREDENTIALS("shared_credentials"),
    KEYS("keys"),
    EC2_IAM_ROLE("ec2-iam-role"),
    // 默认凭据链 + roleArn 扮演角色
    ASSUME_ROLE("grafana-assume-role");

    private final String value;

    AwsAuthType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AwsAuthType of(String value) {
        for (AwsAuthType t : values()) {
            if (t.value.equals(value)) {
                return t;
            }
        }
        throw new ReceiverConfigException("unsupported auth type, supported: \"default\",\"shared_credentials\",\"keys\",\"ec2-iam-role\",\"grafana-assume-role\"");
    }
}
