package com.fastalert.core.spi.transport;

import lombok.Builder;
import lombok.Getter;

/**
 * SNS 客户端参数, 字符串字段缺省为空串
 */
@Getter
@Builder
public class SnsConnectSpec {

    private final String endpoint;

    private final String region;

    private final AwsAuthType authType;

    private final String accessKey;

    private final String secretKey;

    private final String sessionToken;

    private final String profile;

    // 非空时在基础凭据之上扮演该角色
    private final String roleArn;

    private final String externalId;

    // 覆盖 STS 地址
    private final String stsEndpoint;

    @Override
    public String toString() {
        return "SnsConnectSpec{endpoint=" + endpoint + ", region=" + region + ", authType=" + authType + "}";
    }
}
