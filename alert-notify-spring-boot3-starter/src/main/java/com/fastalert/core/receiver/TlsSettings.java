package com.fastalert.core.receiver;

import lombok.Builder;
import lombok.Getter;

/**
 * TLS 配置, 证书与私钥为 PEM 文本
 */
@Getter
@Builder
public final class TlsSettings {

    private final boolean insecureSkipVerify;

    private final String caCertificate;

    private final String clientCertificate;

    private final String clientKey;

    public static TlsSettings parse(Settings s, DecryptFunction decrypt) {
        return TlsSettings.builder()
                .insecureSkipVerify(s.bool("insecureSkipVerify"))
                .caCertificate(decrypt.decrypt("tlsConfig.caCertificate", s.string("caCertificate")))
                .clientCertificate(decrypt.decrypt("tlsConfig.clientCertificate", s.string("clientCertificate")))
                .clientKey(decrypt.decrypt("tlsConfig.clientKey", s.string("clientKey")))
                .build();
    }

    public boolean hasClientCertificate() {
        return !clientCertificate.isEmpty() && !clientKey.isEmpty();
    }

    @Override
    public String toString() {
        return "TlsSettings{insecureSkipVerify=" + insecureSkipVerify + "}";
    }
}
