package com.fastalert.core.receiver;

import java.util.Map;

/**
 * 从接收器的 secure-settings 读取密文, 未配置时退回明文配置值
 */
public class SecureSettingsDecryptor implements DecryptFunction {

    private final Map<String, String> secureSettings;

    public SecureSettingsDecryptor(Map<String, String> secureSettings) {
        this.secureSettings = secureSettings == null ? Map.of() : Map.copyOf(secureSettings);
    }

    @Override
    public String decrypt(String key, String fallback) {
        String v = secureSettings.get(key);
        if (v == null || v.isEmpty()) {
            return fallback == null ? "" : fallback;
        }
        return v;
    }
}
