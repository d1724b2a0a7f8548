package com.fastalert.core.receiver;

/**
 * 密文解析, 找不到时返回 fallback
 */
@FunctionalInterface
public interface DecryptFunction {

    String decrypt(String key, String fallback);

    static DecryptFunction plain() {
        return (key, fallback) -> fallback;
    }
}
