package com.fastalert.core.receiver;

import com.fastalert.exception.ReceiverConfigException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 配置校验工具, 失败统一抛 ReceiverConfigException
 */
public final class ConfigChecks {

    private ConfigChecks() {}

    public static String require(String value, String message) {
        if (value == null || value.trim().isEmpty()) {
            throw new ReceiverConfigException(message);
        }
        return value;
    }

    /**
     * 必须是带 scheme 与 host 的绝对地址
     */
    public static URI requireUrl(String value, String field) {
        require(value, "could not find " + field + " property in settings");
        try {
            URI uri = new URI(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ReceiverConfigException("field " + field + " is not a valid URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ReceiverConfigException("field " + field + " is not a valid URL: " + e.getMessage(), e);
        }
    }
}
