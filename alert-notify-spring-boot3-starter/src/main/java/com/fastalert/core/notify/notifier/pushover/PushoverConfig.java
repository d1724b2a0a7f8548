package com.fastalert.core.notify.notifier.pushover;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.FlexibleNumber;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

/**
 * Pushover 配置, retry 与 expire 解析失败时按 0 处理
 */
@Getter
@Builder
public class PushoverConfig {

    private final String userKey;

    private final String apiToken;

    private final long alertingPriority;

    private final long okPriority;

    private final long retry;

    private final long expire;

    private final String device;

    private final String alertingSound;

    private final String okSound;

    private final boolean upload;

    private final String title;

    private final String message;

    public static PushoverConfig parse(Settings s, DecryptFunction decrypt) {
        return PushoverConfig.builder()
                .userKey(ConfigChecks.require(decrypt.decrypt("userKey", s.string("userKey")), "user key not found"))
                .apiToken(ConfigChecks.require(decrypt.decrypt("apiToken", s.string("apiToken")), "API token not found"))
                .alertingPriority(priority(s.number("priority"), "alerting"))
                .okPriority(priority(s.number("okPriority"), "OK"))
                .retry(lenient(s.number("retry")))
                .expire(lenient(s.number("expire")))
                .device(s.string("device"))
                .alertingSound(s.string("sound"))
                .okSound(s.string("okSound"))
                .upload(s.bool("uploadImage", true))
                .title(s.string("title", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .build();
    }

    private static long priority(FlexibleNumber raw, String which) {
        try {
            return raw.asInt64(0);
        } catch (NumberFormatException e) {
            throw new ReceiverConfigException("failed to convert " + which + " priority to integer: " + raw.raw(), e);
        }
    }

    private static long lenient(FlexibleNumber raw) {
        try {
            return raw.asInt64(0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return "PushoverConfig{alertingPriority=" + alertingPriority + ", okPriority=" + okPriority + "}";
    }
}
