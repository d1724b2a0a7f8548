package com.fastalert.core.notify.notifier.dingding;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

/**
 * 钉钉机器人, msgType 为 link 或 actionCard
 */
@Getter
@Builder
public class DingDingConfig {

    public static final String MSG_TYPE_LINK = "link";
    public static final String MSG_TYPE_ACTION_CARD = "actionCard";

    private final String url;

    private final String messageType;

    private final String title;

    private final String message;

    public static DingDingConfig parse(Settings s, DecryptFunction decrypt) {
        return DingDingConfig.builder()
                .url(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find url property in settings"))
                .messageType(s.string("msgType", MSG_TYPE_LINK))
                .title(s.string("title", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "DingDingConfig{messageType=" + messageType + "}";
    }
}
