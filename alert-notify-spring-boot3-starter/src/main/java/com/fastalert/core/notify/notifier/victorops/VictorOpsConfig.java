package com.fastalert.core.notify.notifier.victorops;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class VictorOpsConfig {

    public static final String DEFAULT_MESSAGE_TYPE = "CRITICAL";

    private final String url;

    private final String messageType;

    private final String title;

    private final String description;

    public static VictorOpsConfig parse(Settings s, DecryptFunction decrypt) {
        return VictorOpsConfig.builder()
                .url(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find victorops url property in settings"))
                .messageType(s.string("messageType", DEFAULT_MESSAGE_TYPE))
                .title(s.string("title", DefaultTemplates.TITLE))
                .description(s.string("description", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "VictorOpsConfig{messageType=" + messageType + "}";
    }
}
