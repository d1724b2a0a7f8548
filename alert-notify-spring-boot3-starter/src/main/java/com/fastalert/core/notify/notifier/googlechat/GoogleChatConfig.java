package com.fastalert.core.notify.notifier.googlechat;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class GoogleChatConfig {

    private final String url;

    private final String title;

    private final String message;

    public static GoogleChatConfig parse(Settings s, DecryptFunction decrypt) {
        return GoogleChatConfig.builder()
                .url(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find url property in settings"))
                .title(s.string("title", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "GoogleChatConfig{}";
    }
}
