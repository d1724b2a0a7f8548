package com.fastalert.core.notify.notifier.dooray;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DoorayConfig {

    private final String url;

    private final String title;

    private final String iconUrl;

    private final String description;

    public static DoorayConfig parse(Settings s, DecryptFunction decrypt) {
        return DoorayConfig.builder()
                .url(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find url in settings"))
                .title(s.string("title", DefaultTemplates.TITLE))
                .iconUrl(s.string("icon_url"))
                .description(s.string("description", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "DoorayConfig{title=" + title + "}";
    }
}
