package com.fastalert.core.notify.notifier.teams;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class TeamsConfig {

    private final String url;

    private final String message;

    private final String title;

    private final String sectionTitle;

    public static TeamsConfig parse(Settings s, DecryptFunction decrypt) {
        return TeamsConfig.builder()
                .url(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find url property in settings"))
                .message(s.string("message", DefaultTemplates.TEAMS_MESSAGE))
                .title(s.string("title", DefaultTemplates.TITLE))
                .sectionTitle(s.string("sectiontitle"))
                .build();
    }

    @Override
    public String toString() {
        return "TeamsConfig{title=" + title + "}";
    }
}
