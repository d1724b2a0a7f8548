package com.fastalert.core.notify.notifier.line;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class LineConfig {

    private final String token;

    private final String title;

    private final String description;

    public static LineConfig parse(Settings s, DecryptFunction decrypt) {
        return LineConfig.builder()
                .token(ConfigChecks.require(decrypt.decrypt("token", s.string("token")), "could not find token in settings"))
                .title(s.string("title", DefaultTemplates.TITLE))
                .description(s.string("description", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "LineConfig{title=" + title + "}";
    }
}
