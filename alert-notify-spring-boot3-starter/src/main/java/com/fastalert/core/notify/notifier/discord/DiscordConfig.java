package com.fastalert.core.notify.notifier.discord;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DiscordConfig {

    private final String webhookUrl;

    private final String title;

    private final String message;

    private final String avatarUrl;

    private final boolean useDiscordUsername;

    public static DiscordConfig parse(Settings s, DecryptFunction decrypt) {
        return DiscordConfig.builder()
                .webhookUrl(ConfigChecks.require(decrypt.decrypt("url", s.string("url")), "could not find webhook url property in settings"))
                .title(s.string("title", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .avatarUrl(s.string("avatar_url"))
                .useDiscordUsername(s.bool("use_discord_username"))
                .build();
    }

    @Override
    public String toString() {
        return "DiscordConfig{useDiscordUsername=" + useDiscordUsername + "}";
    }
}
