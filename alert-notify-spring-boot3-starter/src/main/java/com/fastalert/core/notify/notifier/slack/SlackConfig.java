package com.fastalert.core.notify.notifier.slack;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.DelimitedList;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

@Getter
@Builder
public class SlackConfig {

    public static final String API_URL = "https://slack.com/api/chat.postMessage";

    private final String url;

    private final String token;

    private final String recipient;

    private final String text;

    private final String title;

    private final String username;

    private final String iconEmoji;

    private final String iconUrl;

    private final String mentionChannel;

    private final List<String> mentionUsers;

    private final List<String> mentionGroups;

    public static SlackConfig parse(Settings s, DecryptFunction decrypt) {
        String endpoint = s.string("endpointUrl", API_URL);
        String url = decrypt.decrypt("url", s.string("url"));
        if (url.isEmpty()) {
            url = endpoint;
        }
        try {
            new URI(url);
        } catch (URISyntaxException e) {
            throw new ReceiverConfigException("invalid URL \"" + url + "\"", e);
        }

        String recipient = s.string("recipient").trim();
        if (recipient.isEmpty() && API_URL.equals(url)) {
            throw new ReceiverConfigException("recipient must be specified when using the Slack chat API");
        }
        String mentionChannel = s.string("mentionChannel");
        if (!mentionChannel.isEmpty() && !"here".equals(mentionChannel) && !"channel".equals(mentionChannel)) {
            throw new ReceiverConfigException("invalid value for mentionChannel: \"" + mentionChannel + "\"");
        }
        String token = decrypt.decrypt("token", s.string("token"));
        if (token.isEmpty() && API_URL.equals(url)) {
            throw new ReceiverConfigException("token must be specified when using the Slack chat API");
        }

        return SlackConfig.builder()
                .url(url)
                .token(token)
                .recipient(recipient)
                .text(s.string("text", DefaultTemplates.MESSAGE))
                .title(s.string("title", DefaultTemplates.TITLE))
                .username(s.string("username", "Grafana"))
                .iconEmoji(s.string("icon_emoji"))
                .iconUrl(s.string("icon_url"))
                .mentionChannel(mentionChannel)
                .mentionUsers(DelimitedList.fromJson(s.raw("mentionUsers")).items())
                .mentionGroups(DelimitedList.fromJson(s.raw("mentionGroups")).items())
                .build();
    }

    @Override
    public String toString() {
        return "SlackConfig{recipient=" + recipient + ", username=" + username + "}";
    }
}
