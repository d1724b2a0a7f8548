package com.fastalert.core.notify.notifier.webex;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.net.URISyntaxException;

@Getter
@Builder
public class WebexConfig {

    public static final String DEFAULT_API_URL = "https://webexapis.com/v1/messages";

    private final String message;

    private final String roomId;

    private final String apiUrl;

    private final String token;

    public static WebexConfig parse(Settings s, DecryptFunction decrypt) {
        String apiUrl = s.string("api_url", DEFAULT_API_URL);
        try {
            new URI(apiUrl);
        } catch (URISyntaxException e) {
            throw new ReceiverConfigException("invalid URL \"" + apiUrl + "\"", e);
        }
        return WebexConfig.builder()
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .roomId(s.string("room_id"))
                .apiUrl(apiUrl)
                .token(decrypt.decrypt("bot_token", s.string("bot_token")))
                .build();
    }

    @Override
    public String toString() {
        return "WebexConfig{roomId=" + roomId + "}";
    }
}
