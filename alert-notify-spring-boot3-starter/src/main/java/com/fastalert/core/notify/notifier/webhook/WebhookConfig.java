package com.fastalert.core.notify.notifier.webhook;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.FlexibleNumber;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;

@Getter
@Builder
public class WebhookConfig {

    private final String url;

    private final String httpMethod;

    // 0 表示不限制
    private final int maxAlerts;

    private final String authorizationScheme;

    private final String authorizationCredentials;

    private final String user;

    private final String password;

    private final String title;

    private final String message;

    public static WebhookConfig parse(Settings s, DecryptFunction decrypt) {
        String url = ConfigChecks.require(s.string("url"), "required field 'url' is not specified");

        FlexibleNumber rawMax = s.number("maxAlerts");
        int maxAlerts;
        try {
            maxAlerts = (int) rawMax.asInt64(0);
        } catch (NumberFormatException e) {
            throw new ReceiverConfigException("failed to parse maxAlerts: " + rawMax.raw(), e);
        }

        String user = decrypt.decrypt("username", s.string("username"));
        String password = decrypt.decrypt("password", s.string("password"));
        String credentials = decrypt.decrypt("authorization_credentials", s.string("authorization_credentials"));
        String scheme = s.string("authorization_scheme");
        if (!credentials.isEmpty() && scheme.isEmpty()) {
            scheme = "Bearer";
        }
        if (!user.isEmpty() && !password.isEmpty() && !scheme.isEmpty() && !credentials.isEmpty()) {
            throw new ReceiverConfigException("both HTTP Basic Authentication and Authorization Header are set, only 1 is permitted");
        }

        return WebhookConfig.builder()
                .url(url)
                .httpMethod(s.string("httpMethod", "POST").toUpperCase(Locale.ROOT))
                .maxAlerts(maxAlerts)
                .authorizationScheme(scheme)
                .authorizationCredentials(credentials)
                .user(user)
                .password(password)
                .title(s.string("title", DefaultTemplates.TITLE))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .build();
    }

    public boolean hasAuthorizationHeader() {
        return !authorizationScheme.isEmpty() && !authorizationCredentials.isEmpty();
    }

    @Override
    public String toString() {
        return "WebhookConfig{httpMethod=" + httpMethod + ", maxAlerts=" + maxAlerts + "}";
    }
}
