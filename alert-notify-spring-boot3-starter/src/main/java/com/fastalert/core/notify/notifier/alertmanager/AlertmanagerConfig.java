package com.fastalert.core.notify.notifier.alertmanager;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部 Alertmanager, url 为逗号分隔的多个实例地址
 */
@Getter
@Builder
public class AlertmanagerConfig {

    static final String ALERTS_PATH = "/api/v1/alerts";

    private final List<String> urls;

    private final String user;

    private final String password;

    public static AlertmanagerConfig parse(Settings s, DecryptFunction decrypt) {
        List<String> urls = new ArrayList<>();
        for (String u : s.list("url").items()) {
            String full = (u.endsWith("/") ? u.substring(0, u.length() - 1) : u) + ALERTS_PATH;
            ConfigChecks.requireUrl(full, "url");
            urls.add(full);
        }
        if (urls.isEmpty()) {
            throw new ReceiverConfigException("could not find url property in settings");
        }
        return AlertmanagerConfig.builder()
                .urls(List.copyOf(urls))
                .user(s.string("basicAuthUser"))
                .password(decrypt.decrypt("basicAuthPassword", s.string("basicAuthPassword")))
                .build();
    }

    @Override
    public String toString() {
        return "AlertmanagerConfig{urls=" + urls + "}";
    }
}
