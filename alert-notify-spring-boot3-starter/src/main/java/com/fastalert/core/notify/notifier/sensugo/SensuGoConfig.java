package com.fastalert.core.notify.notifier.sensugo;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SensuGoConfig {

    private final String url;

    private final String entity;

    private final String check;

    private final String namespace;

    private final String handler;

    private final String apiKey;

    private final String message;

    public static SensuGoConfig parse(Settings s, DecryptFunction decrypt) {
        return SensuGoConfig.builder()
                .url(ConfigChecks.require(s.string("url"), "could not find URL property in settings"))
                .apiKey(ConfigChecks.require(decrypt.decrypt("apikey", s.string("apikey")), "could not find the API key property in settings"))
                .entity(s.string("entity"))
                .check(s.string("check"))
                .namespace(s.string("namespace"))
                .handler(s.string("handler"))
                .message(s.string("message", DefaultTemplates.MESSAGE))
                .build();
    }

    @Override
    public String toString() {
        return "SensuGoConfig{url=" + url + "}";
    }
}
