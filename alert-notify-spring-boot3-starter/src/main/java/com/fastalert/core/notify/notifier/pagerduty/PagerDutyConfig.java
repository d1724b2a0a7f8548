package com.fastalert.core.notify.notifier.pagerduty;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import lombok.Builder;
import lombok.Getter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
public class PagerDutyConfig {

    public static final String DEFAULT_SEVERITY = "critical";
    public static final String DEFAULT_CLASS = "default";
    public static final String DEFAULT_GROUP = "default";
    public static final String DEFAULT_CLIENT = "Grafana";

    static final Map<String, String> CUSTOM_DETAILS = new LinkedHashMap<>();

    static {
        CUSTOM_DETAILS.put("firing", "{{ alerts.firing.describe() }}");
        CUSTOM_DETAILS.put("resolved", "{{ alerts.resolved.describe() }}");
        CUSTOM_DETAILS.put("num_firing", "{{ alerts.firing.size() }}");
        CUSTOM_DETAILS.put("num_resolved", "{{ alerts.resolved.size() }}");
    }

    private final String key;

    private final String severity;

    private final String clazz;

    private final String component;

    private final String group;

    private final String summary;

    private final String source;

    private final String client;

    private final String clientUrl;

    public static PagerDutyConfig parse(Settings s, DecryptFunction decrypt) {
        String key = ConfigChecks.require(decrypt.decrypt("integrationKey", s.string("integrationKey")),
                "could not find integration key property in settings");
        String client = s.string("client", DEFAULT_CLIENT);
        return PagerDutyConfig.builder()
                .key(key)
                .severity(s.string("severity", DEFAULT_SEVERITY))
                .clazz(s.string("class", DEFAULT_CLASS))
                .component(s.string("component", "Grafana"))
                .group(s.string("group", DEFAULT_GROUP))
                .summary(s.string("summary", DefaultTemplates.TITLE))
                .client(client)
                .clientUrl(s.string("client_url", "{{ externalURL }}"))
                .source(s.string("source", localHostName(client)))
                .build();
    }

    private static String localHostName(String fallback) {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "PagerDutyConfig{severity=" + severity + ", source=" + source + "}";
    }
}
