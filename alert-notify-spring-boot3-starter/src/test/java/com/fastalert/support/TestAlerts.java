package com.fastalert.support;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TestAlerts {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final String EXTERNAL_URL = "http://grafana.local/";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestAlerts() {}

    /**
     * labels 为 k1, v1, k2, v2 ...
     */
    public static Alert firing(String... labels) {
        return Alert.builder()
                .labels(pairs(labels))
                .startsAt(NOW.minus(Duration.ofMinutes(5)))
                .generatorURL("http://grafana.local/alerting/grafana/rule-1/view")
                .build();
    }

    public static Alert resolved(String... labels) {
        return firing(labels).toBuilder().endsAt(NOW.minus(Duration.ofMinutes(1))).build();
    }

    public static NotifyContext ctx(String... groupLabels) {
        return NotifyContext.forGroupLabels(pairs(groupLabels), "test-receiver");
    }

    public static ReceiverMetadata meta(String type) {
        return meta(type, false);
    }

    public static ReceiverMetadata meta(String type, boolean disableResolveMessage) {
        return ReceiverMetadata.builder()
                .uid("uid-" + type)
                .name(type + "-receiver")
                .type(type)
                .disableResolveMessage(disableResolveMessage)
                .build();
    }

    public static NotifierDependencies deps(Transport transport) {
        return NotifierDependencies.of(transport, EXTERNAL_URL).toBuilder().clock(CLOCK).build();
    }

    public static Settings settings(String json) {
        return Settings.of(json(json));
    }

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Map<String, String> pairs(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(kv[i], kv[i + 1]);
        }
        return m;
    }
}
