package com.fastalert.core.notify.notifier.pagerduty;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PagerDutyNotifierTest {

    private static final String SETTINGS = "{\"integrationKey\": \"routing\", \"severity\": \"{{ commonLabels['severity'] }}\", \"source\": \"grafana-test\"}";

    private final RecordingTransport transport = new RecordingTransport();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Latency");

    private PagerDutyNotifier notifier(String settings) {
        PagerDutyConfig conf = PagerDutyConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new PagerDutyNotifier(TestAlerts.meta(PagerDutyNotifier.TYPE), conf, TestAlerts.deps(transport));
    }

    @Test
    void shouldTriggerEventWithGroupHashAsDedupKey() throws Exception {
        notifier(SETTINGS).notify(ctx, List.of(TestAlerts.firing("alertname", "Latency", "severity", "Warning")));

        assertThat(transport.request(0).getUrl()).isEqualTo(PagerDutyNotifier.API_URL);
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("event_action").asText()).isEqualTo("trigger");
        assertThat(body.path("routing_key").asText()).isEqualTo("routing");
        assertThat(body.path("dedup_key").asText()).isEqualTo(ctx.getGroupKey().hash());
        assertThat(body.path("payload").path("severity").asText()).isEqualTo("warning");
        assertThat(body.path("payload").path("source").asText()).isEqualTo("grafana-test");
    }

    @Test
    void shouldFallBackToCriticalForUnknownSeverity() throws Exception {
        notifier(SETTINGS).notify(ctx, List.of(TestAlerts.firing("alertname", "Latency", "severity", "sev1")));

        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("payload").path("severity").asText()).isEqualTo("critical");
    }

    @Test
    void shouldResolveEvent() throws Exception {
        notifier(SETTINGS).notify(ctx, List.of(TestAlerts.resolved("alertname", "Latency", "severity", "info")));

        assertThat(TestAlerts.json(transport.request(0).bodyAsString()).path("event_action").asText()).isEqualTo("resolve");
    }

    @Test
    void shouldRequireIntegrationKey() {
        assertThatThrownBy(() -> notifier("{}")).isInstanceOf(ReceiverConfigException.class);
    }
}
