package com.fastalert.core.notify.notifier.kafka;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaNotifierTest {

    private final RecordingTransport transport = new RecordingTransport();

    private final AtomicInteger passwordReads = new AtomicInteger();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "QueueLag");

    private KafkaNotifier notifier(String settings) {
        KafkaConfig conf = KafkaConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new KafkaNotifier(TestAlerts.meta(KafkaNotifier.TYPE), conf, TestAlerts.deps(transport).toBuilder()
                .passwordSource(location -> "rotated-" + passwordReads.incrementAndGet())
                .build());
    }

    @Test
    void shouldPublishRecordThroughV2Api() throws Exception {
        notifier("{\"kafkaRestProxy\": \"http://kafka-rest:8082/\", \"kafkaTopic\": \"alerts\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag")));

        assertThat(transport.requests()).hasSize(1);
        assertThat(transport.request(0).getUrl()).isEqualTo("http://kafka-rest:8082/topics/alerts");
        assertThat(transport.request(0).getHeaders()).containsEntry("Content-Type", "application/vnd.kafka.json.v2+json");

        JsonNode value = TestAlerts.json(transport.request(0).bodyAsString()).path("records").get(0).path("value");
        assertThat(value.path("alert_state").asText()).isEqualTo("alerting");
        assertThat(value.path("incident_key").asText()).isEqualTo(ctx.getGroupKey().hash());
        assertThat(value.path("client").asText()).isEqualTo("Grafana");
    }

    @Test
    void shouldPublishThroughV3ApiAndCheckErrorCode() throws Exception {
        String settings = "{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\","
                + " \"apiVersion\": \"v3\", \"kafkaClusterId\": \"lkc-1\"}";
        transport.respond(200, "{\"error_code\": 200, \"topic_name\": \"alerts\"}");

        notifier(settings).notify(ctx, List.of(TestAlerts.resolved("alertname", "QueueLag")));

        assertThat(transport.request(0).getUrl()).isEqualTo("http://kafka-rest:8082/v3/clusters/lkc-1/topics/alerts/records");
        JsonNode value = TestAlerts.json(transport.request(0).bodyAsString()).path("value");
        assertThat(value.path("type").asText()).isEqualTo("JSON");
        assertThat(value.path("data").path("alert_state").asText()).isEqualTo("ok");
    }

    @Test
    void shouldFailWhenV3ErrorCodeIsNotSuccess() {
        String settings = "{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\","
                + " \"apiVersion\": \"v3\", \"kafkaClusterId\": \"lkc-1\"}";
        transport.respond(200, "{\"error_code\": 40403, \"message\": \"topic not found\"}");

        assertThatThrownBy(() -> notifier(settings).notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag"))))
                .isInstanceOf(NotifyException.class)
                .hasMessageContaining("topic not found");
    }

    @Test
    void shouldRefreshPasswordOnceAndRetry() throws Exception {
        String settings = "{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\","
                + " \"username\": \"svc\", \"password\": \"initial\", \"passwordFilePath\": \"/run/secrets/kafka\"}";
        transport.respond(401, "unauthorized").respond(200, "");

        notifier(settings).notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag")));

        assertThat(transport.requests()).hasSize(2);
        assertThat(passwordReads.get()).isEqualTo(1);
        assertThat(transport.request(0).getPassword()).isEqualTo("initial");
        assertThat(transport.request(1).getPassword()).isEqualTo("rotated-1");
        assertThat(transport.request(1).getUser()).isEqualTo("svc");
    }

    @Test
    void shouldReadPasswordFileOnceAtBuildAndOncePerRetry() {
        String settings = "{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\","
                + " \"username\": \"svc\", \"passwordFilePath\": \"/run/secrets/kafka\"}";
        KafkaNotifier notifier = notifier(settings);
        assertThat(passwordReads.get()).isEqualTo(1);
        transport.respond(401, "unauthorized").respond(401, "unauthorized");

        assertThatThrownBy(() -> notifier.notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag"))))
                .isInstanceOf(NotifyException.class);

        assertThat(transport.requests()).hasSize(2);
        assertThat(passwordReads.get()).isEqualTo(2);
        assertThat(transport.request(0).getPassword()).isEqualTo("rotated-1");
        assertThat(transport.request(1).getPassword()).isEqualTo("rotated-2");
    }

    @Test
    void shouldRejectUnreadablePasswordFile() {
        KafkaConfig conf = KafkaConfig.parse(TestAlerts.settings("{\"kafkaRestProxy\": \"http://k\", \"kafkaTopic\": \"t\","
                + " \"username\": \"svc\", \"passwordFilePath\": \"/missing\"}"), DecryptFunction.plain());

        assertThatThrownBy(() -> new KafkaNotifier(TestAlerts.meta(KafkaNotifier.TYPE), conf, TestAlerts.deps(transport).toBuilder()
                .passwordSource(location -> {
                    throw new IOException("no such file: " + location);
                })
                .build()))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("failed to read password from file: no such file: /missing");
    }

    @Test
    void shouldGiveUpAfterTwoAttempts() {
        String settings = "{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\","
                + " \"username\": \"svc\", \"password\": \"initial\", \"passwordFilePath\": \"/run/secrets/kafka\"}";
        transport.respond(401, "unauthorized").respond(401, "still unauthorized").respond(200, "");

        assertThatThrownBy(() -> notifier(settings).notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag"))))
                .isInstanceOf(NotifyException.class)
                .hasMessageContaining("still unauthorized");
        assertThat(transport.requests()).hasSize(2);
    }

    @Test
    void shouldNotRetryWithoutPasswordFile() {
        transport.respond(500, "boom");

        assertThatThrownBy(() -> notifier("{\"kafkaRestProxy\": \"http://kafka-rest:8082\", \"kafkaTopic\": \"alerts\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "QueueLag"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isTrue());
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void shouldRequireClusterIdForV3() {
        assertThatThrownBy(() -> notifier("{\"kafkaRestProxy\": \"http://k\", \"kafkaTopic\": \"t\", \"apiVersion\": \"v3\"}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("kafka cluster id must be provided when using api version 3");
    }
}
