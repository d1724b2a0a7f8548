package com.fastalert.core.notify.notifier.webhook;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.SecureSettingsDecryptor;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookNotifierTest {

    private final RecordingTransport transport = new RecordingTransport();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Cpu");

    private WebhookNotifier notifier(String settings, DecryptFunction decrypt) {
        WebhookConfig conf = WebhookConfig.parse(TestAlerts.settings(settings), decrypt);
        return new WebhookNotifier(TestAlerts.meta(WebhookNotifier.TYPE), conf, TestAlerts.deps(transport));
    }

    @Test
    void shouldPostExtendedDataEnvelope() throws Exception {
        notifier("{\"url\": \"http://hooks.local/alert\"}", DecryptFunction.plain())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu", "pod", "a"), TestAlerts.firing("alertname", "Cpu", "pod", "b")));

        assertThat(transport.request(0).getMethod()).isEqualTo("POST");
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("version").asText()).isEqualTo("1");
        assertThat(body.path("groupKey").asText()).isEqualTo(ctx.getGroupKey().value());
        assertThat(body.path("state").asText()).isEqualTo("alerting");
        assertThat(body.path("status").asText()).isEqualTo("firing");
        assertThat(body.path("alerts")).hasSize(2);
        assertThat(body.path("truncatedAlerts").asInt()).isZero();
        assertThat(body.path("title").asText()).startsWith("[FIRING:2] Cpu");
    }

    @Test
    void shouldTruncateToMaxAlerts() throws Exception {
        notifier("{\"url\": \"http://hooks.local/alert\", \"maxAlerts\": \"1\", \"httpMethod\": \"put\"}", DecryptFunction.plain())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu", "pod", "a"), TestAlerts.firing("alertname", "Cpu", "pod", "b")));

        assertThat(transport.request(0).getMethod()).isEqualTo("PUT");
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("alerts")).hasSize(1);
        assertThat(body.path("truncatedAlerts").asInt()).isEqualTo(1);
    }

    @Test
    void shouldSendAuthorizationHeaderFromSecureSettings() throws Exception {
        notifier("{\"url\": \"http://hooks.local/alert\"}", new SecureSettingsDecryptor(Map.of("authorization_credentials", "s3cr3t")))
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu")));

        assertThat(transport.request(0).getHeaders()).containsEntry("Authorization", "Bearer s3cr3t");
    }

    @Test
    void shouldRenderTemplatedUrl() throws Exception {
        notifier("{\"url\": \"http://hooks.local/{{ commonLabels['alertname'] }}\"}", DecryptFunction.plain())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu")));

        assertThat(transport.request(0).getUrl()).isEqualTo("http://hooks.local/Cpu");
    }

    @Test
    void shouldNotSendWhenUrlFailsToRender() {
        assertThatThrownBy(() -> notifier("{\"url\": \"http://hooks.local/{{ template('nope') }}\"}", DecryptFunction.plain())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isFalse());
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void shouldStillSendWhenTitleAndMessageReferenceUnknownTemplates() throws Exception {
        notifier("{\"url\": \"http://hooks.local/alert\", \"title\": \"{{ template('no.such.title') }}\","
                + " \"message\": \"{{ template('no.such.message') }}\"}", DecryptFunction.plain())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Cpu")));

        assertThat(transport.requests()).hasSize(1);
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("title").asText()).isEmpty();
        assertThat(body.path("message").asText()).isEmpty();
        assertThat(body.path("status").asText()).isEqualTo("firing");
    }

    @Test
    void shouldRejectBasicAuthTogetherWithAuthorizationHeader() {
        assertThatThrownBy(() -> notifier("{\"url\": \"http://h\", \"username\": \"u\", \"password\": \"p\","
                + " \"authorization_credentials\": \"c\"}", DecryptFunction.plain()))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("both HTTP Basic Authentication and Authorization Header are set, only 1 is permitted");
    }
}
