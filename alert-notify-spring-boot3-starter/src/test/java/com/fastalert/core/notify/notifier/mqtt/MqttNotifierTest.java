package com.fastalert.core.notify.notifier.mqtt;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.spi.transport.MqttClient;
import com.fastalert.core.spi.transport.MqttConnectSpec;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MqttNotifierTest {

    private final MqttClient client = mock(MqttClient.class);

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "TempHigh");

    private MqttNotifier notifier(String settings) {
        MqttConfig conf = MqttConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new MqttNotifier(TestAlerts.meta(MqttNotifier.TYPE), conf, TestAlerts.deps(new RecordingTransport()).toBuilder()
                .mqttClientFactory(() -> client)
                .build());
    }

    @Test
    void shouldPublishJsonMessage() throws Exception {
        notifier("{\"brokerUrl\": \"tcp://broker:1883\", \"topic\": \"grafana/alerts\", \"clientId\": \"c1\","
                + " \"username\": \"u\", \"password\": \"p\", \"qos\": 1, \"retain\": true}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "TempHigh")));

        ArgumentCaptor<MqttConnectSpec> spec = ArgumentCaptor.forClass(MqttConnectSpec.class);
        ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
        verify(client).connect(spec.capture());
        verify(client).publish(eq("grafana/alerts"), payload.capture(), eq(1), eq(true));
        verify(client).disconnect();

        assertThat(spec.getValue().getBrokerUrl()).isEqualTo("tcp://broker:1883");
        assertThat(spec.getValue().getClientId()).isEqualTo("c1");
        assertThat(spec.getValue().getPassword()).isEqualTo("p");

        JsonNode msg = TestAlerts.json(new String(payload.getValue(), StandardCharsets.UTF_8));
        assertThat(msg.path("version").asText()).isEqualTo("1");
        assertThat(msg.path("groupKey").asText()).isEqualTo(ctx.getGroupKey().value());
        assertThat(msg.path("status").asText()).isEqualTo("firing");
        assertThat(msg.path("message").asText()).startsWith("**Firing**");
    }

    @Test
    void shouldPublishPlainTextMessage() throws Exception {
        notifier("{\"brokerUrl\": \"tcp://broker:1883\", \"topic\": \"t\", \"messageFormat\": \"text\", \"message\": \"{{ status }}!\"}")
                .notify(ctx, List.of(TestAlerts.resolved("alertname", "TempHigh")));

        verify(client).publish(eq("t"), eq("resolved!".getBytes(StandardCharsets.UTF_8)), eq(0), eq(false));
    }

    @Test
    void shouldFailPermanentlyWhenBrokerIsUnreachable() throws Exception {
        doThrow(new IOException("connection refused")).when(client).connect(any());

        assertThatThrownBy(() -> notifier("{\"brokerUrl\": \"tcp://broker:1883\", \"topic\": \"t\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "TempHigh"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isFalse())
                .hasMessage("Failed to connect to MQTT broker: connection refused");
        verify(client, never()).publish(anyString(), any(), anyInt(), anyBoolean());
    }

    @Test
    void shouldDisconnectAfterPublishFailure() throws Exception {
        doThrow(new IOException("not authorized")).when(client).publish(anyString(), any(), anyInt(), anyBoolean());

        assertThatThrownBy(() -> notifier("{\"brokerUrl\": \"tcp://broker:1883\", \"topic\": \"t\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "TempHigh"))))
                .isInstanceOf(NotifyException.class)
                .hasMessage("Failed to publish MQTT message: not authorized");
        verify(client).disconnect();
    }
}
