package com.fastalert.core.notify.notifier.sns;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.spi.transport.SnsConnectSpec;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SnsNotifierTest {

    private final SnsClient client = mock(SnsClient.class);

    private final AtomicReference<SnsConnectSpec> connected = new AtomicReference<>();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "AlwaysFiring");

    @BeforeEach
    void setUp() {
        when(client.publish(any(PublishRequest.class))).thenReturn(PublishResponse.builder().messageId("m-1").build());
    }

    private SnsNotifier notifier(String settings) {
        SnsConfig conf = SnsConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new SnsNotifier(TestAlerts.meta(SnsNotifier.TYPE), conf, TestAlerts.deps(new RecordingTransport()).toBuilder()
                .snsClientFactory(spec -> {
                    connected.set(spec);
                    return client;
                })
                .build());
    }

    private PublishRequest published() {
        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(client).publish(request.capture());
        return request.getValue();
    }

    @Test
    void shouldPublishTemplatedSubjectAndBodyToTopic() throws Exception {
        notifier("{\"topic_arn\": \"arn:aws:sns:us-east-1:123456789:test\", \"subject\": \"{{ status }} subject\","
                + " \"message\": \"{{ status }} body\", \"sigv4\": {\"region\": \"us-east-1\"}}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring")));

        PublishRequest request = published();
        assertThat(request.topicArn()).isEqualTo("arn:aws:sns:us-east-1:123456789:test");
        assertThat(request.subject()).isEqualTo("firing subject");
        assertThat(request.message()).isEqualTo("firing body");
        assertThat(request.messageDeduplicationId()).isNull();
        assertThat(request.hasMessageAttributes()).isFalse();
        assertThat(connected.get().getEndpoint()).isEqualTo("https://sns.us-east-1.amazonaws.com");
        verify(client).close();
    }

    @Test
    void shouldTruncateSmsMessageAndFlagIt() throws Exception {
        String longText = "abcd".repeat(500);
        notifier("{\"phone_number\": \"123-456-7890\", \"message\": \"" + longText + "\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring")));

        PublishRequest request = published();
        assertThat(request.phoneNumber()).isEqualTo("123-456-7890");
        assertThat(request.message()).isEqualTo(longText.substring(0, 1600));
        assertThat(request.messageAttributes().get("truncated").stringValue()).isEqualTo("true");
    }

    @Test
    void shouldTruncateSubjectAndFlagIt() throws Exception {
        String longText = "abcd".repeat(500);
        notifier("{\"phone_number\": \"123-456-7890\", \"message\": \"abcd\", \"subject\": \"" + longText + "\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring")));

        PublishRequest request = published();
        assertThat(request.message()).isEqualTo("abcd");
        assertThat(request.subject()).isEqualTo(longText.substring(0, 100));
        assertThat(request.messageAttributes().get("subject_truncated").stringValue()).isEqualTo("true");
        assertThat(request.messageAttributes()).doesNotContainKey("truncated");
    }

    @Test
    void shouldSetDeduplicationForFifoTopicAndCopyAttributes() throws Exception {
        notifier("{\"topic_arn\": \"arn:aws:sns:us-east-1:123456789:alerts.fifo\", \"attributes\": {\"team\": \"ops\"}}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring")));

        PublishRequest request = published();
        assertThat(request.messageDeduplicationId()).isEqualTo(ctx.getGroupKey().hash());
        assertThat(request.messageGroupId()).isEqualTo(ctx.getGroupKey().hash());
        assertThat(request.messageAttributes().get("team").stringValue()).isEqualTo("ops");
        assertThat(request.messageAttributes().get("team").dataType()).isEqualTo("String");
    }

    @Test
    void shouldRetryOnServerError() {
        when(client.publish(any(PublishRequest.class))).thenThrow(SnsException.builder().statusCode(503).message("unavailable").build());

        assertThatThrownBy(() -> notifier("{\"target_arn\": \"arn:aws:sns:us-east-1:123456789:endpoint/app\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isTrue());
        verify(client).close();
    }

    @Test
    void shouldNotRetryWhenRequestIsRejected() {
        when(client.publish(any(PublishRequest.class))).thenThrow(SnsException.builder().statusCode(403).message("denied").build());

        assertThatThrownBy(() -> notifier("{\"topic_arn\": \"arn:aws:sns:us-east-1:123456789:test\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> {
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.getMessage()).startsWith("failed to publish SNS message");
                });
    }

    @Test
    void shouldRetryWhenEndpointIsUnreachable() {
        when(client.publish(any(PublishRequest.class))).thenThrow(SdkClientException.create("connection refused"));

        assertThatThrownBy(() -> notifier("{\"topic_arn\": \"arn:aws:sns:us-east-1:123456789:test\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "AlwaysFiring"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isTrue());
    }
}
