package com.fastalert.core.notify.notifier.email;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.spi.transport.EmailMessage;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailNotifierTest {

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Mem");

    private EmailNotifier notifier(String settings, Transport transport) {
        EmailConfig conf = EmailConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new EmailNotifier(TestAlerts.meta(EmailNotifier.TYPE), conf, TestAlerts.deps(transport));
    }

    @Test
    void shouldSendOneEmailPerAddress() throws Exception {
        RecordingTransport transport = new RecordingTransport();

        notifier("{\"addresses\": \"a@example.com;b@example.com\"}", transport)
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Mem")));

        assertThat(transport.emails()).hasSize(2);
        assertThat(transport.emails().get(0).getTo()).containsExactly("a@example.com");
        assertThat(transport.emails().get(1).getTo()).containsExactly("b@example.com");
        EmailMessage first = transport.emails().get(0);
        assertThat(first.getSubject()).startsWith("[FIRING:1] Mem");
        assertThat(first.getBody()).contains("http://grafana.local/alerting/list?alertState=firing&view=state");
    }

    @Test
    void shouldSendSingleEmailToAllAddresses() throws Exception {
        RecordingTransport transport = new RecordingTransport();

        notifier("{\"addresses\": [\"a@example.com\", \"b@example.com\"], \"singleEmail\": true}", transport)
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Mem")));

        assertThat(transport.emails()).hasSize(1);
        assertThat(transport.emails().get(0).getTo()).containsExactly("a@example.com", "b@example.com");
    }

    @Test
    void shouldRetryWhenMailServerFails() {
        Transport failing = new Transport() {
            @Override
            public WebhookResponse sendWebhook(WebhookRequest request) {
                throw new UnsupportedOperationException();
            }

            @Override
            public void sendEmail(EmailMessage message) throws IOException {
                throw new IOException("smtp unavailable");
            }
        };

        assertThatThrownBy(() -> notifier("{\"addresses\": \"a@example.com\"}", failing)
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Mem"))))
                .isInstanceOfSatisfying(NotifyException.class, e -> assertThat(e.isRetryable()).isTrue())
                .hasMessageContaining("smtp unavailable");
    }

    @Test
    void shouldRequireAddresses() {
        assertThatThrownBy(() -> notifier("{}", new RecordingTransport()))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("could not find addresses in settings");
    }
}
