package com.fastalert.core.notify.notifier.pushover;

import com.fastalert.core.notify.Images;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.spi.image.AlertImage;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PushoverNotifierTest {

    private final RecordingTransport transport = new RecordingTransport();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Mem");

    private PushoverNotifier notifier(String settings) {
        PushoverConfig conf = PushoverConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        Images images = Images.of(alert -> Optional.of(AlertImage.builder()
                .fileName("panel.png")
                .content("png".getBytes(StandardCharsets.UTF_8))
                .build()));
        return new PushoverNotifier(TestAlerts.meta(PushoverNotifier.TYPE), conf, TestAlerts.deps(transport).toBuilder()
                .images(images)
                .boundaryGenerator(() -> "test-boundary")
                .build());
    }

    private static String field(String name, String value) {
        return "name=\"" + name + "\"\r\n\r\n" + value + "\r\n";
    }

    @Test
    void shouldPostMultipartFormWithAlertingFields() throws Exception {
        notifier("{\"userKey\": \"u\", \"apiToken\": \"t\", \"priority\": \"1\", \"okPriority\": \"0\","
                + " \"sound\": \"siren\", \"device\": \"phone\", \"message\": \"{{ template('missing') }}\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Mem")));

        assertThat(transport.request(0).getUrl()).isEqualTo("https://api.pushover.net/1/messages.json");
        assertThat(transport.request(0).getHeaders().get("Content-Type")).isEqualTo("multipart/form-data; boundary=test-boundary");
        String body = transport.request(0).bodyAsString();
        assertThat(body)
                .contains(field("user", "u"))
                .contains(field("token", "t"))
                .contains(field("priority", "1"))
                .contains(field("device", "phone"))
                .contains(field("url", "http://grafana.local/alerting/list"))
                .contains(field("url_title", "Show alert rule"))
                .contains(field("sound", "siren"))
                .contains(field("html", "1"))
                .doesNotContain("name=\"retry\"")
                .doesNotContain("name=\"attachment\"");
        assertThat(body).contains("name=\"title\"\r\n\r\n[FIRING:1] Mem");
        assertThat(body).contains(field("message", "(no details)"));
    }

    @Test
    void shouldSendEmergencyRetryAndOkSound() throws Exception {
        notifier("{\"userKey\": \"u\", \"apiToken\": \"t\", \"priority\": 0, \"okPriority\": 2, \"retry\": 30, \"expire\": 3600,"
                + " \"okSound\": \"default\"}")
                .notify(ctx, List.of(TestAlerts.resolved("alertname", "Mem")));

        String body = transport.request(0).bodyAsString();
        assertThat(body)
                .contains(field("priority", "2"))
                .contains(field("retry", "30"))
                .contains(field("expire", "3600"))
                .doesNotContain("name=\"sound\"");
    }

    @Test
    void shouldAttachOneScreenshotUnlessUploadDisabled() throws Exception {
        Alert withImage = TestAlerts.firing("alertname", "Mem").withAnnotation(Alert.IMAGE_TOKEN_ANNOTATION, "tok");
        notifier("{\"userKey\": \"u\", \"apiToken\": \"t\"}").notify(ctx, List.of(withImage, withImage));
        notifier("{\"userKey\": \"u\", \"apiToken\": \"t\", \"uploadImage\": false}").notify(ctx, List.of(withImage));

        String uploaded = transport.request(0).bodyAsString();
        assertThat(uploaded.split("name=\"attachment\"", -1)).hasSize(2);
        assertThat(uploaded).contains("filename=\"panel.png\"");
        assertThat(transport.request(1).bodyAsString()).doesNotContain("name=\"attachment\"");
    }

    @Test
    void shouldValidateCredentialsAndPriority() {
        assertThatThrownBy(() -> notifier("{\"apiToken\": \"t\"}"))
                .isInstanceOf(ReceiverConfigException.class).hasMessage("user key not found");
        assertThatThrownBy(() -> notifier("{\"userKey\": \"u\"}"))
                .isInstanceOf(ReceiverConfigException.class).hasMessage("API token not found");
        assertThatThrownBy(() -> notifier("{\"userKey\": \"u\", \"apiToken\": \"t\", \"priority\": \"high\"}"))
                .isInstanceOf(ReceiverConfigException.class).hasMessageStartingWith("failed to convert alerting priority to integer");
    }
}
