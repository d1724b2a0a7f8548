package com.fastalert.core.notify.notifier.googlechat;

import com.fastalert.core.notify.Images;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.serializer.JacksonPayloadSerializer;
import com.fastalert.core.spi.image.AlertImage;
import com.fastalert.core.template.NamedTemplates;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleChatNotifierTest {

    private final RecordingTransport transport = new RecordingTransport();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Disk");

    private GoogleChatNotifier notifier(String settings) {
        GoogleChatConfig conf = GoogleChatConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new GoogleChatNotifier(TestAlerts.meta(GoogleChatNotifier.TYPE), conf, TestAlerts.deps(transport).toBuilder()
                .images(Images.of(alert -> Optional.of(AlertImage.builder().url("https://img.local/panel.png").build())))
                .appVersion("10.4.0")
                .build());
    }

    @Test
    void shouldPostCardWithLinkButtonAndFooter() throws Exception {
        notifier("{\"url\": \"http://chat.local/hook\", \"message\": \"disk almost full\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Disk")));

        assertThat(transport.request(0).getUrl()).isEqualTo("http://chat.local/hook");
        assertThat(transport.request(0).getHeaders()).containsEntry("Content-Type", "application/json; charset=UTF-8");
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("previewText").asText()).startsWith("[FIRING:1] Disk");
        assertThat(body.path("fallbackText").asText()).isEqualTo(body.path("previewText").asText());
        assertThat(body.path("cards")).hasSize(1);
        JsonNode widgets = body.path("cards").path(0).path("sections").path(0).path("widgets");
        assertThat(widgets.path(0).path("textParagraph").path("text").asText()).isEqualTo("disk almost full");
        assertThat(widgets.path(1).path("buttons").path(0).path("textButton").path("onClick").path("openLink").path("url").asText())
                .isEqualTo("http://grafana.local/alerting/list");
        assertThat(widgets.path(2).path("textParagraph").path("text").asText()).isEqualTo("Grafana v10.4.0 | 01 May 24 10:00 UTC");
    }

    @Test
    void shouldAppendScreenshotCard() throws Exception {
        notifier("{\"url\": \"http://chat.local/hook\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Disk").withAnnotation(Alert.IMAGE_TOKEN_ANNOTATION, "tok")));

        JsonNode cards = TestAlerts.json(transport.request(0).bodyAsString()).path("cards");
        assertThat(cards).hasSize(2);
        assertThat(cards.path(1).path("header").path("title").asText()).isEqualTo("Screenshots");
        JsonNode widgets = cards.path(1).path("sections").path(0).path("widgets");
        assertThat(widgets.path(0).path("textParagraph").path("text").asText()).isEqualTo("firing: Disk");
        assertThat(widgets.path(1).path("image").path("imageUrl").asText()).isEqualTo("https://img.local/panel.png");
    }

    @Test
    void shouldSkipLinkButtonWithoutAbsoluteExternalUrl() throws Exception {
        GoogleChatConfig conf = GoogleChatConfig.parse(TestAlerts.settings("{\"url\": \"http://chat.local/hook\"}"), DecryptFunction.plain());
        new GoogleChatNotifier(TestAlerts.meta(GoogleChatNotifier.TYPE), conf, TestAlerts.deps(transport).toBuilder()
                .renderer(new TemplateRenderer(NamedTemplates.defaults(), new JacksonPayloadSerializer(), ""))
                .build())
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Disk")));

        JsonNode widgets = TestAlerts.json(transport.request(0).bodyAsString())
                .path("cards").path(0).path("sections").path(0).path("widgets");
        widgets.forEach(w -> assertThat(w.has("buttons")).isFalse());
    }

    @Test
    void shouldRequireUrl() {
        assertThatThrownBy(() -> notifier("{}"))
                .isInstanceOf(ReceiverConfigException.class)
                .hasMessage("could not find url property in settings");
    }
}
