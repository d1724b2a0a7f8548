package com.fastalert.core.notify.notifier.dingding;

import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.support.RecordingTransport;
import com.fastalert.support.TestAlerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DingDingNotifierTest {

    private static final String CLIENT_LINK =
            "dingtalk://dingtalkclient/page/link?pc_slide=false&url=http%3A%2F%2Fgrafana.local%2Falerting%2Flist";

    private final RecordingTransport transport = new RecordingTransport();

    private final NotifyContext ctx = TestAlerts.ctx("alertname", "Latency");

    private DingDingNotifier notifier(String settings) {
        DingDingConfig conf = DingDingConfig.parse(TestAlerts.settings(settings), DecryptFunction.plain());
        return new DingDingNotifier(TestAlerts.meta(DingDingNotifier.TYPE), conf, TestAlerts.deps(transport));
    }

    @Test
    void shouldSendLinkMessageByDefault() throws Exception {
        notifier("{\"url\": \"http://oapi.local/robot/send?access_token=t\", \"message\": \"{{ status }}\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Latency")));

        assertThat(transport.request(0).getUrl()).isEqualTo("http://oapi.local/robot/send?access_token=t");
        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("msgtype").asText()).isEqualTo("link");
        assertThat(body.path("link").path("text").asText()).isEqualTo("firing");
        assertThat(body.path("link").path("title").asText()).startsWith("[FIRING:1] Latency");
        assertThat(body.path("link").path("messageUrl").asText()).isEqualTo(CLIENT_LINK);
    }

    @Test
    void shouldSendActionCard() throws Exception {
        notifier("{\"url\": \"http://oapi.local/robot/send\", \"msgType\": \"actionCard\", \"title\": \"t\", \"message\": \"m\"}")
                .notify(ctx, List.of(TestAlerts.resolved("alertname", "Latency")));

        JsonNode body = TestAlerts.json(transport.request(0).bodyAsString());
        assertThat(body.path("msgtype").asText()).isEqualTo("actionCard");
        JsonNode card = body.path("actionCard");
        assertThat(card.path("title").asText()).isEqualTo("t");
        assertThat(card.path("text").asText()).isEqualTo("m");
        assertThat(card.path("singleTitle").asText()).isEqualTo("More");
        assertThat(card.path("singleURL").asText()).isEqualTo(CLIENT_LINK);
        assertThat(body.has("link")).isFalse();
    }

    @Test
    void shouldStillSendWhenTitleReferencesUnknownTemplate() throws Exception {
        notifier("{\"url\": \"http://oapi.local/robot/send\", \"title\": \"{{ template('no.such.title') }}\", \"message\": \"m\"}")
                .notify(ctx, List.of(TestAlerts.firing("alertname", "Latency")));

        JsonNode link = TestAlerts.json(transport.request(0).bodyAsString()).path("link");
        assertThat(link.path("title").asText()).isEmpty();
        assertThat(link.path("text").asText()).isEqualTo("m");
    }
}
