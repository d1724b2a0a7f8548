package com.fastalert.core.notify.notifier.slack;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Slack chat.postMessage 或 incoming webhook
 * 2xx 响应中 ok=false 且带 error 同样视为失败
 */
@Slf4j
public class SlackNotifier implements Notifier {

    public static final String TYPE = "slack";

    private final ReceiverMetadata meta;

    private final SlackConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Clock clock;

    private final String appVersion;

    public SlackNotifier(ReceiverMetadata meta, SlackConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
        this.appVersion = deps.getAppVersion();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        ObjectNode msg = buildMessage(ctx, group);

        WebhookRequest.WebhookRequestBuilder request = WebhookRequest.builder()
                .url(conf.getUrl())
                .header("Content-Type", "application/json")
                .header("User-Agent", "Grafana")
                .body(serializer.serialize(msg));
        if (!conf.getToken().isEmpty()) {
            request.bearerToken(conf.getToken());
        }
        WebhookResponse resp = sender.send(request.build());
        checkBody(resp);
    }

    ObjectNode buildMessage(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        ObjectNode msg = serializer.createObjectNode();
        msg.put("channel", tmpl.expand(conf.getRecipient()));
        msg.put("username", tmpl.expand(conf.getUsername()));
        putIfNotEmpty(msg, "icon_emoji", tmpl.expand(conf.getIconEmoji()));
        putIfNotEmpty(msg, "icon_url", tmpl.expand(conf.getIconUrl()));

        String title = tmpl.expand(conf.getTitle());
        ObjectNode attachment = msg.putArray("attachments").addObject();
        attachment.put("color", NotifySupport.statusColor(group));
        attachment.put("title", title);
        attachment.put("fallback", title);
        attachment.put("footer", "Grafana v" + appVersion);
        attachment.put("footer_icon", NotifySupport.FOOTER_ICON_URL);
        attachment.put("ts", clock.instant().getEpochSecond());
        attachment.put("title_link", UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));
        attachment.put("text", tmpl.expand(conf.getText()));

        String mentions = mentions(tmpl);
        if (!mentions.isEmpty()) {
            ObjectNode section = msg.putArray("blocks").addObject();
            section.put("type", "section");
            ObjectNode text = section.putObject("text");
            text.put("type", "mrkdwn");
            text.put("text", mentions);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);
        return msg;
    }

    private String mentions(TemplateExpander tmpl) {
        StringBuilder sb = new StringBuilder();
        String channel = conf.getMentionChannel().trim();
        if (!channel.isEmpty()) {
            sb.append("<!").append(channel).append('|').append(channel).append('>');
        }
        if (!conf.getMentionGroups().isEmpty()) {
            appendSpace(sb);
            for (String g : conf.getMentionGroups()) {
                sb.append("<!subteam^").append(tmpl.expand(g)).append('>');
            }
        }
        if (!conf.getMentionUsers().isEmpty()) {
            appendSpace(sb);
            for (String u : conf.getMentionUsers()) {
                sb.append("<@").append(tmpl.expand(u)).append('>');
            }
        }
        return sb.toString();
    }

    private static void appendSpace(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
    }

    private static void putIfNotEmpty(ObjectNode node, String field, String value) {
        if (!value.isEmpty()) {
            node.put(field, value);
        }
    }

    /**
     * incoming webhook 返回纯文本 "ok", 只校验合法 JSON
     */
    void checkBody(WebhookResponse resp) throws NotifyException {
        JsonNode body;
        try {
            body = serializer.readTree(resp.body());
        } catch (IllegalStateException e) {
            log.debug("[Notify-slack] receiver={} non-json response body ignored", name());
            return;
        }
        if (body == null || !body.isObject()) {
            return;
        }
        String err = body.path("error").asText("");
        if (!body.path("ok").asBoolean(false) && !err.isEmpty()) {
            throw NotifyException.retryable("failed to make Slack API request: " + err);
        }
    }

    @Override
    public String name() {
        return meta.name();
    }

    @Override
    public String type() {
        return meta.type();
    }

    @Override
    public boolean disableResolve() {
        return meta.disableResolve();
    }
}
