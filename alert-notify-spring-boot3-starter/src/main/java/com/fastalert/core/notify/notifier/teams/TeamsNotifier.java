package com.fastalert.core.notify.notifier.teams;

import com.fastalert.core.notify.Images;
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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Microsoft Teams, Adaptive Card 消息
 * 旧版 Office 365 connector 成功时响应体为 "1"
 */
@Slf4j
public class TeamsNotifier implements Notifier {

    public static final String TYPE = "teams";

    static final String ADAPTIVE_CARD = "application/vnd.microsoft.card.adaptive";

    static final String LEGACY_HOST_SUFFIX = "webhook.office.com";

    private final ReceiverMetadata meta;

    private final TeamsConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public TeamsNotifier(ReceiverMetadata meta, TeamsConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        ObjectNode msg = buildMessage(tmpl, group);
        NotifySupport.warnTemplateErrors(this, tmpl);

        String url = tmpl.expandOrRaw(conf.getUrl());
        WebhookResponse resp = sender.send(WebhookRequest.builder()
                .url(url)
                .header("Content-Type", "application/json")
                .body(serializer.serialize(msg))
                .build());
        String host = UrlPaths.host(url);
        if (host != null && host.endsWith(LEGACY_HOST_SUFFIX) && !"1".equals(resp.bodyAsString().trim())) {
            throw NotifyException.retryable("send notification to Teams: webhook response body must equal 1, got " + resp.bodyAsString());
        }
    }

    ObjectNode buildMessage(TemplateExpander tmpl, AlertGroup group) {
        ObjectNode card = serializer.createObjectNode();
        card.put("$schema", "http://adaptivecards.io/schemas/adaptive-card.json");
        card.put("type", "AdaptiveCard");
        card.put("version", "1.4");
        card.putObject("msTeams").put("width", "Full");

        ArrayNode body = card.putArray("body");
        ObjectNode title = textBlock(body, tmpl.expand(conf.getTitle()));
        title.put("weight", "Bolder");
        title.put("size", "Large");
        title.put("color", group.isResolved() ? "Good" : "Attention");
        String sectionTitle = tmpl.expand(conf.getSectionTitle());
        if (!sectionTitle.isEmpty()) {
            textBlock(body, sectionTitle).put("weight", "Bolder");
        }
        textBlock(body, tmpl.expand(conf.getMessage()));

        ArrayNode imageSet = serializer.createObjectNode().putArray("images");
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasUrl()) {
                ObjectNode img = imageSet.addObject();
                img.put("type", "Image");
                img.put("url", image.getUrl());
            }
            return true;
        });
        if (!imageSet.isEmpty()) {
            ObjectNode set = body.addObject();
            set.put("type", "ImageSet");
            set.put("imageSize", "Large");
            set.set("images", imageSet);
        }

        ObjectNode actions = body.addObject();
        actions.put("type", "ActionSet");
        ObjectNode open = actions.putArray("actions").addObject();
        open.put("type", "Action.OpenUrl");
        open.put("title", "View URL");
        open.put("url", UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));

        ObjectNode msg = serializer.createObjectNode();
        msg.put("type", "message");
        msg.put("summary", tmpl.expand(conf.getTitle()));
        ObjectNode attachment = msg.putArray("attachments").addObject();
        attachment.put("contentType", ADAPTIVE_CARD);
        attachment.set("content", card);
        return msg;
    }

    private static ObjectNode textBlock(ArrayNode body, String text) {
        ObjectNode block = body.addObject();
        block.put("type", "TextBlock");
        block.put("text", text);
        block.put("wrap", true);
        return block;
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
