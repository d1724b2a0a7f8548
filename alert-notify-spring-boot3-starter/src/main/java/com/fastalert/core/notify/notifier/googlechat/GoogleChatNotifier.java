package com.fastalert.core.notify.notifier.googlechat;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
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

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Google Chat 卡片消息
 * 外部地址不是绝对地址时不加跳转按钮, 否则 Google Chat 会显示空消息
 */
@Slf4j
public class GoogleChatNotifier implements Notifier {

    public static final String TYPE = "googlechat";

    static final DateTimeFormatter FOOTER_TIME = DateTimeFormatter.ofPattern("dd MMM yy HH:mm z", Locale.US)
            .withZone(ZoneId.of("UTC"));

    private final ReceiverMetadata meta;

    private final GoogleChatConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    private final String appVersion;

    public GoogleChatNotifier(ReceiverMetadata meta, GoogleChatConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.clock = deps.getClock();
        this.appVersion = deps.getAppVersion();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-googlechat] receiver={} executing notification", name());
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        ObjectNode msg = serializer.createObjectNode();
        String title = tmpl.expand(conf.getTitle());
        msg.put("previewText", title);
        msg.put("fallbackText", title);
        ArrayNode cards = msg.putArray("cards");
        ObjectNode card = cards.addObject();
        card.putObject("header").put("title", title);
        ArrayNode widgets = card.putArray("sections").addObject().putArray("widgets");

        String text = tmpl.expand(conf.getMessage());
        if (!text.isEmpty()) {
            widgets.addObject().putObject("textParagraph").put("text", text);
        }
        String ruleUrl = UrlPaths.join(tmpl.externalUrl(), "/alerting/list");
        if (isAbsolute(ruleUrl)) {
            ObjectNode button = widgets.addObject().putArray("buttons").addObject().putObject("textButton");
            button.put("text", "OPEN IN GRAFANA");
            button.putObject("onClick").putObject("openLink").put("url", ruleUrl);
        } else {
            log.warn("[Notify-googlechat] receiver={} external URL is missing or invalid, skipping link button, ruleUrl={}", name(), ruleUrl);
        }
        widgets.addObject().putObject("textParagraph")
                .put("text", "Grafana v" + appVersion + " | " + FOOTER_TIME.format(clock.instant()));

        ObjectNode screenshots = screenshotCard(group);
        if (screenshots != null) {
            cards.add(screenshots);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(tmpl.expandOrRaw(conf.getUrl()))
                .header("Content-Type", "application/json; charset=UTF-8")
                .body(serializer.serialize(msg))
                .build());
    }

    private ObjectNode screenshotCard(AlertGroup group) {
        ObjectNode card = serializer.createObjectNode();
        card.putObject("header").put("title", "Screenshots");
        ArrayNode sections = card.putArray("sections");
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (!image.hasUrl()) {
                return true;
            }
            ArrayNode widgets = sections.addObject().putArray("widgets");
            widgets.addObject().putObject("textParagraph")
                    .put("text", alert.status(group.getEvaluatedAt()) + ": " + alert.name());
            widgets.addObject().putObject("image").put("imageUrl", image.getUrl());
            return true;
        });
        return sections.isEmpty() ? null : card;
    }

    static boolean isAbsolute(String url) {
        try {
            return new URI(url).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
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
