package com.fastalert.core.notify.notifier.dooray;

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
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Dooray incoming webhook, 标题作为 botName
 */
@Slf4j
public class DoorayNotifier implements Notifier {

    public static final String TYPE = "dooray";

    private final ReceiverMetadata meta;

    private final DoorayConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Clock clock;

    public DoorayNotifier(ReceiverMetadata meta, DoorayConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-dooray] receiver={} executing notification", name());
        TemplateExpander tmpl = renderer.newExpander(ctx, NotifySupport.group(ctx, alerts, clock));
        String title = tmpl.expand(conf.getTitle());
        String text = title + "\n" + UrlPaths.join(tmpl.externalUrl(), "/alerting/list") + "\n\n" + tmpl.expand(conf.getDescription());
        NotifySupport.warnTemplateErrors(this, tmpl);

        ObjectNode body = serializer.createObjectNode();
        body.put("botName", title);
        body.put("botIconImage", conf.getIconUrl());
        body.put("text", text);
        sender.send(WebhookRequest.builder()
                .url(conf.getUrl())
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(serializer.serialize(body))
                .build());
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
