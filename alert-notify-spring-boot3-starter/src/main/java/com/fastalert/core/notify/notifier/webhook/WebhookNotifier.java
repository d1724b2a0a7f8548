package com.fastalert.core.notify.notifier.webhook;

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
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.template.ExtendedData;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * 通用 webhook, 载荷为完整的模板数据加上渲染后的标题与正文
 */
@Slf4j
public class WebhookNotifier implements Notifier {

    public static final String TYPE = "webhook";

    private final ReceiverMetadata meta;

    private final WebhookConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public WebhookNotifier(ReceiverMetadata meta, WebhookConfig conf, NotifierDependencies deps) {
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
        int truncated = 0;
        if (conf.getMaxAlerts() > 0 && alerts.size() > conf.getMaxAlerts()) {
            truncated = alerts.size() - conf.getMaxAlerts();
            alerts = alerts.subList(0, conf.getMaxAlerts());
        }
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        ExtendedData data = tmpl.data();

        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasUrl()) {
                data.getAlerts().get(i).setImageURL(image.getUrl());
            }
            return true;
        });

        ObjectNode msg = (ObjectNode) serializer.valueToTree(data);
        msg.put("version", "1");
        msg.put("groupKey", ctx.getGroupKey().value());
        msg.put("truncatedAlerts", truncated);
        msg.put("title", tmpl.expand(conf.getTitle()));
        msg.put("state", NotifySupport.state(group));
        msg.put("message", tmpl.expand(conf.getMessage()));
        NotifySupport.warnTemplateErrors(this, tmpl);

        // 地址渲染失败时不发送
        tmpl.reset();
        String url = tmpl.expand(conf.getUrl());
        if (tmpl.hasErrors()) {
            throw NotifyException.permanent("failed to render webhook url: " + tmpl.firstError().getMessage(), tmpl.firstError());
        }

        WebhookRequest.WebhookRequestBuilder request = WebhookRequest.builder()
                .url(url)
                .method(conf.getHttpMethod())
                .header("Content-Type", "application/json")
                .body(serializer.serialize(msg))
                .user(conf.getUser())
                .password(conf.getPassword());
        if (conf.hasAuthorizationHeader()) {
            request.header("Authorization", conf.getAuthorizationScheme() + " " + conf.getAuthorizationCredentials());
        }
        log.debug("[Notify-webhook] receiver={} alerts={} truncated={}", name(), group.size(), truncated);
        sender.send(request.build());
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
