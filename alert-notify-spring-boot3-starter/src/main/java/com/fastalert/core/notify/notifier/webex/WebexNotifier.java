package com.fastalert.core.notify.notifier.webex;

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
import com.fastalert.core.template.Truncations;
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
 * Webex messages API, markdown 正文按字节截断, 只附带第一张截图
 */
@Slf4j
public class WebexNotifier implements Notifier {

    public static final String TYPE = "webex";

    static final int MAX_MESSAGE_LEN_BYTES = 4096;

    private final ReceiverMetadata meta;

    private final WebexConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public WebexNotifier(ReceiverMetadata meta, WebexConfig conf, NotifierDependencies deps) {
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
        Truncations.Truncated message = Truncations.inBytes(tmpl.expand(conf.getMessage()), MAX_MESSAGE_LEN_BYTES);
        if (message.truncated()) {
            log.warn("[Notify-webex] receiver={} message too long, truncated to {} bytes", name(), MAX_MESSAGE_LEN_BYTES);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);

        ObjectNode body = serializer.createObjectNode();
        if (!conf.getRoomId().isEmpty()) {
            body.put("roomId", conf.getRoomId());
        }
        body.put("markdown", message.value());
        ArrayNode files = body.putArray("files");
        images.firstImageUrl(group.getAlerts()).ifPresent(files::add);

        // 地址渲染失败时不发送
        tmpl.reset();
        String url = tmpl.expand(conf.getApiUrl());
        if (tmpl.hasErrors()) {
            throw NotifyException.permanent("failed to render webex api url: " + tmpl.firstError().getMessage(), tmpl.firstError());
        }
        WebhookRequest.WebhookRequestBuilder request = WebhookRequest.builder()
                .url(url)
                .header("Content-Type", "application/json")
                .body(serializer.serialize(body));
        if (!conf.getToken().isEmpty()) {
            request.bearerToken(conf.getToken());
        }
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
