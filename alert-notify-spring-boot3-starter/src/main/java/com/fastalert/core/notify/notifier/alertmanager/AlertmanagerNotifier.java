package com.fastalert.core.notify.notifier.alertmanager;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 转发原始告警到外部 Alertmanager
 * 依次发送到每个实例, 至少一个成功即视为成功
 */
@Slf4j
public class AlertmanagerNotifier implements Notifier {

    public static final String TYPE = "prometheus-alertmanager";

    static final String IMAGE_ANNOTATION = "image";

    private final ReceiverMetadata meta;

    private final AlertmanagerConfig conf;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    public AlertmanagerNotifier(ReceiverMetadata meta, AlertmanagerConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-alertmanager] receiver={} sending {} alert(s)", name(), alerts.size());
        if (alerts.isEmpty()) {
            return;
        }
        List<Alert> withImages = new ArrayList<>(alerts);
        images.forEachStoredImage(alerts, (i, alert, image) -> {
            if (image.hasUrl()) {
                withImages.set(i, alert.withAnnotation(IMAGE_ANNOTATION, image.getUrl()));
            }
            return true;
        });
        byte[] body = serializer.serialize(toJson(withImages));

        NotifyException last = null;
        int failures = 0;
        for (String url : conf.getUrls()) {
            try {
                sender.send(WebhookRequest.builder()
                        .url(url)
                        .user(conf.getUser())
                        .password(conf.getPassword())
                        .header("Content-Type", "application/json")
                        .body(body)
                        .build());
            } catch (NotifyException e) {
                log.warn("[Notify-alertmanager] receiver={} failed to send to {}: {}", name(), url, e.getMessage());
                last = e;
                failures++;
            }
        }
        if (failures == conf.getUrls().size()) {
            throw new NotifyException("failed to send alert to Alertmanager: " + last.getMessage(), last.isRetryable(), last);
        }
    }

    ArrayNode toJson(List<Alert> alerts) {
        ArrayNode out = serializer.createObjectNode().arrayNode();
        for (Alert a : alerts) {
            ObjectNode n = out.addObject();
            ObjectNode labels = n.putObject("labels");
            a.getLabels().forEach(labels::put);
            ObjectNode annotations = n.putObject("annotations");
            a.getAnnotations().forEach(annotations::put);
            if (a.getStartsAt() != null) {
                n.put("startsAt", a.getStartsAt().toString());
            }
            if (a.getEndsAt() != null) {
                n.put("endsAt", a.getEndsAt().toString());
            }
            n.put("generatorURL", a.getGeneratorURL());
        }
        return out;
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
