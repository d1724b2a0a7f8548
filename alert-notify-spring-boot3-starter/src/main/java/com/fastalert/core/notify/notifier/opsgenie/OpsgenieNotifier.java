package com.fastalert.core.notify.notifier.opsgenie;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.template.Truncations;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Opsgenie 告警
 * 以分组哈希作为 alias 创建告警, 恢复时按 alias 关闭 (autoClose)
 */
@Slf4j
public class OpsgenieNotifier implements Notifier {

    public static final String TYPE = "opsgenie";

    public static final int MAX_MESSAGE_LEN_RUNES = 130;

    static final String SOURCE = "Grafana";

    static final String PRIORITY_LABEL = "og_priority";

    private static final Set<String> VALID_PRIORITIES = Set.of("P1", "P2", "P3", "P4", "P5");

    private final ReceiverMetadata meta;

    private final OpsgenieConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public OpsgenieNotifier(ReceiverMetadata meta, OpsgenieConfig conf, NotifierDependencies deps) {
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
        if (group.isResolved() && !sendResolved()) {
            log.debug("[Notify-opsgenie] receiver={} resolve message suppressed", name());
            return;
        }
        String hash = ctx.getGroupKey().hash();

        String url;
        byte[] body;
        if (group.isResolved()) {
            // 恢复时只需要 source, 不渲染其它模板
            if (!conf.isAutoClose()) {
                log.debug("[Notify-opsgenie] receiver={} resolved without autoClose, skipping", name());
                return;
            }
            ObjectNode close = serializer.createObjectNode();
            close.put("source", SOURCE);
            url = conf.getApiUrl() + "/" + hash + "/close?identifierType=alias";
            body = serializer.serialize(close);
        } else {
            TemplateExpander tmpl = renderer.newExpander(ctx, group);
            body = serializer.serialize(buildCreateMessage(tmpl, group, hash));
            NotifySupport.warnTemplateErrors(this, tmpl);
            tmpl.reset();
            url = tmpl.expandOrRaw(conf.getApiUrl());
            if (tmpl.hasErrors()) {
                log.warn("[Notify-opsgenie] receiver={} failed to template url, falling back to configured value", name());
            }
        }

        sender.send(WebhookRequest.builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Authorization", "GenieKey " + conf.getApiKey())
                .body(body)
                .build());
    }

    ObjectNode buildCreateMessage(TemplateExpander tmpl, AlertGroup group, String hash) {
        String ruleUrl = UrlPaths.join(tmpl.externalUrl(), "/alerting/list");

        Truncations.Truncated message = Truncations.inRunes(tmpl.expand(conf.getMessage()), MAX_MESSAGE_LEN_RUNES);
        if (message.truncated()) {
            log.warn("[Notify-opsgenie] receiver={} truncated message, max_runes={}", name(), MAX_MESSAGE_LEN_RUNES);
        }

        String description = tmpl.expand(conf.getDescription());
        if (description.trim().isEmpty()) {
            description = tmpl.expand(DefaultTemplates.TITLE) + "\n" + ruleUrl + "\n\n" + tmpl.expand(DefaultTemplates.MESSAGE);
        }

        String priority = null;
        Map<String, String> labels = new TreeMap<>();
        for (Map.Entry<String, String> e : tmpl.data().getCommonLabels().entrySet()) {
            labels.put(e.getKey(), tmpl.expand(e.getValue()));
            if (PRIORITY_LABEL.equals(e.getKey()) && conf.isOverridePriority() && VALID_PRIORITIES.contains(e.getValue())) {
                priority = e.getValue();
            }
        }

        ObjectNode msg = serializer.createObjectNode();
        msg.put("alias", hash);
        msg.put("message", message.value());
        if (!description.isEmpty()) {
            msg.put("description", description);
        }

        ObjectNode details = msg.putObject("details");
        details.put("url", ruleUrl);
        if (conf.sendDetails()) {
            labels.forEach(details::put);
            List<String> imageUrls = new ArrayList<>();
            images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
                if (image.hasUrl()) {
                    imageUrls.add(image.getUrl());
                }
                return true;
            });
            if (!imageUrls.isEmpty()) {
                ArrayNode urls = details.putArray("image_urls");
                imageUrls.forEach(urls::add);
            }
        }
        msg.put("source", SOURCE);

        List<String> tags = new ArrayList<>();
        if (conf.sendTags()) {
            labels.forEach((k, v) -> tags.add(k + ":" + v));
        }
        Collections.sort(tags);
        ArrayNode tagsNode = msg.putArray("tags");
        tags.forEach(tagsNode::add);

        if (priority != null) {
            msg.put("priority", priority);
        }
        return msg;
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
