package com.fastalert.core.notify.notifier.sensugo;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Sensu Go 事件 API
 * 触发时 check 状态为 2 (critical), 恢复为 0
 */
@Slf4j
public class SensuGoNotifier implements Notifier {

    public static final String TYPE = "sensugo";

    static final String DEFAULT_NAME = "default";

    static final int STATUS_OK = 0;
    static final int STATUS_CRITICAL = 2;

    static final int CHECK_INTERVAL_SECONDS = 86400;

    private final ReceiverMetadata meta;

    private final SensuGoConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public SensuGoNotifier(ReceiverMetadata meta, SensuGoConfig conf, NotifierDependencies deps) {
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
        log.debug("[Notify-sensugo] receiver={} sending Sensu Go result", name());
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        String entity = orDefault(tmpl.expand(conf.getEntity()));
        String check = orDefault(tmpl.expand(conf.getCheck()));
        String namespace = orDefault(tmpl.expand(conf.getNamespace()));
        String ruleUrl = UrlPaths.join(tmpl.externalUrl(), "/alerting/list");

        ObjectNode body = serializer.createObjectNode();
        ObjectNode entityMeta = body.putObject("entity").putObject("metadata");
        entityMeta.put("name", entity);
        entityMeta.put("namespace", namespace);

        ObjectNode checkNode = body.putObject("check");
        ObjectNode checkMeta = checkNode.putObject("metadata");
        checkMeta.put("name", check);
        ObjectNode labels = checkMeta.putObject("labels");
        images.firstImageUrl(group.getAlerts()).ifPresent(url -> labels.put("imageURL", url));
        labels.put("ruleURL", ruleUrl);
        checkNode.put("output", tmpl.expand(conf.getMessage()));
        checkNode.put("issued", clock.instant().getEpochSecond());
        checkNode.put("interval", CHECK_INTERVAL_SECONDS);
        checkNode.put("status", group.isResolved() ? STATUS_OK : STATUS_CRITICAL);
        if (conf.getHandler().isEmpty()) {
            checkNode.putNull("handlers");
        } else {
            checkNode.putArray("handlers").add(tmpl.expand(conf.getHandler()));
        }
        body.put("ruleUrl", ruleUrl);
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(stripTrailingSlash(conf.getUrl()) + "/api/core/v2/namespaces/" + namespace + "/events")
                .header("Content-Type", "application/json")
                .header("Authorization", "Key " + conf.getApiKey())
                .body(serializer.serialize(body))
                .build());
    }

    private static String orDefault(String s) {
        return s.isEmpty() ? DEFAULT_NAME : s;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
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
