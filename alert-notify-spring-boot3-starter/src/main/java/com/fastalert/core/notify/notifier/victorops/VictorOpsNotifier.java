package com.fastalert.core.notify.notifier.victorops;

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
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * VictorOps (Splunk On-Call) REST 集成, entity_id 为分组哈希
 */
@Slf4j
public class VictorOpsNotifier implements Notifier {

    public static final String TYPE = "victorops";

    static final String STATE_RECOVERY = "RECOVERY";

    static final int MAX_MESSAGE_LEN_RUNES = 20480;

    private final ReceiverMetadata meta;

    private final VictorOpsConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    private final String appVersion;

    public VictorOpsNotifier(ReceiverMetadata meta, VictorOpsConfig conf, NotifierDependencies deps) {
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
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        ObjectNode body = serializer.createObjectNode();
        body.put("message_type", messageType(tmpl, group));
        body.put("entity_id", ctx.getGroupKey().hash());
        body.put("entity_display_name", tmpl.expand(conf.getTitle()));
        body.put("timestamp", clock.instant().getEpochSecond());
        Truncations.Truncated state = Truncations.inRunes(tmpl.expand(conf.getDescription()), MAX_MESSAGE_LEN_RUNES);
        if (state.truncated()) {
            log.warn("[Notify-victorops] receiver={} truncated state_message, incident={}, max_runes={}", name(), ctx.getGroupKey().hash(), MAX_MESSAGE_LEN_RUNES);
        }
        body.put("state_message", state.value());
        body.put("monitoring_tool", "Grafana v" + appVersion);
        images.firstImageUrl(group.getAlerts()).ifPresent(url -> body.put("image_url", url));
        body.put("alert_url", UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(tmpl.expandOrRaw(conf.getUrl()))
                .header("Content-Type", "application/json")
                .body(serializer.serialize(body))
                .build());
    }

    String messageType(TemplateExpander tmpl, AlertGroup group) {
        if (group.isResolved()) {
            return STATE_RECOVERY;
        }
        String type = tmpl.expand(conf.getMessageType()).toUpperCase(Locale.ROOT);
        if (type.isEmpty()) {
            log.warn("[Notify-victorops] receiver={} message type rendered empty, using {}", name(), VictorOpsConfig.DEFAULT_MESSAGE_TYPE);
            return VictorOpsConfig.DEFAULT_MESSAGE_TYPE;
        }
        return type;
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
