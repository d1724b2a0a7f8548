package com.fastalert.core.notify.notifier.pagerduty;

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
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * PagerDuty Events API v2
 * 以分组哈希作为 dedup_key, 触发与恢复分别发送 trigger / resolve 事件
 */
@Slf4j
public class PagerDutyNotifier implements Notifier {

    public static final String TYPE = "pagerduty";

    public static final String API_URL = "https://events.pagerduty.com/v2/enqueue";

    public static final int MAX_SUMMARY_LEN_RUNES = 1024;

    static final String EVENT_TRIGGER = "trigger";
    static final String EVENT_RESOLVE = "resolve";

    private static final Set<String> KNOWN_SEVERITY = Set.of(PagerDutyConfig.DEFAULT_SEVERITY, "error", "warning", "info");

    private final ReceiverMetadata meta;

    private final PagerDutyConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public PagerDutyNotifier(ReceiverMetadata meta, PagerDutyConfig conf, NotifierDependencies deps) {
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
            log.debug("[Notify-pagerduty] receiver={} resolve event suppressed", name());
            return;
        }
        PagerDutyMessage msg = buildMessage(ctx, group);
        log.info("[Notify-pagerduty] receiver={} event_type={}", name(), msg.getEventAction());
        sender.send(WebhookRequest.builder()
                .url(API_URL)
                .header("Content-Type", "application/json")
                .body(serializer.serialize(msg))
                .build());
    }

    PagerDutyMessage buildMessage(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        Map<String, String> details = new LinkedHashMap<>();
        PagerDutyConfig.CUSTOM_DETAILS.forEach((k, v) -> details.put(k, tmpl.expand(v)));

        String severity = tmpl.expand(conf.getSeverity()).toLowerCase(Locale.ROOT);
        if (!KNOWN_SEVERITY.contains(severity)) {
            log.warn("[Notify-pagerduty] receiver={} severity '{}' is not a known value, using {}", name(), severity, PagerDutyConfig.DEFAULT_SEVERITY);
            severity = PagerDutyConfig.DEFAULT_SEVERITY;
        }

        PagerDutyMessage.Payload payload = new PagerDutyMessage.Payload();
        payload.setSource(tmpl.expand(conf.getSource()));
        payload.setComponent(tmpl.expand(conf.getComponent()));
        Truncations.Truncated summary = Truncations.inRunes(tmpl.expand(conf.getSummary()), MAX_SUMMARY_LEN_RUNES);
        if (summary.truncated()) {
            log.warn("[Notify-pagerduty] receiver={} truncated summary, max_runes={}", name(), MAX_SUMMARY_LEN_RUNES);
        }
        payload.setSummary(summary.value());
        payload.setSeverity(severity);
        payload.setCustomDetails(details);
        payload.setClazz(tmpl.expand(conf.getClazz()));
        payload.setGroup(tmpl.expand(conf.getGroup()));

        PagerDutyMessage msg = new PagerDutyMessage();
        msg.setClient(tmpl.expand(conf.getClient()));
        msg.setClientUrl(tmpl.expand(conf.getClientUrl()));
        msg.setRoutingKey(conf.getKey());
        msg.setEventAction(group.isResolved() ? EVENT_RESOLVE : EVENT_TRIGGER);
        msg.setDedupKey(ctx.getGroupKey().hash());
        msg.getLinks().add(new PagerDutyMessage.Link(tmpl.externalUrl(), "External URL"));
        msg.setPayload(payload);

        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasUrl()) {
                msg.getImages().add(new PagerDutyMessage.Image(image.getUrl()));
            }
            return true;
        });

        NotifySupport.warnTemplateErrors(this, tmpl);
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
