package com.fastalert.core.notify.notifier.pushover;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.MultipartBody;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.BoundaryGenerator;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.template.Truncations;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Pushover 消息 API, multipart 表单
 * 优先级 2 (emergency) 时附带 retry 与 expire; 最多附加一张本地截图
 */
@Slf4j
public class PushoverNotifier implements Notifier {

    public static final String TYPE = "pushover";

    static final String ENDPOINT = "https://api.pushover.net/1/messages.json";

    static final int MAX_FILE_SIZE = 1 << 21;
    static final int MAX_TITLE_LEN_RUNES = 250;
    static final int MAX_MESSAGE_LEN_RUNES = 1024;
    static final int MAX_URL_LEN_RUNES = 512;

    static final long EMERGENCY_PRIORITY = 2;

    private final ReceiverMetadata meta;

    private final PushoverConfig conf;

    private final TemplateRenderer renderer;

    private final WebhookSender sender;

    private final Images images;

    private final BoundaryGenerator boundaries;

    private final Clock clock;

    public PushoverNotifier(ReceiverMetadata meta, PushoverConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.boundaries = deps.getBoundaryGenerator();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        String key = ctx.getGroupKey().hash();

        MultipartBody body = new MultipartBody(boundaries.next());
        body.field("user", tmpl.expand(conf.getUserKey()));
        body.field("token", conf.getApiToken());

        String title = truncate(tmpl.expand(conf.getTitle()), MAX_TITLE_LEN_RUNES, "title", key);
        String message = truncate(tmpl.expand(conf.getMessage()), MAX_MESSAGE_LEN_RUNES, "message", key).trim();
        if (message.isEmpty()) {
            message = "(no details)";
        }
        String url = truncate(UrlPaths.join(tmpl.externalUrl(), "/alerting/list"), MAX_URL_LEN_RUNES, "URL", key);

        long priority = group.isResolved() ? conf.getOkPriority() : conf.getAlertingPriority();
        body.field("priority", Long.toString(priority));
        if (priority == EMERGENCY_PRIORITY) {
            body.field("retry", Long.toString(conf.getRetry()));
            body.field("expire", Long.toString(conf.getExpire()));
        }
        if (!conf.getDevice().isEmpty()) {
            body.field("device", tmpl.expand(conf.getDevice()));
        }
        body.field("title", title);
        body.field("url", url);
        body.field("url_title", "Show alert rule");
        body.field("message", message);

        if (conf.isUpload()) {
            images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
                if (!image.hasContent()) {
                    return true;
                }
                if (image.getContent().length > MAX_FILE_SIZE) {
                    log.warn("[Notify-pushover] receiver={} image exceeds maximum file size: {}", name(), image.getContent().length);
                    return true;
                }
                body.file("attachment", image.getFileName(), image.getContent());
                return false;
            });
        }

        String sound = tmpl.expand(group.isResolved() ? conf.getOkSound() : conf.getAlertingSound());
        if (!"default".equals(sound)) {
            body.field("sound", sound);
        }
        body.field("html", "1");
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(ENDPOINT)
                .header("Content-Type", body.contentType())
                .body(body.build())
                .build());
    }

    private String truncate(String s, int maxRunes, String field, String key) {
        Truncations.Truncated t = Truncations.inRunes(s, maxRunes);
        if (t.truncated()) {
            log.warn("[Notify-pushover] receiver={} truncated {}, key={}, max_runes={}", name(), field, key, maxRunes);
        }
        return t.value();
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
