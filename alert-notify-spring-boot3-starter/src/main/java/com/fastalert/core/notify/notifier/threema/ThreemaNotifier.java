package com.fastalert.core.notify.notifier.threema;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Threema Gateway, send_simple 接口
 */
@Slf4j
public class ThreemaNotifier implements Notifier {

    public static final String TYPE = "threema";

    static final String API_URL = "https://msgapi.threema.ch/send_simple";

    private final ReceiverMetadata meta;

    private final ThreemaConfig conf;

    private final TemplateRenderer renderer;

    private final WebhookSender sender;

    private final Images images;

    private final Clock clock;

    public ThreemaNotifier(ReceiverMetadata meta, ThreemaConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-threema] receiver={} from={} to={}", name(), conf.getGatewayId(), conf.getRecipientId());
        Map<String, String> form = new LinkedHashMap<>();
        form.put("from", conf.getGatewayId());
        form.put("to", conf.getRecipientId());
        form.put("secret", conf.getApiSecret());
        form.put("text", buildMessage(ctx, NotifySupport.group(ctx, alerts, clock)));

        sender.send(WebhookRequest.builder()
                .url(API_URL)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .body(UrlPaths.form(form))
                .build());
    }

    String buildMessage(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        StringBuilder sb = new StringBuilder();
        sb.append(group.isResolved() ? "✅ " : "⚠️ ")
                .append(tmpl.expand(conf.getTitle()))
                .append("\n\n*Message:*\n")
                .append(tmpl.expand(conf.getDescription()))
                .append("\n*URL:* ")
                .append(UrlPaths.join(tmpl.externalUrl(), "/alerting/list"))
                .append('\n');
        NotifySupport.warnTemplateErrors(this, tmpl);
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasUrl()) {
                sb.append("*Image:* ").append(image.getUrl()).append('\n');
            }
            return true;
        });
        return sb.toString();
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
