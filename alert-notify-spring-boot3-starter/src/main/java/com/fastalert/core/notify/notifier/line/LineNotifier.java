package com.fastalert.core.notify.notifier.line;

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
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * LINE Notify, 表单提交
 */
@Slf4j
public class LineNotifier implements Notifier {

    public static final String TYPE = "line";

    static final String NOTIFY_URL = "https://notify-api.line.me/api/notify";

    private final ReceiverMetadata meta;

    private final LineConfig conf;

    private final TemplateRenderer renderer;

    private final WebhookSender sender;

    private final Clock clock;

    public LineNotifier(ReceiverMetadata meta, LineConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-line] receiver={} executing notification", name());
        TemplateExpander tmpl = renderer.newExpander(ctx, NotifySupport.group(ctx, alerts, clock));
        String message = tmpl.expand(conf.getTitle()) + "\n"
                + UrlPaths.join(tmpl.externalUrl(), "/alerting/list") + "\n\n"
                + tmpl.expand(conf.getDescription());
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(NOTIFY_URL)
                .bearerToken(conf.getToken())
                .header("Content-Type", "application/x-www-form-urlencoded;charset=UTF-8")
                .body(UrlPaths.form(Map.of("message", message)))
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
