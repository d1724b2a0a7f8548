package com.fastalert.core.notify.notifier.telegram;

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
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Telegram Bot API
 * 先 sendMessage, 再为每张带内容的截图 sendPhoto; 截图上传失败只记日志
 */
@Slf4j
public class TelegramNotifier implements Notifier {

    public static final String TYPE = "telegram";

    static final String API_URL = "https://api.telegram.org/bot%s/%s";

    static final int MAX_MESSAGE_LEN_RUNES = 4096;

    private final ReceiverMetadata meta;

    private final TelegramConfig conf;

    private final TemplateRenderer renderer;

    private final WebhookSender sender;

    private final Images images;

    private final BoundaryGenerator boundaries;

    private final Clock clock;

    public TelegramNotifier(ReceiverMetadata meta, TelegramConfig conf, NotifierDependencies deps) {
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
        Truncations.Truncated text = Truncations.inRunes(tmpl.expand(conf.getMessage()), MAX_MESSAGE_LEN_RUNES);
        if (text.truncated()) {
            log.warn("[Notify-telegram] receiver={} truncated message, key={}, max_runes={}", name(), ctx.getGroupKey().hash(), MAX_MESSAGE_LEN_RUNES);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);

        MultipartBody body = newBody().field("text", text.value());
        if (!conf.getParseMode().isEmpty()) {
            body.field("parse_mode", conf.getParseMode());
        }
        if (conf.isDisableNotifications()) {
            body.field("disable_notification", "true");
        }
        try {
            sender.send(request("sendMessage", body));
        } catch (NotifyException e) {
            throw new NotifyException("failed to send telegram message: " + e.getMessage(), e.isRetryable(), e);
        }

        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (!image.hasContent()) {
                return true;
            }
            try {
                sender.send(request("sendPhoto", newBody().file("photo", image.getFileName(), image.getContent())));
            } catch (NotifyException e) {
                log.warn("[Notify-telegram] receiver={} failed to upload image to telegram, alert={}, err={}", name(), alert.name(), e.getMessage());
            }
            return true;
        });
    }

    private MultipartBody newBody() {
        return new MultipartBody(boundaries.next()).field("chat_id", conf.getChatId());
    }

    private WebhookRequest request(String action, MultipartBody body) {
        return WebhookRequest.builder()
                .url(String.format(API_URL, conf.getBotToken(), action))
                .header("Content-Type", body.contentType())
                .body(body.build())
                .build();
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
