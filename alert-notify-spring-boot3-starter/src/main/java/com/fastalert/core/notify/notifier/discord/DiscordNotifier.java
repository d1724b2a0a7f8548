package com.fastalert.core.notify.notifier.discord;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.MultipartBody;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Discord webhook
 * 截图以额外的 embed 附加, 只有本地内容的截图以 multipart 上传
 */
@Slf4j
public class DiscordNotifier implements Notifier {

    public static final String TYPE = "discord";

    static final int MAX_EMBEDS = 10;
    static final int MAX_MESSAGE_LEN_RUNES = 2000;

    private final ReceiverMetadata meta;

    private final DiscordConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final BoundaryGenerator boundaries;

    private final Clock clock;

    private final String appVersion;

    public DiscordNotifier(ReceiverMetadata meta, DiscordConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.boundaries = deps.getBoundaryGenerator();
        this.clock = deps.getClock();
        this.appVersion = deps.getAppVersion();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        ObjectNode msg = serializer.createObjectNode();
        if (!conf.isUseDiscordUsername()) {
            msg.put("username", "Grafana");
        }
        Truncations.Truncated content = Truncations.inRunes(tmpl.expand(conf.getMessage()), MAX_MESSAGE_LEN_RUNES);
        if (content.truncated()) {
            log.warn("[Notify-discord] receiver={} truncated content, key={}, max_runes={}", name(), ctx.getGroupKey().hash(), MAX_MESSAGE_LEN_RUNES);
        }
        msg.put("content", content.value());
        if (!conf.getAvatarUrl().isEmpty()) {
            msg.put("avatar_url", tmpl.expandOrRaw(conf.getAvatarUrl()));
        }

        long color = Long.parseLong(NotifySupport.statusColor(group).substring(1), 16);
        ArrayNode embeds = msg.putArray("embeds");
        ObjectNode link = embeds.addObject();
        link.put("title", tmpl.expand(conf.getTitle()));
        ObjectNode footer = link.putObject("footer");
        footer.put("text", "Grafana v" + appVersion);
        footer.put("icon_url", NotifySupport.FOOTER_ICON_URL);
        link.put("type", "rich");
        link.put("color", color);
        link.put("url", UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));

        List<Upload> uploads = new ArrayList<>();
        int[] quota = {MAX_EMBEDS - 1};
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (quota[0] < 1) {
                return false;
            }
            String url;
            if (image.hasUrl()) {
                url = image.getUrl();
            } else if (image.hasContent()) {
                url = "attachment://" + image.getFileName();
                uploads.add(new Upload(image.getFileName(), image.getContent()));
            } else {
                return true;
            }
            ObjectNode embed = embeds.addObject();
            embed.putObject("image").put("url", url);
            embed.put("color", color);
            embed.put("title", alert.name());
            quota[0]--;
            return true;
        });
        NotifySupport.warnTemplateErrors(this, tmpl);

        String url = tmpl.expandOrRaw(conf.getWebhookUrl());
        byte[] json = serializer.serialize(msg);
        WebhookRequest.WebhookRequestBuilder request = WebhookRequest.builder().url(url);
        if (uploads.isEmpty()) {
            request.header("Content-Type", "application/json").body(json);
        } else {
            MultipartBody body = new MultipartBody(boundaries.next());
            body.field("payload_json", new String(json, StandardCharsets.UTF_8));
            for (Upload u : uploads) {
                body.file("", u.fileName, u.content);
            }
            request.header("Content-Type", body.contentType()).body(body.build());
        }
        sender.send(request.build());
    }

    private static final class Upload {
        private final String fileName;
        private final byte[] content;

        Upload(String fileName, byte[] content) {
            this.fileName = fileName;
            this.content = content;
        }
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
