package com.fastalert.core.notify.notifier.dingding;

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
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 钉钉机器人 webhook
 * 消息链接使用 dingtalk:// 协议在客户端侧边栏打开告警列表
 */
@Slf4j
public class DingDingNotifier implements Notifier {

    public static final String TYPE = "dingding";

    static final String CLIENT_LINK = "dingtalk://dingtalkclient/page/link?";

    private final ReceiverMetadata meta;

    private final DingDingConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Clock clock;

    public DingDingNotifier(ReceiverMetadata meta, DingDingConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-dingding] receiver={} executing notification", name());
        TemplateExpander tmpl = renderer.newExpander(ctx, NotifySupport.group(ctx, alerts, clock));

        Map<String, String> query = new LinkedHashMap<>();
        query.put("pc_slide", "false");
        query.put("url", UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));
        String link = CLIENT_LINK + UrlPaths.form(query);

        String message = tmpl.expand(conf.getMessage());
        String title = tmpl.expand(conf.getTitle());
        String msgType = tmpl.expand(conf.getMessageType());

        ObjectNode body = serializer.createObjectNode();
        if (DingDingConfig.MSG_TYPE_ACTION_CARD.equals(msgType)) {
            body.put("msgtype", DingDingConfig.MSG_TYPE_ACTION_CARD);
            ObjectNode card = body.putObject("actionCard");
            card.put("text", message);
            card.put("title", title);
            card.put("singleTitle", "More");
            card.put("singleURL", link);
        } else {
            body.put("msgtype", DingDingConfig.MSG_TYPE_LINK);
            ObjectNode l = body.putObject("link");
            l.put("text", message);
            l.put("title", title);
            l.put("messageUrl", link);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);

        sender.send(WebhookRequest.builder()
                .url(tmpl.expandOrRaw(conf.getUrl()))
                .header("Content-Type", "application/json")
                .body(serializer.serialize(body))
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
