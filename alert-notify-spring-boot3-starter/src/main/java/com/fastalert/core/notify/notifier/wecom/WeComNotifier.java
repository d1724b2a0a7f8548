package com.fastalert.core.notify.notifier.wecom;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 企业微信, 群机器人或应用消息
 * 应用模式的 access_token 在过期前 300 秒内视为失效; 并发刷新只发起一次请求, 其余调用方等待同一结果
 */
@Slf4j
public class WeComNotifier implements Notifier {

    public static final String TYPE = "wecom";

    static final long TOKEN_EXPIRY_MARGIN_SECONDS = 300;

    private final ReceiverMetadata meta;

    private final WeComConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Clock clock;

    private final Object tokenLock = new Object();

    private volatile AccessToken token;

    // guarded by tokenLock
    private CompletableFuture<AccessToken> inflight;

    public WeComNotifier(ReceiverMetadata meta, WeComConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.info("[Notify-wecom] receiver={} executing notification", name());
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        String title = tmpl.expand(conf.getTitle());
        String message = tmpl.expand(conf.getMessage());
        String content = WeComConfig.MSG_TYPE_MARKDOWN.equals(conf.getMsgType())
                ? "# " + title + "\n" + message + "\n"
                : title + "\n" + message + "\n";
        NotifySupport.warnTemplateErrors(this, tmpl);

        ObjectNode body = serializer.createObjectNode();
        body.put("msgtype", conf.getMsgType());
        body.putObject(conf.getMsgType()).put("content", content);

        String url = conf.getUrl();
        if (conf.isApiApp()) {
            body.put("agentid", conf.getAgentId());
            body.put("touser", conf.getToUser());
            url = conf.getEndpointUrl() + "/cgi-bin/message/send?access_token=" + UrlPaths.queryEscape(accessToken());
        }

        WebhookResponse resp = sender.send(WebhookRequest.builder()
                .url(url)
                .header("Content-Type", "application/json")
                .body(serializer.serialize(body))
                .build());
        JsonNode result = parse(resp);
        int errCode = result.path("errcode").asInt(0);
        if (errCode != 0) {
            throw NotifyException.retryable("WeCom returned errcode " + errCode + ": " + result.path("errmsg").asText(""));
        }
    }

    String accessToken() throws NotifyException {
        AccessToken current = token;
        if (current != null && current.isValid(clock.instant())) {
            return current.value;
        }
        CompletableFuture<AccessToken> future;
        boolean owner = false;
        synchronized (tokenLock) {
            current = token;
            if (current != null && current.isValid(clock.instant())) {
                return current.value;
            }
            if (inflight == null) {
                inflight = new CompletableFuture<>();
                owner = true;
            }
            future = inflight;
        }
        if (owner) {
            try {
                AccessToken fetched = fetchToken();
                token = fetched;
                future.complete(fetched);
            } catch (NotifyException | RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                synchronized (tokenLock) {
                    inflight = null;
                }
            }
        }
        try {
            return future.get().value;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NotifyException) {
                throw (NotifyException) e.getCause();
            }
            throw NotifyException.retryable("failed to get WeCom access token: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NotifyException.retryable("interrupted while waiting for WeCom access token", e);
        }
    }

    private AccessToken fetchToken() throws NotifyException {
        log.debug("[Notify-wecom] receiver={} fetching access token", name());
        WebhookResponse resp = sender.send(WebhookRequest.builder()
                .url(conf.getEndpointUrl() + "/cgi-bin/gettoken?corpid=" + UrlPaths.queryEscape(conf.getCorpId())
                        + "&corpsecret=" + UrlPaths.queryEscape(conf.getSecret()))
                .header("Content-Type", "application/json")
                .header("User-Agent", "Grafana")
                .build());
        JsonNode body = parse(resp);
        int errCode = body.path("errcode").asInt(0);
        if (errCode != 0) {
            throw NotifyException.retryable("WeCom returned errmsg: " + body.path("errmsg").asText(""));
        }
        String value = body.path("access_token").asText("");
        if (value.isEmpty()) {
            throw NotifyException.retryable("WeCom returned no access_token");
        }
        long expiresIn = body.path("expires_in").asLong(0);
        return new AccessToken(value, clock.instant().plusSeconds(expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS));
    }

    private JsonNode parse(WebhookResponse resp) throws NotifyException {
        try {
            return serializer.readTree(resp.body());
        } catch (IllegalStateException e) {
            throw NotifyException.retryable("failed to parse WeCom response: " + resp.bodyAsString(), e);
        }
    }

    private static final class AccessToken {
        private final String value;
        private final Instant expiresAt;

        AccessToken(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isValid(Instant now) {
            return now.isBefore(expiresAt);
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
