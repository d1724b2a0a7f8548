package com.fastalert.core.notify.notifier.kafka;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.notify.WebhookSender;
import com.fastalert.core.receiver.PasswordSource;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Kafka REST Proxy
 * v2 与 v3 由配置选择; v3 除 HTTP 状态外还需校验响应体中的 error_code
 * 配置了密码文件时, 失败后刷新密码并再发送一次, 最多两次
 */
@Slf4j
public class KafkaNotifier implements Notifier {

    public static final String TYPE = "kafka";

    static final int MAX_ATTEMPTS = 2;

    static final String V2_CONTENT_TYPE = "application/vnd.kafka.json.v2+json";
    static final String V2_ACCEPT = "application/vnd.kafka.v2+json";

    static final String STATE_ALERTING = "alerting";
    static final String STATE_OK = "ok";

    private final ReceiverMetadata meta;

    private final KafkaConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final WebhookSender sender;

    private final Images images;

    private final PasswordSource passwordSource;

    private final Clock clock;

    // 可能被刷新, 同一接收器的并发调用共享
    private volatile String password;

    public KafkaNotifier(ReceiverMetadata meta, KafkaConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.sender = deps.webhookSender();
        this.images = deps.getImages();
        this.passwordSource = deps.getPasswordSource();
        this.clock = deps.getClock();
        this.password = initialPassword(conf, passwordSource);
    }

    /**
     * 未配置密码时在构建阶段从文件读取一次
     */
    private static String initialPassword(KafkaConfig conf, PasswordSource source) {
        if (!conf.getPassword().isEmpty() || !conf.canRefreshPassword()) {
            return conf.getPassword();
        }
        try {
            return source.read(conf.getPasswordFilePath());
        } catch (IOException e) {
            throw new ReceiverConfigException("failed to read password from file: " + e.getMessage(), e);
        }
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        TemplateExpander tmpl = renderer.newExpander(ctx, group);

        String topic = tmpl.expand(conf.getTopic());
        KafkaRecord record = buildRecord(tmpl, group, ctx.getGroupKey().hash());
        NotifySupport.warnTemplateErrors(this, tmpl);

        WebhookRequest request = conf.isV3() ? v3Request(topic, record) : v2Request(topic, record);
        boolean retryOnFailure = conf.canRefreshPassword();

        NotifyException last = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            if (attempt > 0) {
                if (!retryOnFailure) {
                    break;
                }
                log.debug("[Notify-kafka] receiver={} retrying with a refreshed password", name());
                refreshPassword();
            }
            try {
                send(request);
                return;
            } catch (NotifyException e) {
                log.warn("[Notify-kafka] receiver={} failed to send notification, attempt={}, err={}", name(), attempt + 1, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private void send(WebhookRequest request) throws NotifyException {
        WebhookRequest.WebhookRequestBuilder builder = request.toBuilder();
        if (conf.isBasicAuth()) {
            builder.user(conf.getUsername()).password(password);
        }
        WebhookResponse resp = sender.send(builder.build());
        if (conf.isV3()) {
            checkV3Response(resp);
        }
    }

    void checkV3Response(WebhookResponse resp) throws NotifyException {
        JsonNode body;
        try {
            body = serializer.readTree(resp.body());
        } catch (IllegalStateException e) {
            throw NotifyException.permanent("failed to parse kafka v3 response", e);
        }
        JsonNode code = body == null ? null : body.get("error_code");
        if (code == null || !code.canConvertToInt()) {
            throw NotifyException.permanent("kafka v3 response has no error_code: " + resp.bodyAsString());
        }
        int errorCode = code.asInt();
        if (errorCode < 200 || errorCode >= 300) {
            String message = body.path("message").asText("");
            throw new NotifyException(String.format("kafka v3 produce failed with error_code %d: %s", errorCode, message),
                    errorCode >= 500 || errorCode == 429);
        }
    }

    private void refreshPassword() throws NotifyException {
        try {
            password = passwordSource.read(conf.getPasswordFilePath());
        } catch (IOException e) {
            throw NotifyException.permanent("failed to read password from file: " + e.getMessage(), e);
        }
    }

    KafkaRecord buildRecord(TemplateExpander tmpl, AlertGroup group, String hash) {
        KafkaRecord record = new KafkaRecord();
        record.setClient("Grafana");
        record.setDescription(tmpl.expand(conf.getDescription()));
        record.setDetails(tmpl.expand(conf.getDetails()));
        record.setAlertState(group.isResolved() ? STATE_OK : STATE_ALERTING);
        record.setClientUrl(UrlPaths.join(tmpl.externalUrl(), "/alerting/list"));
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasUrl()) {
                record.getContexts().add(new KafkaRecord.Context("image", image.getUrl()));
            }
            return true;
        });
        record.setIncidentKey(hash);
        log.debug("[Notify-kafka] receiver={} alert_state={}", name(), record.getAlertState());
        return record;
    }

    private WebhookRequest v2Request(String topic, KafkaRecord record) {
        ObjectNode body = serializer.createObjectNode();
        body.putArray("records").addObject().set("value", serializer.valueToTree(record));
        return WebhookRequest.builder()
                .url(conf.getEndpoint() + "/topics/" + topic)
                .header("Content-Type", V2_CONTENT_TYPE)
                .header("Accept", V2_ACCEPT)
                .body(serializer.serialize(body))
                .build();
    }

    private WebhookRequest v3Request(String topic, KafkaRecord record) {
        ObjectNode body = serializer.createObjectNode();
        ObjectNode value = body.putObject("value");
        value.put("type", "JSON");
        value.set("data", serializer.valueToTree(record));
        return WebhookRequest.builder()
                .url(conf.getEndpoint() + "/v3/clusters/" + conf.getClusterId() + "/topics/" + topic + "/records")
                .header("Content-Type", "application/json")
                .body(serializer.serialize(body))
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
