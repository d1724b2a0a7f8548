package com.fastalert.core.notify.notifier.mqtt;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.MqttClient;
import com.fastalert.core.spi.transport.MqttClientFactory;
import com.fastalert.core.spi.transport.MqttConnectSpec;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * MQTT 发布
 * 每次通知建立连接, 发布一条消息后断开; 连接与发布失败都不重试
 */
@Slf4j
public class MqttNotifier implements Notifier {

    public static final String TYPE = "mqtt";

    static final String PROTOCOL_VERSION = "1";

    private final ReceiverMetadata meta;

    private final MqttConfig conf;

    private final TemplateRenderer renderer;

    private final PayloadSerializer serializer;

    private final MqttClientFactory clients;

    private final Clock clock;

    public MqttNotifier(ReceiverMetadata meta, MqttConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.serializer = deps.getSerializer();
        this.clients = deps.getMqttClientFactory();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        log.debug("[Notify-mqtt] receiver={} topic={} qos={} retain={}", name(), conf.getTopic(), conf.getQos(), conf.isRetain());
        byte[] payload = buildMessage(ctx, NotifySupport.group(ctx, alerts, clock));

        MqttClient client = clients.newClient();
        try {
            client.connect(MqttConnectSpec.builder()
                    .brokerUrl(conf.getBrokerUrl())
                    .clientId(conf.getClientId())
                    .username(conf.getUsername())
                    .password(conf.getPassword())
                    .tls(conf.getTls())
                    .build());
        } catch (IOException e) {
            throw NotifyException.permanent("Failed to connect to MQTT broker: " + e.getMessage(), e);
        }
        try {
            client.publish(conf.getTopic(), payload, conf.getQos(), conf.isRetain());
        } catch (IOException e) {
            throw NotifyException.permanent("Failed to publish MQTT message: " + e.getMessage(), e);
        } finally {
            disconnect(client);
        }
    }

    private void disconnect(MqttClient client) {
        try {
            client.disconnect();
        } catch (IOException e) {
            log.error("[Notify-mqtt] receiver={} failed to disconnect from MQTT broker", name(), e);
        }
    }

    byte[] buildMessage(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        String text = tmpl.expand(conf.getMessage());
        NotifySupport.warnTemplateErrors(this, tmpl);
        if (!conf.isJson()) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        ObjectNode msg = (ObjectNode) serializer.valueToTree(tmpl.data());
        msg.put("version", PROTOCOL_VERSION);
        msg.put("groupKey", ctx.getGroupKey().value());
        msg.put("message", text);
        return serializer.serialize(msg);
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
