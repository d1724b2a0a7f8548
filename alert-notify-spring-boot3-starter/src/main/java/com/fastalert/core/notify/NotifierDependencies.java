package com.fastalert.core.notify;

import com.fastalert.core.receiver.PasswordSource;
import com.fastalert.core.serializer.JacksonPayloadSerializer;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.image.ImageProvider;
import com.fastalert.core.spi.transport.BoundaryGenerator;
import com.fastalert.core.spi.transport.MqttClientFactory;
import com.fastalert.core.spi.transport.SnsClientFactory;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.template.NamedTemplates;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.transport.AwsSnsClientFactory;
import com.fastalert.core.transport.PahoMqttClientFactory;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;

/**
 * Notifier 构造时注入的协作者
 */
@Getter
@Builder(toBuilder = true)
public class NotifierDependencies {

    private final Transport transport;

    private final TemplateRenderer renderer;

    @Builder.Default
    private final PayloadSerializer serializer = new JacksonPayloadSerializer();

    @Builder.Default
    private final Images images = Images.of(ImageProvider.unavailable());

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    @Builder.Default
    private final BoundaryGenerator boundaryGenerator = BoundaryGenerator.random();

    @Builder.Default
    private final MqttClientFactory mqttClientFactory = new PahoMqttClientFactory();

    @Builder.Default
    private final SnsClientFactory snsClientFactory = new AwsSnsClientFactory();

    @Builder.Default
    private final PasswordSource passwordSource = PasswordSource.files();

    @Builder.Default
    private final String appVersion = "1.0.0";

    /**
     * 使用内置模板与默认序列化器
     */
    public static NotifierDependencies of(Transport transport, String externalUrl) {
        JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();
        return NotifierDependencies.builder()
                .transport(transport)
                .serializer(serializer)
                .renderer(new TemplateRenderer(NamedTemplates.defaults(), serializer, externalUrl))
                .build();
    }

    public WebhookSender webhookSender() {
        return new WebhookSender(transport);
    }
}
