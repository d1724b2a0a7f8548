package com.fastalert.autoconfig;

import com.fastalert.config.AlertNotifyProperties;
import com.fastalert.core.guard.GuardedNotifyExecutor;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.BuiltinNotifierFactories;
import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotificationDispatcher;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.ReceiverRegistry;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.receiver.SecureSettingsDecryptor;
import com.fastalert.core.serializer.JacksonPayloadSerializer;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.image.ImageProvider;
import com.fastalert.core.spi.notify.NotifierFactory;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.template.NamedTemplates;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.transport.RestTemplateTransport;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = {
        NotifyGuardAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class,
        NotifyMetricsAutoConfiguration.class
})
@EnableConfigurationProperties(AlertNotifyProperties.class)
public class AlertNotifyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 应用提供 JavaMailSender 时才能发送邮件
     */
    @Bean
    @ConditionalOnMissingBean(Transport.class)
    public Transport alertTransport(AlertNotifyProperties props, ObjectProvider<JavaMailSender> mailSender) {
        AlertNotifyProperties.Http http = props.getHttp();
        return new RestTemplateTransport(
                RestTemplateTransport.defaultRestTemplate(http.getConnectTimeout(), http.getReadTimeout()),
                mailSender.getIfAvailable(),
                props.getMail().getFrom());
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer(AlertNotifyProperties props, PayloadSerializer serializer) {
        return new TemplateRenderer(new NamedTemplates(props.getTemplates()), serializer, props.getExternalUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifierDependencies notifierDependencies(AlertNotifyProperties props,
                                                     Transport transport,
                                                     TemplateRenderer renderer,
                                                     PayloadSerializer serializer,
                                                     ObjectProvider<ImageProvider> imageProvider) {
        return NotifierDependencies.builder()
                .transport(transport)
                .renderer(renderer)
                .serializer(serializer)
                .images(Images.of(imageProvider.getIfAvailable(ImageProvider::unavailable)))
                .appVersion(props.getAppVersion())
                .build();
    }

    /**
     * 内置实现之后追加应用自定义的 NotifierFactory, 同类型时覆盖内置实现
     * 配置中的接收器在启动时逐个初始化, 任何配置错误都会使启动失败
     */
    @Bean
    @ConditionalOnMissingBean
    public ReceiverRegistry receiverRegistry(AlertNotifyProperties props,
                                             NotifierDependencies deps,
                                             PayloadSerializer serializer,
                                             FailureDecider decider,
                                             GuardedNotifyExecutor guard,
                                             NotifyMetrics metrics,
                                             ObjectProvider<NotifierFactory> customFactories) {
        List<NotifierFactory> factories = new ArrayList<>(BuiltinNotifierFactories.all());
        factories.addAll(customFactories.orderedStream().collect(Collectors.toList()));
        ReceiverRegistry registry = new ReceiverRegistry(factories, deps, decider, guard, metrics);
        for (AlertNotifyProperties.Receiver r : props.getReceivers()) {
            ReceiverMetadata meta = ReceiverMetadata.builder()
                    .uid(r.getUid() == null ? UUID.randomUUID().toString() : r.getUid())
                    .name(r.getName())
                    .type(r.getType())
                    .disableResolveMessage(r.isDisableResolveMessage())
                    .build();
            registry.register(meta, serializer.valueToTree(r.getSettings()), new SecureSettingsDecryptor(r.getSecureSettings()));
        }
        return registry;
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "alertDispatchExecutor")
    public ExecutorService alertDispatchExecutor(AlertNotifyProperties props) {
        AlertNotifyProperties.Dispatch cfg = props.getDispatch();
        return new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                new NamedThreadFactory("alert-notify"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(@Qualifier("alertDispatchExecutor") ExecutorService alertDispatchExecutor) {
        return new NotificationDispatcher(alertDispatchExecutor);
    }
}
