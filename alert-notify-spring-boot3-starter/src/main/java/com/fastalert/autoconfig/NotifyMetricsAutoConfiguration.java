package com.fastalert.autoconfig;

import com.fastalert.core.metric.NotifyMeterRegistryProvider;
import com.fastalert.core.metric.NotifyMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class NotifyMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public NotifyMeterRegistryProvider notifyMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        // 应用未引入 actuator 时为空, 由 provider 兜底
        return new NotifyMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyMetrics notifyMetrics(NotifyMeterRegistryProvider provider) {
        return NotifyMetrics.create(provider.getRegistry());
    }
}
