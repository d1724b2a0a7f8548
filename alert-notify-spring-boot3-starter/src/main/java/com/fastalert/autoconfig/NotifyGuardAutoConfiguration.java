package com.fastalert.autoconfig;

import com.fastalert.config.NotifyGuardProperties;
import com.fastalert.core.guard.GuardedNotifyExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        NotifyGuardProperties.class
})
public class NotifyGuardAutoConfiguration {

    /**
     * 通知调用统一保护入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedNotifyExecutor guardedNotifyExecutor(NotifyGuardProperties props) {
        return new GuardedNotifyExecutor(props);
    }
}
