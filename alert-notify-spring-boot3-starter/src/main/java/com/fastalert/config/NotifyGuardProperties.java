package com.fastalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * fast-alert:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-rate-threshold: 60
 *       sliding-window-size: 50
 *       wait-duration-in-open-state: 30s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 20
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 10
 *       limit-refresh-period: 1s
 *     cb-per-type:
 *       jira: { failure-rate-threshold: 30, wait-duration-in-open-state: 60s }
 */
@Data
@ConfigurationProperties(prefix = "fast-alert.guard")
public class NotifyGuardProperties {
    /** 总开关, 关闭时不做任何装饰 */
    private boolean enabled = false;

    /** 默认配置（可被接收器类型覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按接收器类型覆盖 */
    private Map<String, CbConfig> cbPerType;
    private Map<String, BhConfig> bhPerType;
    private Map<String, RlConfig> rlPerType;

    public interface Toggle {
        boolean isEnabled();
    }

    @Data
    public static class CbConfig implements Toggle {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(10);
        private int slidingWindowSize = 50;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedNumberOfCallsInHalfOpenState = 5;
    }

    @Data
    public static class BhConfig implements Toggle {
        private boolean enabled = false;
        private int maxConcurrentCalls = 50;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig implements Toggle {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 20;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(0);
    }
}
