package com.fastdispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * dispatch:
 *   guard:
 *     circuit-breaker:
 *       failure-rate-threshold: 50
 *       sliding-window-size: 20
 *       wait-duration-in-open-state: 60s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 20
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 10
 *       limit-refresh-period: 1s
 *     cb-per-receiver:
 *       pager: { failure-rate-threshold: 30, wait-duration-in-open-state: 30s }
 */
@Data
@ConfigurationProperties(prefix = "dispatch.guard")
public class DispatchGuardProperties {

    /** 默认配置（可被 receiver 覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按 receiver 覆盖 */
    private Map<String, CbConfig> cbPerReceiver;
    private Map<String, BhConfig> bhPerReceiver;
    private Map<String, RlConfig> rlPerReceiver;

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);
        private int permittedNumberOfCallsInHalfOpenState = 2;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 20;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 10;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(0);
    }
}
