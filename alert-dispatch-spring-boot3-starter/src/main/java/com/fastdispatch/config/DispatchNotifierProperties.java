package com.fastdispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 通知投递配置
 */
@Data
@ConfigurationProperties(prefix = "dispatch.notify")
public class DispatchNotifierProperties {

    /** 并行调用通知器的线程池 */
    private Async async = new Async();

    /** 同一 接收者+分组 的通知节流 */
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Async {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        /** 排队满后直接拒绝, 由 flush 记为失败 */
        private int queueCapacity = 2000;
        private Duration keepAlive = Duration.ofSeconds(60);
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        /** 统计窗口 */
        private Duration window = Duration.ofMinutes(1);
        /** 窗口内最多放行次数, 超出的 flush 被抑制 */
        private int threshold = 30;
    }
}
