package com.fastdispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 告警分发引擎配置, 前缀 dispatch
 *
 * <pre>
 * dispatch:
 *   wheel:
 *     tick: 50ms
 *     slots: 256
 *   flush:
 *     core-pool-size: 4
 *     max-pool-size: 16
 *     rejected-handler: abort
 *   default-route:
 *     receiver: ops
 *     group-by: [alertname]
 *   routes:
 *     - name: db
 *       receiver: dba
 *       match: { team: db }
 *       group-by: [alertname, instance]
 *       group-wait: 10s
 *       repeat-interval: 1h
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dispatch")
public class AlertDispatchProperties {

    /** 关闭后不启动接收循环, 其余 Bean 照常装配 */
    private boolean enabled = true;

    /** 各分组的 groupWait/groupInterval 定时共用一个时间轮 */
    private Wheel wheel = new Wheel();

    private Cleanup cleanup = new Cleanup();

    /** 执行 flush 的线程池 */
    private FlushPool flush = new FlushPool();

    private Shutdown shutdown = new Shutdown();

    /** 单次 flush 上下文的最短生存期 */
    private Duration minFlushTimeout = Duration.ofSeconds(10);

    /** 无路由命中时使用 */
    private RouteConfig defaultRoute = new RouteConfig();

    /** 按声明顺序匹配, 一条告警可命中多条路由 */
    private List<RouteConfig> routes = new ArrayList<>();

    @Data
    public static class Wheel {
        /** 定时精度, 分组等待一般为秒级 */
        private Duration tick = Duration.ofMillis(50);
        private int slots = 256;
        /** 超出后 newTimeout 抛 RejectedExecutionException, 0 不限制 */
        private long maxPending = 0;
    }

    @Data
    public static class Cleanup {
        private Duration initialDelay = Duration.ofSeconds(30);
        /** 两次清理之间的固定间隔 */
        private Duration period = Duration.ofSeconds(30);
    }

    @Data
    public static class FlushPool {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 1024;
        private Duration keepAlive = Duration.ofSeconds(60);
        /** 被拒绝的 flush 由分组在下一个间隔重试, 提交方是时间轮线程, 不提供 CALLER_RUNS */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.ABORT;
    }

    @Data
    public static class Shutdown {
        /** 等待在途 flush 结束的上限 */
        private Duration await = Duration.ofSeconds(30);
    }

    @Data
    public static class RouteConfig {
        private String name = "default";
        private String receiver = "default";
        /** 等值匹配, 全部满足才命中 */
        private Map<String, String> match = new LinkedHashMap<>();
        private Set<String> groupBy = new LinkedHashSet<>();
        private Duration groupWait = Duration.ofSeconds(30);
        private Duration groupInterval = Duration.ofMinutes(5);
        private Duration repeatInterval = Duration.ofHours(4);
    }

    public enum RejectedHandlerPolicy {
        ABORT, DISCARD_OLDEST;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }
}
