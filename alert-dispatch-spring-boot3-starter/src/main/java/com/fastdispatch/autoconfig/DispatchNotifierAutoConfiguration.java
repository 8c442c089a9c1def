package com.fastdispatch.autoconfig;

import com.fastdispatch.config.DispatchNotifierProperties;
import com.fastdispatch.core.handler.GuardedNotifierExecutor;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.notify.NotifyingPipeline;
import com.fastdispatch.core.notify.notifier.LoggingNotifier;
import com.fastdispatch.core.notify.ratelimit.RateLimitFilter;
import com.fastdispatch.core.notify.route.ReceiverRouter;
import com.fastdispatch.core.spi.notify.Notifier;
import com.fastdispatch.core.spi.notify.NotifierFilter;
import com.fastdispatch.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration
@EnableConfigurationProperties(DispatchNotifierProperties.class)
public class DispatchNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(@Qualifier("loggingNotifier") Notifier logging) {
        return new ReceiverRouter(List.of(logging));
    }

    @Bean
    @ConditionalOnMissingBean(NotifierFilter.class)
    @ConditionalOnProperty(prefix = "dispatch.notify.rate-limit", name = "enabled", matchIfMissing = true)
    public NotifierFilter rateLimitFilter(DispatchNotifierProperties props) {
        return new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
    }

    @Bean("dispatchNotifyExecutor")
    public ExecutorService dispatchNotifyExecutor(DispatchNotifierProperties props) {
        DispatchNotifierProperties.Async cfg = props.getAsync();
        return new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "dispatch-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    @ConditionalOnMissingBean(NotifyingPipeline.class)
    public NotifyingPipeline notifyingPipeline(@Qualifier("dispatchNotifyExecutor") ExecutorService exec,
                                               NotifierRouter router,
                                               ObjectProvider<NotifierFilter> filter,
                                               ObjectProvider<GuardedNotifierExecutor> guard,
                                               DispatchMetrics metrics,
                                               Clock clock) {
        return new NotifyingPipeline(exec, router, filter.getIfAvailable(), guard.getIfAvailable(), metrics, clock);
    }
}
