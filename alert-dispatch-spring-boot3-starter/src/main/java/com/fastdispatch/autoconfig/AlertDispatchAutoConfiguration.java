package com.fastdispatch.autoconfig;

import com.fastdispatch.annotation.EnableAlertDispatch;
import com.fastdispatch.config.AlertDispatchProperties;
import com.fastdispatch.config.DispatchNotifierProperties;
import com.fastdispatch.core.Dispatcher;
import com.fastdispatch.core.DispatcherLifecycle;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.notify.NotifyingPipeline;
import com.fastdispatch.core.provider.MemAlertProvider;
import com.fastdispatch.core.provider.MemMarker;
import com.fastdispatch.core.route.StaticRouteMatcher;
import com.fastdispatch.core.serializer.JacksonPayloadSerializer;
import com.fastdispatch.core.spi.AlertProvider;
import com.fastdispatch.core.spi.EventStore;
import com.fastdispatch.core.spi.Marker;
import com.fastdispatch.core.spi.PayloadSerializer;
import com.fastdispatch.core.spi.RouteMatcher;
import com.fastdispatch.core.store.EventService;
import com.fastdispatch.core.store.MemEventStore;
import com.fastdispatch.model.route.Route;
import com.fastdispatch.model.route.RouteOpts;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、flush 线程池及分发引擎
 */
@AutoConfiguration
@EnableConfigurationProperties({
        AlertDispatchProperties.class,
        DispatchNotifierProperties.class
})
public class AlertDispatchAutoConfiguration {

    /**
     * 时间轮, 所有聚合分组共享
     */
    @Bean
    public HashedWheelTimer dispatchWheelTimer(AlertDispatchProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("dispatch-wheel-timer"),
                props.getWheel().getTick().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getSlots(),
                false,
                props.getWheel().getMaxPending()
        );
    }

    /**
     * flush 线程池
     */
    @Bean("dispatchFlushExecutor")
    public ExecutorService dispatchFlushExecutor(AlertDispatchProperties props) {
        AlertDispatchProperties.FlushPool exec = props.getFlush();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("dispatch-flush-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    /**
     * 默认内存告警来源, 宿主可提供自己的实现
     */
    @Bean
    @ConditionalOnMissingBean(AlertProvider.class)
    public MemAlertProvider memAlertProvider() {
        return new MemAlertProvider();
    }

    @Bean
    @ConditionalOnMissingBean(Marker.class)
    public MemMarker memMarker() {
        return new MemMarker();
    }

    /**
     * 配置驱动的静态路由
     */
    @Bean
    @ConditionalOnMissingBean(RouteMatcher.class)
    public RouteMatcher routeMatcher(AlertDispatchProperties props) {
        List<Route> routes = props.getRoutes().stream()
                .map(AlertDispatchAutoConfiguration::toRoute)
                .toList();
        return new StaticRouteMatcher(routes, toRoute(props.getDefaultRoute()));
    }

    /**
     * 分发引擎
     */
    @Bean
    public Dispatcher dispatcher(AlertProvider alertProvider,
                                 RouteMatcher routeMatcher,
                                 Marker marker,
                                 NotifyingPipeline pipeline,
                                 HashedWheelTimer timer,
                                 @Qualifier("dispatchFlushExecutor") ExecutorService flushExecutor,
                                 DispatchMetrics metrics,
                                 AlertDispatchProperties props,
                                 Clock clock) {
        return new Dispatcher(alertProvider, routeMatcher, marker, pipeline, timer, flushExecutor,
                metrics, props, clock);
    }

    /**
     * 分发引擎启动器
     */
    @Bean
    public DispatcherLifecycle dispatcherLifecycle(Dispatcher dispatcher,
                                                   AlertDispatchProperties props,
                                                   DispatchNotifierProperties notifyProps,
                                                   ApplicationContext applicationContext) {
        EnableAlertDispatch enable = findEnableAlertDispatch(applicationContext);
        if (enable != null) {
            props.setEnabled(enable.value());
        }
        return new DispatcherLifecycle(dispatcher, props, notifyProps);
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 没有数据源时事件存内存
     */
    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public EventStore memEventStore() {
        return new MemEventStore();
    }

    @Bean
    @ConditionalOnMissingBean(EventService.class)
    public EventService eventService(EventStore eventStore, AlertProvider alertProvider, Clock clock) {
        return new EventService(eventStore, alertProvider, clock);
    }

    static Route toRoute(AlertDispatchProperties.RouteConfig cfg) {
        RouteOpts opts = RouteOpts.builder()
                .receiver(cfg.getReceiver())
                .groupBy(cfg.getGroupBy() == null ? Set.of() : Set.copyOf(cfg.getGroupBy()))
                .groupWait(cfg.getGroupWait())
                .groupInterval(cfg.getGroupInterval())
                .repeatInterval(cfg.getRepeatInterval())
                .build();
        return new Route(cfg.getName(), cfg.getMatch(), opts);
    }

    private EnableAlertDispatch findEnableAlertDispatch(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableAlertDispatch an = type.getAnnotation(EnableAlertDispatch.class);
            if (an != null) return an;
        }
        return null;
    }
}
