package com.fastdispatch.core;

import com.fastdispatch.config.AlertDispatchProperties;
import com.fastdispatch.config.DispatchNotifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class DispatcherLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(DispatcherLifecycle.class);

    private final Dispatcher dispatcher;

    private final AlertDispatchProperties props;

    private final DispatchNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public DispatcherLifecycle(Dispatcher dispatcher, AlertDispatchProperties props,
                               DispatchNotifierProperties notifyProps) {
        this.dispatcher = dispatcher;
        this.props = props;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        running.compareAndSet(false, props.isEnabled());
        if (!running.get()) {
            log.info("[Dispatcher] start skipped, dispatch.enabled=false");
            return;
        }
        // 打印关键启动信息（一次性）
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ Alert Dispatcher starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ routes              : {}", props.getRoutes().size());
            log.info("│ default.receiver    : {}", props.getDefaultRoute().getReceiver());
            log.info("│ wheel.tick          : {} ms", props.getWheel().getTick().toMillis());
            log.info("│ wheel.slots         : {}", props.getWheel().getSlots());
            log.info("│ flush.core          : {}", props.getFlush().getCorePoolSize());
            log.info("│ flush.max           : {}", props.getFlush().getMaxPoolSize());
            log.info("│ flush.queue         : {}", props.getFlush().getQueueCapacity());
            log.info("│ cleanup.period      : {} ms", props.getCleanup().getPeriod().toMillis());
            log.info("│ minFlushTimeout     : {} ms", props.getMinFlushTimeout().toMillis());
            log.info("│ notify.rateLimit    : {}", notifyProps.getRateLimit().isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Dispatcher] failed to render startup banner: {}", t.toString());
        }
        // start() 会阻塞, 放到独立线程
        Thread loop = new Thread(() -> {
            try {
                dispatcher.start();
            } catch (RuntimeException e) {
                log.error("[Dispatcher] loop terminated abnormally", e);
            }
        }, "alert-dispatcher");
        loop.start();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Dispatcher] stop skipped: not running");
            return;
        }
        log.info("[Dispatcher] stopping...");
        try {
            dispatcher.gracefulShutdown(props.getShutdown().getAwait());
        } finally {
            log.info("[Dispatcher] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
