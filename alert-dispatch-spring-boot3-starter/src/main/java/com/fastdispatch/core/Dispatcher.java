package com.fastdispatch.core;

import com.fastdispatch.config.AlertDispatchProperties;
import com.fastdispatch.core.cancel.CancellationScope;
import com.fastdispatch.core.group.AggregationGroup;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.notify.NotifyingPipeline;
import com.fastdispatch.core.overview.OverviewBuilder;
import com.fastdispatch.core.spi.AlertIterator;
import com.fastdispatch.core.spi.AlertProvider;
import com.fastdispatch.core.spi.Marker;
import com.fastdispatch.core.spi.RouteMatcher;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.ctx.NotifyContext;
import com.fastdispatch.model.overview.AlertOverview;
import com.fastdispatch.model.route.Route;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 告警分发引擎
 * <p>
 * 从告警流读取告警, 按路由与分组标签放入聚合分组; 分组在共享时间轮上自行驱动 flush,
 * 周期清理只负责回收空分组
 * <p>
 * 锁顺序：引擎锁 → 分组锁
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final AlertProvider alertProvider;

    private final RouteMatcher routeMatcher;

    private final Marker marker;

    private final NotifyingPipeline pipeline;

    /** 所有分组共享的时间轮 */
    private final HashedWheelTimer timer;

    /** 分组 flush 执行线程池 */
    private final ExecutorService flushExecutor;

    private final DispatchMetrics metrics;

    private final AlertDispatchProperties props;

    private final Clock clock;

    /** 引擎锁 */
    private final ReentrantReadWriteLock mtx = new ReentrantReadWriteLock();

    /** guarded by mtx */
    private final Map<Route, Map<Fingerprint, AggregationGroup>> aggrGroups = new HashMap<>();

    // 以下 guarded by this
    private CancellationScope rootScope;
    private Thread loopThread;
    private CountDownLatch done;
    private boolean closed;

    public Dispatcher(AlertProvider alertProvider,
                      RouteMatcher routeMatcher,
                      Marker marker,
                      NotifyingPipeline pipeline,
                      HashedWheelTimer timer,
                      ExecutorService flushExecutor,
                      DispatchMetrics metrics,
                      AlertDispatchProperties props,
                      Clock clock) {
        this.alertProvider = alertProvider;
        this.routeMatcher = routeMatcher;
        this.marker = marker;
        this.pipeline = pipeline;
        this.timer = timer;
        this.flushExecutor = flushExecutor;
        this.metrics = metrics;
        this.props = props;
        this.clock = clock;
        metrics.gaugeActiveGroups(this::groupCount);
    }

    /**
     * 启动分发循环, 阻塞当前线程直到告警流结束或 {@link #stop()}
     */
    public void start() {
        CancellationScope scope;
        CountDownLatch latch;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("dispatcher already shut down");
            }
            if (loopThread != null) {
                throw new IllegalStateException("dispatcher already running");
            }
            scope = CancellationScope.root();
            latch = new CountDownLatch(1);
            rootScope = scope;
            done = latch;
            loopThread = Thread.currentThread();
        }

        mtx.writeLock().lock();
        try {
            aggrGroups.clear();
        } finally {
            mtx.writeLock().unlock();
        }

        ScheduledExecutorService cleanupExecutor =
                Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("dispatch-cleanup"));
        long period = props.getCleanup().getPeriod().toMillis();
        cleanupExecutor.scheduleWithFixedDelay(this::safeCleanup,
                props.getCleanup().getInitialDelay().toMillis(), period, TimeUnit.MILLISECONDS);

        try (AlertIterator it = alertProvider.subscribe()) {
            log.info("[Dispatcher] started, cleanup every {} ms", period);
            loop(it, scope);
        } finally {
            cleanupExecutor.shutdownNow();
            synchronized (this) {
                loopThread = null;
                // 吞掉 stop() 用来唤醒循环的中断
                if (scope.isCancelled()) {
                    Thread.interrupted();
                }
            }
            latch.countDown();
            log.info("[Dispatcher] loop exited");
        }
    }

    private void loop(AlertIterator it, CancellationScope scope) {
        while (!scope.isCancelled()) {
            Alert alert;
            try {
                alert = it.next();
            } catch (InterruptedException e) {
                if (!scope.isCancelled()) {
                    Thread.currentThread().interrupt();
                    log.warn("[Dispatcher] interrupted without stop, leaving loop");
                }
                return;
            }
            if (alert == null) {
                // 流结束
                Throwable err = it.err();
                if (err != null) {
                    log.error("[Dispatcher] alert stream ended with error", err);
                } else {
                    log.info("[Dispatcher] alert stream exhausted");
                }
                return;
            }
            metrics.incReceived();

            Throwable err = it.err();
            if (err != null) {
                metrics.incStreamErr();
                log.error("[Dispatcher] error on alert stream, alert {} skipped", alert.fingerprint(), err);
                continue;
            }

            for (Route route : routeMatcher.match(alert.getLabels())) {
                processAlert(alert, route, scope);
            }
        }
    }

    /**
     * 查找或创建分组并插入告警
     * 插入与创建同处引擎写锁内, 清理无法在首条告警落入前回收新建分组
     */
    void processAlert(Alert alert, Route route, CancellationScope scope) {
        LabelSet groupLabels = alert.getLabels().subset(route.getOpts().getGroupBy());
        Fingerprint fp = groupLabels.fingerprint();

        mtx.writeLock().lock();
        try {
            Map<Fingerprint, AggregationGroup> routeGroups = aggrGroups.computeIfAbsent(route, r -> new HashMap<>());
            AggregationGroup ag = routeGroups.get(fp);
            if (ag == null) {
                ag = new AggregationGroup(scope, groupLabels, route, timer, flushExecutor,
                        props.getMinFlushTimeout(), clock);
                routeGroups.put(fp, ag);
                metrics.incGroupsCreated();
                log.debug("[Dispatcher] group {} created on route {}", groupLabels, route.getName());
                ag.run(this::notifyGroup);
            }
            ag.insert(alert);
        } finally {
            mtx.writeLock().unlock();
        }
    }

    private boolean notifyGroup(NotifyContext ctx, List<Alert> alerts) {
        metrics.incFlushed();
        try {
            boolean ok = pipeline.deliver(ctx, alerts);
            if (!ok) {
                log.error("[Dispatcher] notify failed, receiver={} group={} alerts={} kept for next flush",
                        ctx.getReceiver(), ctx.getGroupLabels(), alerts.size());
            }
            return ok;
        } catch (RuntimeException e) {
            log.error("[Dispatcher] notify failed, receiver={} group={}", ctx.getReceiver(), ctx.getGroupLabels(), e);
            return false;
        }
    }

    private void safeCleanup() {
        try {
            cleanup();
        } catch (Exception e) {
            // 抛出会终止周期任务
            log.error("[Dispatcher] cleanup sweep error", e);
        }
    }

    /**
     * 回收空分组, 分组只在这里销毁
     * 非空但丢了定时的分组在这里补排
     */
    int cleanup() {
        int removed = 0;
        int rearmed = 0;
        mtx.writeLock().lock();
        try {
            Iterator<Map.Entry<Route, Map<Fingerprint, AggregationGroup>>> routes = aggrGroups.entrySet().iterator();
            while (routes.hasNext()) {
                Map<Fingerprint, AggregationGroup> groups = routes.next().getValue();
                Iterator<AggregationGroup> it = groups.values().iterator();
                while (it.hasNext()) {
                    AggregationGroup ag = it.next();
                    if (ag.empty()) {
                        ag.stop();
                        it.remove();
                        removed++;
                    } else if (ag.rearm()) {
                        rearmed++;
                    }
                }
                if (groups.isEmpty()) {
                    routes.remove();
                }
            }
        } finally {
            mtx.writeLock().unlock();
        }
        if (rearmed > 0) {
            log.warn("[Dispatcher] cleanup re-armed {} groups without pending flush", rearmed);
        }
        if (removed > 0) {
            metrics.incGroupsRemoved(removed);
            log.debug("[Dispatcher] cleanup removed {} empty groups", removed);
        }
        return removed;
    }

    /**
     * 停止分发, 从未启动时无操作
     * 取消根作用域后所有分组的定时链一并撤销, 等待循环退出
     */
    public void stop() {
        CancellationScope scope;
        CountDownLatch latch;
        synchronized (this) {
            if (rootScope == null) {
                return;
            }
            scope = rootScope;
            latch = done;
        }
        scope.cancel();
        synchronized (this) {
            if (loopThread != null && loopThread != Thread.currentThread()) {
                loopThread.interrupt();
            }
        }
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Dispatcher] interrupted while waiting for loop exit");
        }
    }

    /**
     * 当前所有分组中仍在触发的告警
     */
    public AlertOverview overview() {
        mtx.readLock().lock();
        try {
            return OverviewBuilder.build(aggrGroups, marker, clock.instant());
        } finally {
            mtx.readLock().unlock();
        }
    }

    /**
     * 停止分发 → 停止时间轮 → 关停 flush 线程池, 等待在途完成
     */
    public void gracefulShutdown(Duration await) {
        synchronized (this) {
            closed = true;
        }
        stop();
        Set<Timeout> unprocessed = timer.stop();
        log.info("[Dispatcher] timer stopped, {} pending timeouts dropped", unprocessed.size());

        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(Math.max(1, await.toMillis()), TimeUnit.MILLISECONDS)) {
                flushExecutor.shutdownNow();
                log.warn("[Dispatcher] flushExecutor forced shutdown after {} ms", await.toMillis());
            }
        } catch (InterruptedException ie) {
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Dispatcher] graceful shutdown done");
    }

    public int groupCount() {
        mtx.readLock().lock();
        try {
            int n = 0;
            for (Map<Fingerprint, AggregationGroup> groups : aggrGroups.values()) {
                n += groups.size();
            }
            return n;
        } finally {
            mtx.readLock().unlock();
        }
    }

    public List<AggregationGroup> groups(Route route) {
        mtx.readLock().lock();
        try {
            Map<Fingerprint, AggregationGroup> groups = aggrGroups.get(route);
            return groups == null ? List.of() : new ArrayList<>(groups.values());
        } finally {
            mtx.readLock().unlock();
        }
    }

    public synchronized boolean isRunning() {
        return loopThread != null;
    }
}
