package com.fastdispatch.core.group;

import com.fastdispatch.core.cancel.CancellationScope;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.ctx.NotifyContext;
import com.fastdispatch.model.route.Route;
import com.fastdispatch.model.route.RouteOpts;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 聚合分组
 * 持有同一路由下分组标签相同的告警, 并按 groupWait/groupInterval 在时间轮上驱动自己的 flush
 */
public class AggregationGroup {

    private static final Logger log = LoggerFactory.getLogger(AggregationGroup.class);

    private final LabelSet labels;

    private final Route route;

    private final RouteOpts opts;

    private final Fingerprint groupKey;

    /** 共享时间轮, 只负责到点, 不执行投递 */
    private final HashedWheelTimer timer;

    /** flush 执行线程池 */
    private final Executor flushExecutor;

    /** 单次 flush 的最短生存期 */
    private final Duration minFlushTimeout;

    private final Clock clock;

    /** 由引擎作用域派生 */
    private final CancellationScope scope;

    private final ReentrantReadWriteLock mtx = new ReentrantReadWriteLock();

    /** guarded by mtx */
    private final Map<Fingerprint, Entry> alerts = new HashMap<>();

    /** guarded by mtx, 每次 insert 自增 */
    private long revision;

    /** guarded by mtx */
    private boolean hasSent;

    /** guarded by mtx, 下一次 flush */
    private Timeout next;

    private volatile NotifyFunction notifyFunction;

    /** 持有期间表示有 flush 在途 */
    private final ReentrantLock flushLock = new ReentrantLock();

    public AggregationGroup(CancellationScope parent,
                            LabelSet labels,
                            Route route,
                            HashedWheelTimer timer,
                            Executor flushExecutor,
                            Duration minFlushTimeout,
                            Clock clock) {
        this.labels = labels;
        this.route = route;
        this.opts = route.getOpts();
        this.groupKey = labels.fingerprint().combine(route.fingerprint());
        this.timer = timer;
        this.flushExecutor = flushExecutor;
        this.minFlushTimeout = minFlushTimeout;
        this.clock = clock;
        this.scope = parent.child();
    }

    /**
     * 启动分组的定时循环, 首次在 groupWait 后触发
     */
    public void run(NotifyFunction nf) {
        mtx.writeLock().lock();
        try {
            if (notifyFunction != null) {
                throw new IllegalStateException("aggregation group " + this + " already running");
            }
            notifyFunction = nf;
            if (!scope.isCancelled()) {
                next = schedule(opts.getGroupWait());
            }
        } finally {
            mtx.writeLock().unlock();
        }
        scope.onCancel(this::disarm);
    }

    /**
     * 插入或覆盖告警
     * 尚未发送过且告警已超过等待期时立即触发 flush
     */
    public void insert(Alert alert) {
        Instant now = clock.instant();
        mtx.writeLock().lock();
        try {
            alerts.put(alert.fingerprint(), new Entry(alert, ++revision));

            boolean overdue = !hasSent && alert.getStartsAt() != null
                    && alert.getStartsAt().plus(opts.getGroupWait()).isBefore(now);
            if (next == null) {
                // 上次排期被时间轮拒绝
                if (notifyFunction != null && !scope.isCancelled()) {
                    next = schedule(overdue ? Duration.ZERO : pendingDelay());
                }
            } else if (overdue) {
                next.cancel();
                next = schedule(Duration.ZERO);
            }
        } finally {
            mtx.writeLock().unlock();
        }
    }

    /**
     * 停止定时循环, 阻塞直到在途 flush 结束
     */
    public void stop() {
        scope.cancel();
        flushLock.lock();
        flushLock.unlock();
    }

    /**
     * 已运行但没有挂起定时的分组重新排期
     *
     * @return 是否补排成功
     */
    public boolean rearm() {
        mtx.writeLock().lock();
        try {
            if (next != null || notifyFunction == null || scope.isCancelled()) {
                return false;
            }
            next = schedule(pendingDelay());
            return next != null;
        } finally {
            mtx.writeLock().unlock();
        }
    }

    /** guarded by mtx */
    private Duration pendingDelay() {
        return hasSent ? opts.getGroupInterval() : opts.getGroupWait();
    }

    private void disarm() {
        mtx.writeLock().lock();
        try {
            if (next != null) {
                next.cancel();
                next = null;
            }
        } finally {
            mtx.writeLock().unlock();
        }
    }

    /**
     * 时间轮到点
     * 先安排下一次, 再把 flush 交给线程池, 慢投递不影响下一次准点触发
     */
    private void onTick(Timeout fired) {
        Instant now = clock.instant();
        mtx.writeLock().lock();
        try {
            // 已被 insert 重置或已停止
            if (scope.isCancelled() || fired != next) {
                return;
            }
            next = schedule(opts.getGroupInterval());
        } finally {
            mtx.writeLock().unlock();
        }
        try {
            flushExecutor.execute(() -> flushAt(now));
        } catch (RejectedExecutionException e) {
            log.warn("[AggrGroup] flush of {} rejected, retry on next tick", this);
        }
    }

    private void flushAt(Instant now) {
        if (!flushLock.tryLock()) {
            log.debug("[AggrGroup] previous flush of {} still running, tick skipped", this);
            return;
        }
        try {
            if (scope.isCancelled()) {
                return;
            }
            Duration timeout = flushTimeout();
            CancellationScope flushScope = scope.child();
            NotifyContext ctx = new NotifyContext(now, groupKey, labels, opts.getReceiver(),
                    opts.getRepeatInterval(), now.plus(timeout), flushScope);
            Timeout expiry = newTimeout(GroupTask.Kind.FLUSH_DEADLINE, t -> flushScope.cancel(), timeout);
            try {
                NotifyFunction nf = notifyFunction;
                flush(now, slice -> nf.notify(ctx, slice));
            } catch (RuntimeException e) {
                log.error("[AggrGroup] flush of {} failed", this, e);
            } finally {
                if (expiry != null) {
                    expiry.cancel();
                }
                flushScope.cancel();
            }
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * 投递当前告警快照, 成功后只删除快照之后未被覆盖且已恢复的告警
     */
    void flush(Instant now, Predicate<List<Alert>> notify) {
        if (empty()) {
            return;
        }
        Map<Fingerprint, Entry> snapshot;
        mtx.readLock().lock();
        try {
            snapshot = new HashMap<>(alerts);
        } finally {
            mtx.readLock().unlock();
        }
        List<Alert> slice = new ArrayList<>(snapshot.size());
        for (Entry e : snapshot.values()) {
            slice.add(e.alert);
        }

        log.debug("[AggrGroup] flushing {} alerts of {}", slice.size(), this);

        if (!notify.test(slice)) {
            return;
        }
        mtx.writeLock().lock();
        try {
            for (Map.Entry<Fingerprint, Entry> e : snapshot.entrySet()) {
                Entry live = alerts.get(e.getKey());
                if (e.getValue().alert.resolvedAt(now)
                        && live != null && live.revision == e.getValue().revision) {
                    alerts.remove(e.getKey());
                }
            }
            hasSent = true;
        } finally {
            mtx.writeLock().unlock();
        }
    }

    /** 单次 flush 的生存期, 不低于下限 */
    Duration flushTimeout() {
        Duration interval = opts.getGroupInterval();
        return interval.compareTo(minFlushTimeout) < 0 ? minFlushTimeout : interval;
    }

    private Timeout schedule(Duration delay) {
        return newTimeout(GroupTask.Kind.FLUSH, this::onTick, delay);
    }

    private Timeout newTimeout(GroupTask.Kind kind, Consumer<Timeout> action, Duration delay) {
        try {
            return timer.newTimeout(new GroupTask(kind, this, action), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或挂起数超限, FLUSH 由下一次 insert 或清理补排
            log.warn("[AggrGroup] {} timeout for {} not scheduled: {}", kind, this, e.toString());
            return null;
        }
    }

    public boolean empty() {
        mtx.readLock().lock();
        try {
            return alerts.isEmpty();
        } finally {
            mtx.readLock().unlock();
        }
    }

    public int size() {
        mtx.readLock().lock();
        try {
            return alerts.size();
        } finally {
            mtx.readLock().unlock();
        }
    }

    public List<Alert> alertSlice() {
        mtx.readLock().lock();
        try {
            List<Alert> slice = new ArrayList<>(alerts.size());
            for (Entry e : alerts.values()) {
                slice.add(e.alert);
            }
            return slice;
        } finally {
            mtx.readLock().unlock();
        }
    }

    public boolean hasSent() {
        mtx.readLock().lock();
        try {
            return hasSent;
        } finally {
            mtx.readLock().unlock();
        }
    }

    public boolean isStopped() {
        return scope.isCancelled();
    }

    public Fingerprint fingerprint() {
        return labels.fingerprint();
    }

    public Fingerprint groupKey() {
        return groupKey;
    }

    public LabelSet getLabels() {
        return labels;
    }

    public Route getRoute() {
        return route;
    }

    @Override
    public String toString() {
        return fingerprint() + "/" + opts.getReceiver();
    }

    private static final class Entry {
        private final Alert alert;
        private final long revision;

        private Entry(Alert alert, long revision) {
            this.alert = alert;
            this.revision = revision;
        }
    }
}
