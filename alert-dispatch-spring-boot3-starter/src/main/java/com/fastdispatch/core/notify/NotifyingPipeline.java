package com.fastdispatch.core.notify;

import com.fastdispatch.core.handler.GuardedNotifierExecutor;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.spi.notify.Notifier;
import com.fastdispatch.core.spi.notify.NotifierFilter;
import com.fastdispatch.core.spi.notify.NotifierRouter;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 通知链路
 * 过滤 → 路由 → 各渠道在通知线程池上经保护执行, 整体受上下文截止时刻约束
 * <p>
 * 返回 false 时分组保留告警, 下一次 flush 再投
 */
public class NotifyingPipeline {

    private final Logger log = LoggerFactory.getLogger(NotifyingPipeline.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    /** 可为空 */
    private final NotifierFilter filter;

    /** 可为空, 为空时直接调用渠道 */
    private final GuardedNotifierExecutor guard;

    private final DispatchMetrics metrics;

    private final Clock clock;

    public NotifyingPipeline(ExecutorService exec, NotifierRouter router, NotifierFilter filter,
                             GuardedNotifierExecutor guard, DispatchMetrics metrics, Clock clock) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.guard = guard;
        this.metrics = metrics;
        this.clock = clock;
    }

    public boolean deliver(NotifyContext ctx, List<Alert> alerts) {
        if (ctx.isCancelled()) {
            log.debug("[Notify] {} cancelled before delivery", ctx);
            return false;
        }
        if (filter != null && !filter.allow(ctx, alerts)) {
            metrics.incNotifySuppressed();
            log.info("[Notify] receiver={} group={} suppressed", ctx.getReceiver(), ctx.getGroupLabels());
            return false;
        }
        List<Notifier> notifiers = router.route(ctx);
        if (notifiers.isEmpty()) {
            metrics.incNotifyFailed();
            log.warn("[Notify] no notifier for receiver={}", ctx.getReceiver());
            return false;
        }

        // 各渠道并行投递
        List<Future<?>> futures = new ArrayList<>(notifiers.size());
        boolean ok = true;
        for (Notifier n : notifiers) {
            try {
                Future<?> f = exec.submit(() -> {
                    invoke(n, ctx, alerts);
                    return null;
                });
                ctx.getScope().onCancel(() -> f.cancel(true));
                futures.add(f);
            } catch (RejectedExecutionException e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} receiver={} rejected by notify executor", n.name(), ctx.getReceiver());
                futures.add(null);
                ok = false;
            }
        }

        for (int i = 0; i < futures.size(); i++) {
            Future<?> f = futures.get(i);
            if (f == null) {
                continue;
            }
            if (!await(notifiers.get(i), f, ctx)) {
                ok = false;
            }
        }
        return ok;
    }

    private void invoke(Notifier n, NotifyContext ctx, List<Alert> alerts) throws Exception {
        long start = System.nanoTime();
        try {
            if (guard == null) {
                n.notify(ctx, alerts);
            } else {
                guard.execute(ctx.getReceiver(), () -> {
                    n.notify(ctx, alerts);
                    return null;
                });
            }
        } finally {
            metrics.recordNotifyNanos(System.nanoTime() - start);
        }
    }

    private boolean await(Notifier n, Future<?> f, NotifyContext ctx) {
        try {
            f.get(ctx.remaining(clock.instant()).toMillis(), TimeUnit.MILLISECONDS);
            metrics.incNotifySent();
            return true;
        } catch (TimeoutException e) {
            f.cancel(true);
            metrics.incNotifyFailed();
            log.warn("[Notify] channel={} receiver={} deadline {} exceeded", n.name(), ctx.getReceiver(), ctx.getDeadline());
            return false;
        } catch (CancellationException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] channel={} receiver={} cancelled", n.name(), ctx.getReceiver());
            return false;
        } catch (ExecutionException e) {
            metrics.incNotifyFailed();
            log.error("[Notify] channel={} receiver={} failed", n.name(), ctx.getReceiver(), e.getCause());
            return false;
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            metrics.incNotifyFailed();
            log.warn("[Notify] channel={} receiver={} interrupted", n.name(), ctx.getReceiver());
            return false;
        }
    }
}
