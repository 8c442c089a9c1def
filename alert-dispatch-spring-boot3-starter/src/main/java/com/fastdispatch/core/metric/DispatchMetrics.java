package com.fastdispatch.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public final class DispatchMetrics {
    private final MeterRegistry reg;
    private final Counter received;
    private final Counter streamErr;
    private final Counter groupsCreated;
    private final Counter groupsRemoved;
    private final Counter flushed;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final Timer notifyTimer;

    private DispatchMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.received = Counter.builder("dispatch.alerts.received").description("alerts received from stream").register(reg);
        this.streamErr = Counter.builder("dispatch.stream.error").description("alert stream errors").register(reg);
        this.groupsCreated = Counter.builder("dispatch.groups.created").description("aggregation groups created").register(reg);
        this.groupsRemoved = Counter.builder("dispatch.groups.removed").description("aggregation groups removed by cleanup").register(reg);
        this.flushed = Counter.builder("dispatch.flush").description("group flushes delivered to pipeline").register(reg);
        this.notifySuppressed = Counter.builder("dispatch.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent = Counter.builder("dispatch.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("dispatch.notify.failed").description("notify failed").register(reg);
        this.notifyTimer = Timer.builder("dispatch.notify.time").description("notify call time").register(reg);
    }

    public static DispatchMetrics create(MeterRegistry reg) { return new DispatchMetrics(reg); }

    public void incReceived(){ received.increment(); }
    public void incStreamErr(){ streamErr.increment(); }
    public void incGroupsCreated(){ groupsCreated.increment(); }
    public void incGroupsRemoved(int n){ groupsRemoved.increment(n); }
    public void incFlushed(){ flushed.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment();}
    public void incNotifyFailed(){ notifyFailed.increment();}
    public void incNotifySent(){ notifySent.increment();}
    /** 当前存活分组数, 由引擎在构造时挂上 */
    public void gaugeActiveGroups(Supplier<Number> count) {
        Gauge.builder("dispatch.groups.active", count).description("aggregation groups alive").register(reg);
    }

    public void recordNotifyNanos(long nanos){ notifyTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
