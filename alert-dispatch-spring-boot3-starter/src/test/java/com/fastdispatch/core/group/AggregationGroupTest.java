package com.fastdispatch.core.group;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fastdispatch.core.cancel.CancellationScope;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.ctx.NotifyContext;
import com.fastdispatch.model.route.Route;
import com.fastdispatch.model.route.RouteOpts;
import io.netty.util.HashedWheelTimer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AggregationGroupTest {

    private HashedWheelTimer timer;
    private ExecutorService flushExecutor;
    private CancellationScope root;
    private Recorder recorder;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        flushExecutor = Executors.newFixedThreadPool(2);
        root = CancellationScope.root();
        recorder = new Recorder();
    }

    @AfterEach
    void tearDown() {
        root.cancel();
        timer.stop();
        flushExecutor.shutdownNow();
    }

    private AggregationGroup group(Duration groupWait, Duration groupInterval) {
        return group(groupWait, groupInterval, timer, flushExecutor);
    }

    private AggregationGroup group(Duration groupWait, Duration groupInterval, HashedWheelTimer wheel, Executor pool) {
        var opts = RouteOpts.builder()
                .receiver("ops")
                .groupBy(Set.of("job"))
                .groupWait(groupWait)
                .groupInterval(groupInterval)
                .build();
        var route = new Route("r", Map.of(), opts);
        return new AggregationGroup(root, LabelSet.of("job", "api"), route, wheel, pool,
                Duration.ofSeconds(10), Clock.systemUTC());
    }

    private static void awaitNoPendingTimeouts(HashedWheelTimer wheel) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (wheel.pendingTimeouts() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(wheel.pendingTimeouts()).isZero();
    }

    private static Alert alert(String name, Instant startsAt, Instant endsAt) {
        return Alert.builder()
                .labels(LabelSet.of("job", "api", "alertname", name))
                .startsAt(startsAt)
                .endsAt(endsAt)
                .build();
    }

    @Test
    void shouldRetainOnlyLatestValuePerFingerprint() {
        // given
        var group = group(Duration.ofHours(1), Duration.ofHours(1));
        var first = alert("X", Instant.now(), null);
        var second = first.toBuilder().annotations(Map.of("summary", "updated")).build();

        // when
        group.insert(first);
        group.insert(second);

        // then
        assertThat(group.size()).isEqualTo(1);
        assertThat(group.alertSlice()).containsExactly(second);
    }

    @Test
    void shouldPruneOnlyResolvedAlertsUnchangedSinceSnapshot() {
        // given
        var now = Instant.now();
        var group = group(Duration.ofHours(1), Duration.ofHours(1));
        var x = alert("X", now.minusSeconds(60), now.minusSeconds(1));
        var y = alert("Y", now.minusSeconds(60), now.minusSeconds(1));
        var z = alert("Z", now.minusSeconds(60), null);
        group.insert(x);
        group.insert(y);
        group.insert(z);

        // when
        group.flush(now, slice -> {
            // Y overwritten between snapshot and delivery confirmation
            group.insert(y.toBuilder().build());
            return true;
        });

        // then
        assertThat(group.alertSlice())
                .extracting(a -> a.getLabels().get("alertname"))
                .containsExactlyInAnyOrder("Y", "Z");
        assertThat(group.hasSent()).isTrue();
    }

    @Test
    void shouldKeepAlertsWhenDeliveryFails() {
        // given
        var now = Instant.now();
        var group = group(Duration.ofHours(1), Duration.ofHours(1));
        group.insert(alert("Y", now.minusSeconds(60), now.minusSeconds(1)));

        // when
        group.flush(now, slice -> false);

        // then
        assertThat(group.size()).isEqualTo(1);
        assertThat(group.hasSent()).isFalse();

        // when
        group.flush(now, slice -> true);

        // then
        assertThat(group.empty()).isTrue();
    }

    @Test
    void shouldNotDeliverEmptyGroup() {
        // given
        var group = group(Duration.ofHours(1), Duration.ofHours(1));
        var calls = new AtomicInteger();

        // when
        group.flush(Instant.now(), slice -> calls.incrementAndGet() > 0);

        // then
        assertThat(calls).hasValue(0);
    }

    @Test
    void shouldFlushAfterGroupWaitWithoutDeletingFiringAlert() throws Exception {
        // given
        var group = group(Duration.ofMillis(200), Duration.ofSeconds(5));
        var x = alert("X", Instant.now(), null);
        var started = System.nanoTime();
        group.run(recorder);

        // when
        group.insert(x);
        var flushed = recorder.flushes.poll(3, TimeUnit.SECONDS);

        // then
        assertThat(flushed).containsExactly(x);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        group.stop();
        assertThat(group.alertSlice()).containsExactly(x);
    }

    @Test
    void shouldRemoveResolvedAlertOnNextIntervalFlush() throws Exception {
        // given
        var group = group(Duration.ofMillis(100), Duration.ofMillis(500));
        var x = alert("X", Instant.now(), null);
        group.run(recorder);
        group.insert(x);
        assertThat(recorder.flushes.poll(3, TimeUnit.SECONDS)).containsExactly(x);

        // when
        var resolved = x.toBuilder().endsAt(Instant.now().minusMillis(100)).build();
        group.insert(resolved);
        var flushed = recorder.flushes.poll(3, TimeUnit.SECONDS);

        // then
        assertThat(flushed).containsExactly(resolved);
        // stop() waits for the in-flight flush, prune included
        group.stop();
        assertThat(group.empty()).isTrue();
    }

    @Test
    void shouldFlushImmediatelyWhenAlertAlreadyOutlivedGroupWait() throws Exception {
        // given
        var group = group(Duration.ofSeconds(30), Duration.ofMinutes(5));
        var old = alert("X", Instant.now().minusSeconds(120), null);
        group.run(recorder);

        // when
        group.insert(old);
        var flushed = recorder.flushes.poll(2, TimeUnit.SECONDS);

        // then
        assertThat(flushed).containsExactly(old);
    }

    @Test
    void shouldStopFiringAfterStop() throws Exception {
        // given
        var group = group(Duration.ofMillis(100), Duration.ofMillis(100));
        group.run(recorder);
        group.insert(alert("X", Instant.now(), null));

        // when
        group.stop();
        group.stop();

        // then
        assertThat(group.isStopped()).isTrue();
        assertThat(recorder.flushes.poll(400, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void shouldStopWhenParentScopeCancelled() throws Exception {
        // given
        var group = group(Duration.ofMillis(100), Duration.ofMillis(100));
        group.run(recorder);
        group.insert(alert("X", Instant.now(), null));

        // when
        root.cancel();

        // then
        assertThat(group.isStopped()).isTrue();
        assertThat(recorder.flushes.poll(400, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void shouldHandContextBoundToFlushDeadline() throws Exception {
        // given
        var group = group(Duration.ofMillis(50), Duration.ofSeconds(1));
        group.run(recorder);

        // when
        group.insert(alert("X", Instant.now(), null));
        var ctx = recorder.contexts.poll(3, TimeUnit.SECONDS);

        // then
        assertThat(ctx).isNotNull();
        assertThat(ctx.getReceiver()).isEqualTo("ops");
        assertThat(ctx.getGroupLabels()).isEqualTo(LabelSet.of("job", "api"));
        assertThat(ctx.getGroupKey()).isEqualTo(group.groupKey());
        assertThat(Duration.between(ctx.getNow(), ctx.getDeadline())).isEqualTo(Duration.ofSeconds(10));
        group.stop();
        // flush scope revoked once the flush returned
        assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    void shouldUseGroupIntervalAsFlushTimeoutAboveFloor() {
        assertThat(group(Duration.ofSeconds(1), Duration.ofSeconds(1)).flushTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(group(Duration.ofSeconds(1), Duration.ofMinutes(5)).flushTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldRejectSecondRun() {
        // given
        var group = group(Duration.ofHours(1), Duration.ofHours(1));
        group.run(recorder);

        // then
        assertThatThrownBy(() -> group.run(recorder)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDeriveGroupKeyFromLabelsAndRoute() {
        // given
        var a = group(Duration.ofHours(1), Duration.ofHours(1));
        var otherRoute = new Route("other", Map.of(), RouteOpts.builder().receiver("dba").build());
        var b = new AggregationGroup(root, LabelSet.of("job", "api"), otherRoute, timer, flushExecutor,
                Duration.ofSeconds(10), Clock.systemUTC());

        // then
        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
        assertThat(a.groupKey()).isNotEqualTo(b.groupKey());
    }

    @Test
    void shouldKeepWheelOnTimeWhileFlushPoolSaturated() throws Exception {
        // given
        var wheel = new HashedWheelTimer(r -> new Thread(r, "test-wheel"), 10, TimeUnit.MILLISECONDS);
        var pool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS, new SynchronousQueue<>(),
                new ThreadPoolExecutor.AbortPolicy());
        try {
            var slow = new Gate();
            var busy = group(Duration.ofMillis(20), Duration.ofHours(1), wheel, pool);
            busy.run(slow);
            busy.insert(alert("Slow", Instant.now(), null));
            assertThat(slow.entered.await(3, TimeUnit.SECONDS)).isTrue();

            var other = new Gate();
            var starved = group(Duration.ofMillis(50), Duration.ofMillis(100), wheel, pool);
            starved.run(other);
            starved.insert(alert("Other", Instant.now(), null));

            // when
            var fired = new CountDownLatch(1);
            wheel.newTimeout(t -> fired.countDown(), 150, TimeUnit.MILLISECONDS);

            // then
            assertThat(fired.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(other.threads).isEmpty();

            // when
            other.release.countDown();
            slow.release.countDown();

            // then
            var thread = other.threads.poll(3, TimeUnit.SECONDS);
            assertThat(thread).isNotNull().isNotEqualTo("test-wheel");
        } finally {
            wheel.stop();
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRearmOnInsertAfterWheelRejectedSchedule() throws Exception {
        // given
        var wheel = new HashedWheelTimer(Executors.defaultThreadFactory(), 10, TimeUnit.MILLISECONDS, 64, false, 1);
        try {
            var holder = group(Duration.ofHours(1), Duration.ofHours(1), wheel, flushExecutor);
            holder.run(recorder);
            var starved = group(Duration.ofMillis(50), Duration.ofHours(1), wheel, flushExecutor);
            starved.run(recorder);
            var x = alert("X", Instant.now(), null);
            starved.insert(x);
            assertThat(starved.rearm()).isFalse();
            assertThat(recorder.flushes.poll(300, TimeUnit.MILLISECONDS)).isNull();

            // when
            holder.stop();
            awaitNoPendingTimeouts(wheel);
            var y = alert("Y", Instant.now(), null);
            starved.insert(y);

            // then
            assertThat(recorder.flushes.poll(3, TimeUnit.SECONDS)).containsExactlyInAnyOrder(x, y);
        } finally {
            wheel.stop();
        }
    }

    @Test
    void shouldRearmIdleGroupOnRequest() throws Exception {
        // given
        var wheel = new HashedWheelTimer(Executors.defaultThreadFactory(), 10, TimeUnit.MILLISECONDS, 64, false, 1);
        try {
            var holder = group(Duration.ofHours(1), Duration.ofHours(1), wheel, flushExecutor);
            holder.run(recorder);
            var starved = group(Duration.ofMillis(50), Duration.ofHours(1), wheel, flushExecutor);
            starved.run(recorder);
            var x = alert("X", Instant.now(), null);
            starved.insert(x);
            holder.stop();
            awaitNoPendingTimeouts(wheel);

            // when
            var rearmed = starved.rearm();

            // then
            assertThat(rearmed).isTrue();
            assertThat(starved.rearm()).isFalse();
            assertThat(recorder.flushes.poll(3, TimeUnit.SECONDS)).containsExactly(x);
        } finally {
            wheel.stop();
        }
    }

    @Test
    void shouldNotRearmBeforeRunOrAfterStop() {
        // given
        var group = group(Duration.ofMillis(50), Duration.ofHours(1));

        // then
        assertThat(group.rearm()).isFalse();

        // when
        group.run(recorder);
        group.stop();

        // then
        assertThat(group.rearm()).isFalse();
    }

    private static final class Gate implements NotifyFunction {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final BlockingQueue<String> threads = new LinkedBlockingQueue<>();

        @Override
        public boolean notify(NotifyContext ctx, List<Alert> alerts) {
            threads.add(Thread.currentThread().getName());
            entered.countDown();
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private static final class Recorder implements NotifyFunction {
        private final BlockingQueue<List<Alert>> flushes = new LinkedBlockingQueue<>();
        private final BlockingQueue<NotifyContext> contexts = new LinkedBlockingQueue<>();

        @Override
        public boolean notify(NotifyContext ctx, List<Alert> alerts) {
            contexts.add(ctx);
            flushes.add(alerts);
            return true;
        }
    }
}
