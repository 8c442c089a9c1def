package com.fastdispatch.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fastdispatch.config.AlertDispatchProperties;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.notify.NotifyingPipeline;
import com.fastdispatch.core.notify.route.ReceiverRouter;
import com.fastdispatch.core.provider.MemAlertProvider;
import com.fastdispatch.core.provider.MemMarker;
import com.fastdispatch.core.route.StaticRouteMatcher;
import com.fastdispatch.core.spi.AlertIterator;
import com.fastdispatch.core.spi.AlertProvider;
import com.fastdispatch.core.spi.notify.Notifier;
import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.ctx.NotifyContext;
import com.fastdispatch.model.overview.AlertGroup;
import com.fastdispatch.model.route.Route;
import com.fastdispatch.model.route.RouteOpts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.HashedWheelTimer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatcherTest {

    private HashedWheelTimer timer;
    private ExecutorService flushExecutor;
    private ExecutorService notifyExecutor;
    private SimpleMeterRegistry registry;
    private RecordingNotifier notifier;
    private AlertDispatchProperties props;
    private Thread loop;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        flushExecutor = Executors.newFixedThreadPool(2);
        notifyExecutor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        notifier = new RecordingNotifier();
        props = new AlertDispatchProperties();
        // sweeps are triggered by the tests themselves
        props.getCleanup().setInitialDelay(Duration.ofHours(1));
        props.getCleanup().setPeriod(Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() throws Exception {
        timer.stop();
        flushExecutor.shutdownNow();
        notifyExecutor.shutdownNow();
        if (loop != null) {
            loop.join(TimeUnit.SECONDS.toMillis(5));
        }
    }

    private static Route route(String name, Map<String, String> match, String receiver, Duration wait, Duration interval) {
        return new Route(name, match, RouteOpts.builder()
                .receiver(receiver)
                .groupBy(Set.of("alertname"))
                .groupWait(wait)
                .groupInterval(interval)
                .build());
    }

    private Dispatcher dispatcher(AlertProvider provider, List<Route> routes, Route fallback) {
        var pipeline = new NotifyingPipeline(notifyExecutor, new ReceiverRouter(List.of(notifier)), null, null,
                DispatchMetrics.create(registry), Clock.systemUTC());
        return new Dispatcher(provider, new StaticRouteMatcher(routes, fallback), new MemMarker(), pipeline,
                timer, flushExecutor, DispatchMetrics.create(registry), props, Clock.systemUTC());
    }

    private void startInBackground(Dispatcher dispatcher) {
        loop = new Thread(dispatcher::start, "test-dispatcher");
        loop.start();
    }

    private static Alert alert(Map<String, String> labels, Instant endsAt) {
        return Alert.builder().labels(LabelSet.of(labels)).startsAt(Instant.now()).endsAt(endsAt).build();
    }

    @Test
    void shouldKeepGroupsOfDifferentRoutesIndependent() throws Exception {
        // given
        var db = route("db", Map.of("team", "db"), "dba", Duration.ofMillis(50), Duration.ofMinutes(5));
        var down = route("down", Map.of("alertname", "Down"), "ops", Duration.ofMillis(50), Duration.ofMinutes(5));
        var provider = new MemAlertProvider();
        var dispatcher = dispatcher(provider, List.of(db, down), null);
        startInBackground(dispatcher);

        // when
        provider.put(alert(Map.of("alertname", "Down", "team", "db"), null));
        var first = notifier.deliveries.poll(3, TimeUnit.SECONDS);
        var second = notifier.deliveries.poll(3, TimeUnit.SECONDS);

        // then
        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(Set.of(first.receiver, second.receiver)).containsExactlyInAnyOrder("dba", "ops");
        assertThat(first.groupKey).isNotEqualTo(second.groupKey);
        assertThat(dispatcher.groups(db)).hasSize(1);
        assertThat(dispatcher.groups(down)).hasSize(1);
        assertThat(dispatcher.groups(db).get(0)).isNotSameAs(dispatcher.groups(down).get(0));
        assertThat(dispatcher.groupCount()).isEqualTo(2);
        dispatcher.stop();
        assertThat(dispatcher.groups(db).get(0).isStopped()).isTrue();
    }

    @Test
    void shouldRecreateFreshGroupAfterCleanup() throws Exception {
        // given
        var r = route("r", Map.of(), "ops", Duration.ofMillis(50), Duration.ofMinutes(5));
        var provider = new MemAlertProvider();
        var dispatcher = dispatcher(provider, List.of(), r);
        startInBackground(dispatcher);
        provider.put(alert(Map.of("alertname", "Down"), Instant.now().minusSeconds(1)));
        assertThat(notifier.deliveries.poll(3, TimeUnit.SECONDS)).isNotNull();
        var old = dispatcher.groups(r).get(0);
        // waits for the in-flight flush so its prune has landed
        old.stop();
        assertThat(old.empty()).isTrue();

        // when
        var removed = dispatcher.cleanup();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(dispatcher.groupCount()).isZero();
        assertThat(dispatcher.groups(r)).isEmpty();

        // when
        provider.put(alert(Map.of("alertname", "Down"), null));
        var again = notifier.deliveries.poll(3, TimeUnit.SECONDS);

        // then
        assertThat(again).isNotNull();
        var fresh = dispatcher.groups(r).get(0);
        assertThat(fresh).isNotSameAs(old);
        assertThat(fresh.isStopped()).isFalse();
        assertThat(fresh.alertSlice()).hasSize(1);
        dispatcher.stop();
    }

    @Test
    void shouldKeepNonEmptyGroupsOnCleanup() throws Exception {
        // given
        var r = route("r", Map.of(), "ops", Duration.ofHours(1), Duration.ofHours(1));
        var provider = new ScriptedProvider();
        provider.alerts.add(alert(Map.of("alertname", "Down"), null));
        var dispatcher = dispatcher(provider, List.of(), r);
        dispatcher.start();

        // when
        var removed = dispatcher.cleanup();

        // then
        assertThat(removed).isZero();
        assertThat(dispatcher.groupCount()).isEqualTo(1);
        assertThat(registry.get("dispatch.groups.active").gauge().value()).isEqualTo(1.0);
        dispatcher.stop();
    }

    @Test
    void shouldRearmGroupLeftWithoutTimerOnCleanup() throws Exception {
        // given
        timer.stop();
        timer = new HashedWheelTimer(Executors.defaultThreadFactory(), 10, TimeUnit.MILLISECONDS, 64, false, 1);
        var blocker = timer.newTimeout(t -> { }, 1, TimeUnit.HOURS);
        var r = route("r", Map.of(), "ops", Duration.ofMillis(50), Duration.ofHours(1));
        var provider = new ScriptedProvider();
        provider.alerts.add(alert(Map.of("alertname", "Down"), null));
        var dispatcher = dispatcher(provider, List.of(), r);
        dispatcher.start();
        assertThat(notifier.deliveries.poll(300, TimeUnit.MILLISECONDS)).isNull();
        blocker.cancel();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (timer.pendingTimeouts() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        // when
        var removed = dispatcher.cleanup();

        // then
        assertThat(removed).isZero();
        var delivery = notifier.deliveries.poll(3, TimeUnit.SECONDS);
        assertThat(delivery).isNotNull();
        assertThat(delivery.receiver).isEqualTo("ops");
        dispatcher.stop();
    }

    @Test
    void shouldSkipAlertsReportedWithStreamError() {
        // given
        var r = route("r", Map.of(), "ops", Duration.ofHours(1), Duration.ofHours(1));
        var broken = alert(Map.of("alertname", "Broken"), null);
        var good = alert(Map.of("alertname", "Good"), null);
        var provider = new ScriptedProvider();
        provider.alerts.add(broken);
        provider.alerts.add(good);
        provider.broken.add(broken);
        var dispatcher = dispatcher(provider, List.of(), r);

        // when
        dispatcher.start();

        // then
        assertThat(dispatcher.groups(r)).hasSize(1);
        assertThat(dispatcher.groups(r).get(0).alertSlice()).containsExactly(good);
        assertThat(registry.counter("dispatch.stream.error").count()).isEqualTo(1.0);
        assertThat(provider.closed).isTrue();
        dispatcher.stop();
    }

    @Test
    void shouldOrderOverviewByGroupLabels() {
        // given
        var r = new Route("r", Map.of(), RouteOpts.builder()
                .receiver("ops")
                .groupBy(Set.of("a"))
                .groupWait(Duration.ofHours(1))
                .groupInterval(Duration.ofHours(1))
                .build());
        var provider = new ScriptedProvider();
        provider.alerts.add(alert(Map.of("a", "2", "alertname", "X"), null));
        provider.alerts.add(alert(Map.of("a", "1", "alertname", "X"), null));
        provider.alerts.add(alert(Map.of("a", "1", "alertname", "Y"), Instant.now().minusSeconds(5)));
        var dispatcher = dispatcher(provider, List.of(), r);
        dispatcher.start();

        // when
        var first = dispatcher.overview();
        var second = dispatcher.overview();

        // then
        assertThat(first.getGroups()).extracting(AlertGroup::getLabels)
                .containsExactly(LabelSet.of("a", "1"), LabelSet.of("a", "2"));
        assertThat(second.getGroups()).extracting(AlertGroup::getLabels)
                .containsExactly(LabelSet.of("a", "1"), LabelSet.of("a", "2"));
        assertThat(first.getGroups().get(0).getBlocks().get(0).getAlerts()).hasSize(1);
        dispatcher.stop();
    }

    @Test
    void shouldReturnFromStopWhenNeverStarted() {
        // given
        var dispatcher = dispatcher(new MemAlertProvider(), List.of(), null);

        // when
        dispatcher.stop();

        // then
        assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    void shouldExitLoopOnStop() throws Exception {
        // given
        var r = route("r", Map.of(), "ops", Duration.ofMillis(50), Duration.ofHours(1));
        var provider = new MemAlertProvider();
        var dispatcher = dispatcher(provider, List.of(), r);
        startInBackground(dispatcher);
        provider.put(alert(Map.of("alertname", "Down"), null));
        assertThat(notifier.deliveries.poll(3, TimeUnit.SECONDS)).isNotNull();

        // when
        dispatcher.stop();
        loop.join(TimeUnit.SECONDS.toMillis(5));

        // then
        assertThat(loop.isAlive()).isFalse();
        assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    void shouldRefuseToStartAfterGracefulShutdown() {
        // given
        var dispatcher = dispatcher(new MemAlertProvider(), List.of(), null);

        // when
        dispatcher.gracefulShutdown(Duration.ofSeconds(1));

        // then
        assertThat(flushExecutor.isShutdown()).isTrue();
        assertThatThrownBy(dispatcher::start).isInstanceOf(IllegalStateException.class);
    }

    private static final class Delivery {
        private final String receiver;
        private final Fingerprint groupKey;

        private Delivery(String receiver, Fingerprint groupKey) {
            this.receiver = receiver;
            this.groupKey = groupKey;
        }
    }

    private static final class RecordingNotifier implements Notifier {
        private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void notify(NotifyContext ctx, List<Alert> alerts) {
            deliveries.add(new Delivery(ctx.getReceiver(), ctx.getGroupKey()));
        }
    }

    /**
     * 固定告警序列, 读完即结束; broken 中的告警伴随流错误
     */
    private static final class ScriptedProvider implements AlertProvider {
        private final Deque<Alert> alerts = new ArrayDeque<>();
        private final Set<Alert> broken = new HashSet<>();
        private volatile boolean closed;

        @Override
        public AlertIterator subscribe() {
            return new AlertIterator() {
                private Alert current;

                @Override
                public Alert next() {
                    current = alerts.poll();
                    return current;
                }

                @Override
                public Throwable err() {
                    return current != null && broken.contains(current) ? new IllegalStateException("decode failed") : null;
                }

                @Override
                public void close() {
                    closed = true;
                }
            };
        }

        @Override
        public void put(Alert... batch) {
            alerts.addAll(List.of(batch));
        }

        @Override
        public Alert get(Fingerprint fp) {
            throw new NotFoundException("alert " + fp + " not found");
        }
    }
}
