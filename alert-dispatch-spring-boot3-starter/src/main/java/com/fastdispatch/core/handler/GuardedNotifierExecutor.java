package com.fastdispatch.core.handler;

import com.fastdispatch.config.DispatchGuardProperties;
import com.fastdispatch.exception.guard.ReceiverBulkheadFullException;
import com.fastdispatch.exception.guard.ReceiverOpenCircuitException;
import com.fastdispatch.exception.guard.ReceiverRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 通知渠道保护
 * 按 receiver 对投递调用增加 RL/BH/CB 装饰
 */
public class GuardedNotifierExecutor {

    private final DispatchGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedNotifierExecutor(DispatchGuardProperties props) {
        this.props = props;
    }

    /**
     * 统一入口
     * 组合装饰 RateLimiter → Bulkhead → CircuitBreaker 后执行
     */
    public <T> T execute(String receiver, Callable<T> call) throws Exception {
        Callable<T> decorated = call;

        // RateLimit最外层限流，抑制突发流量
        if (enabled(props.getRateLimiter(), props.getRlPerReceiver(), receiver, DispatchGuardProperties.RlConfig::isEnabled)) {
            RateLimiter rl = rlCache.computeIfAbsent(receiver, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        // Bulkhead 限制下游并发
        if (enabled(props.getBulkhead(), props.getBhPerReceiver(), receiver, DispatchGuardProperties.BhConfig::isEnabled)) {
            Bulkhead bh = bhCache.computeIfAbsent(receiver, this::buildBh);
            decorated = Bulkhead.decorateCallable(bh, decorated);
        }

        // CircuitBreaker fail-fast 熔断器
        if (enabled(props.getCircuitBreaker(), props.getCbPerReceiver(), receiver, DispatchGuardProperties.CbConfig::isEnabled)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(receiver, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new ReceiverOpenCircuitException(receiver, open);
        } catch (BulkheadFullException full) {
            throw new ReceiverBulkheadFullException(receiver, full);
        } catch (RequestNotPermitted rnp) {
            throw new ReceiverRateLimitedException(receiver, rnp);
        }
    }

    private RateLimiter buildRl(String receiver) {
        DispatchGuardProperties.RlConfig r = pick(props.getRlPerReceiver(), receiver, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + receiver, cfg);
    }

    private Bulkhead buildBh(String receiver) {
        DispatchGuardProperties.BhConfig b = pick(props.getBhPerReceiver(), receiver, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + receiver, cfg);
    }

    private CircuitBreaker buildCb(String receiver) {
        DispatchGuardProperties.CbConfig c = pick(props.getCbPerReceiver(), receiver, props.getCircuitBreaker());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + receiver, cfg);
    }

    private static <C> C pick(Map<String, C> perReceiver, String receiver, C def) {
        if (perReceiver == null) {
            return def;
        }
        return perReceiver.getOrDefault(receiver, def);
    }

    private static <C> boolean enabled(C defaultCfg, Map<String, C> map, String receiver, Predicate<C> isEnabled) {
        if (defaultCfg == null) {
            return false;
        }
        // receiver 配置不为空则使用 receiver 配置
        return isEnabled.test(pick(map, receiver, defaultCfg));
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String receiver) {
        if (!enabled(props.getCircuitBreaker(), props.getCbPerReceiver(), receiver, DispatchGuardProperties.CbConfig::isEnabled)) {
            return null;
        }
        return cbCache.computeIfAbsent(receiver, this::buildCb);
    }
}
