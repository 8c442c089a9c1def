package com.fastdispatch.core.notify.ratelimit;

import com.fastdispatch.core.spi.notify.NotifierFilter;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存窗口限流, 按 接收者+分组 计数
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public RateLimitFilter(Duration window, int threshold, Clock clock) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
        this.windowStart = clock.millis();
    }

    @Override
    public boolean allow(NotifyContext ctx, List<Alert> alerts) {
        long now = clock.millis();
        // 重置窗口
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = ctx.getReceiver() + "_" + ctx.getGroupKey();
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold;
    }
}
