package com.fastdispatch.model.ctx;

import com.fastdispatch.core.cancel.CancellationScope;
import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.LabelSet;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次 flush 的通知上下文
 */
public class NotifyContext {

    /** 定时器触发时刻, 整条通知链路以此为准 */
    private final Instant now;

    /** 分组键, 路由内唯一 */
    private final Fingerprint groupKey;

    private final LabelSet groupLabels;

    private final String receiver;

    private final Duration repeatInterval;

    /** 超过该时刻通知应放弃 */
    private final Instant deadline;

    private final CancellationScope scope;

    public NotifyContext(Instant now, Fingerprint groupKey, LabelSet groupLabels, String receiver,
                         Duration repeatInterval, Instant deadline, CancellationScope scope) {
        this.now = now;
        this.groupKey = groupKey;
        this.groupLabels = groupLabels;
        this.receiver = receiver;
        this.repeatInterval = repeatInterval;
        this.deadline = deadline;
        this.scope = scope;
    }

    public Instant getNow() {
        return now;
    }

    public Fingerprint getGroupKey() {
        return groupKey;
    }

    public LabelSet getGroupLabels() {
        return groupLabels;
    }

    public String getReceiver() {
        return receiver;
    }

    public Duration getRepeatInterval() {
        return repeatInterval;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public CancellationScope getScope() {
        return scope;
    }

    public boolean isCancelled() {
        return scope.isCancelled();
    }

    /**
     * 距截止时刻的剩余时间, 不会为负
     */
    public Duration remaining(Instant at) {
        Duration d = Duration.between(at, deadline);
        return d.isNegative() ? Duration.ZERO : d;
    }

    @Override
    public String toString() {
        return "NotifyContext{receiver=" + receiver + ", groupKey=" + groupKey + ", groupLabels=" + groupLabels
                + ", now=" + now + ", deadline=" + deadline + "}";
    }
}
