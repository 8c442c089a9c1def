package com.fastdispatch.core.group;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

import java.util.function.Consumer;

/**
 * 时间轮上的分组任务
 * 让时间轮返回的 Timeout 能识别所属分组
 */
public class GroupTask implements TimerTask {

    public enum Kind { FLUSH, FLUSH_DEADLINE }

    private final Kind kind;

    private final AggregationGroup group;

    /** 真正要执行的逻辑, 入参为触发的 Timeout */
    private final Consumer<Timeout> actual;

    public GroupTask(Kind kind, AggregationGroup group, Consumer<Timeout> actual) {
        this.kind = kind;
        this.group = group;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        actual.accept(timeout);
    }

    public Kind getKind() {
        return kind;
    }

    public AggregationGroup getGroup() {
        return group;
    }
}
