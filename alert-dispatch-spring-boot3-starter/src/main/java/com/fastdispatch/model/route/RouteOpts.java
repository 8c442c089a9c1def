package com.fastdispatch.model.route;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Set;

/**
 * 路由的分组与通知节奏
 */
@Getter
@Builder
public class RouteOpts {

    /** 接收者 */
    private final String receiver;

    /** 参与分组的标签名 */
    @Builder.Default
    private final Set<String> groupBy = Set.of();

    /** 首次通知前的等待 */
    @Builder.Default
    private final Duration groupWait = Duration.ofSeconds(30);

    /** 分组再次通知的间隔 */
    @Builder.Default
    private final Duration groupInterval = Duration.ofMinutes(5);

    /** 内容不变时重复通知的最小间隔 */
    @Builder.Default
    private final Duration repeatInterval = Duration.ofHours(4);

    @Override
    public String toString() {
        return "RouteOpts{receiver=" + receiver + ", groupBy=" + groupBy
                + ", groupWait=" + groupWait + ", groupInterval=" + groupInterval
                + ", repeatInterval=" + repeatInterval + "}";
    }
}
