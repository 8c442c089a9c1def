package com.fastdispatch.core.spi.notify;

import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;

import java.util.List;

/**
 * 通知渠道
 */
public interface Notifier {

    /**
     * 返回此Notifier支持的渠道/名称, 用于路由日志与指标纬度
     */
    String name();

    /**
     * 能否处理此分组, 粗粒度过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 同步投递, 抛异常视为失败; 应关注 ctx 的取消
     */
    void notify(NotifyContext ctx, List<Alert> alerts) throws Exception;
}
