package com.fastdispatch.core.spi.notify;

import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;

import java.util.List;

/**
 * 过滤器：限流、去抖等
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行，false 表示本次抑制
     */
    boolean allow(NotifyContext ctx, List<Alert> alerts);
}
