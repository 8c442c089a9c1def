package com.fastdispatch.core.group;

import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;

import java.util.List;

/**
 * 分组投递函数, 由引擎注入
 */
@FunctionalInterface
public interface NotifyFunction {

    /** 返回 false 表示投递失败, 告警保留到下一次 flush */
    boolean notify(NotifyContext ctx, List<Alert> alerts);
}
