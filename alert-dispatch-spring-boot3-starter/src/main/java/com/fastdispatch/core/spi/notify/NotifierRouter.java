package com.fastdispatch.core.spi.notify;

import com.fastdispatch.model.ctx.NotifyContext;

import java.util.List;

/**
 * 路由：根据接收者 → 选择若干 Notifier
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx);
}
