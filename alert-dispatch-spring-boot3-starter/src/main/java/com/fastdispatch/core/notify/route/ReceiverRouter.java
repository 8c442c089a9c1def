package com.fastdispatch.core.notify.route;

import com.fastdispatch.core.spi.notify.Notifier;
import com.fastdispatch.core.spi.notify.NotifierRouter;
import com.fastdispatch.model.ctx.NotifyContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按接收者路由
 * 未单独登记的接收者走默认渠道
 */
public class ReceiverRouter implements NotifierRouter {

    private final List<Notifier> defaults;

    private final Map<String, List<Notifier>> byReceiver = new ConcurrentHashMap<>();

    public ReceiverRouter(List<Notifier> defaults) {
        this.defaults = List.copyOf(defaults);
    }

    public ReceiverRouter register(String receiver, List<Notifier> notifiers) {
        byReceiver.put(receiver, List.copyOf(notifiers));
        return this;
    }

    @Override
    public List<Notifier> route(NotifyContext ctx) {
        List<Notifier> candidates = byReceiver.getOrDefault(ctx.getReceiver(), defaults);
        return candidates.stream()
                .filter(n -> n.supports(ctx))
                .toList();
    }
}
