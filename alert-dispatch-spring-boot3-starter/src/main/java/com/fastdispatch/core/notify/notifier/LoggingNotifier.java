package com.fastdispatch.core.notify.notifier;

import com.fastdispatch.core.spi.notify.Notifier;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.ctx.NotifyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) {
        long firing = alerts.stream().filter(a -> a.firingAt(ctx.getNow())).count();
        if (firing > 0) {
            log.warn("[Notify-{}] group={}, labels={}, firing={}, resolved={}, alerts={}",
                    ctx.getReceiver(), ctx.getGroupKey(), ctx.getGroupLabels(), firing, alerts.size() - firing, truncate(alerts.toString()));
        } else {
            log.info("[Notify-{}] group={}, labels={}, resolved={}",
                    ctx.getReceiver(), ctx.getGroupKey(), ctx.getGroupLabels(), alerts.size());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
