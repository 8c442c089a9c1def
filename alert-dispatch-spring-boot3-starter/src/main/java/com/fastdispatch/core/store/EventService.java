package com.fastdispatch.core.store;

import com.fastdispatch.core.spi.AlertProvider;
import com.fastdispatch.core.spi.EventStore;
import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Event;
import com.fastdispatch.model.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 事件操作入口, 供外部 API 层调用
 * 未找到的事件/告警以 {@link NotFoundException} 原样抛出
 */
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventStore events;

    private final AlertProvider alerts;

    private final Clock clock;

    public EventService(EventStore events, AlertProvider alerts, Clock clock) {
        this.events = events;
        this.alerts = alerts;
        this.clock = clock;
    }

    public List<Event> listEvents() {
        return events.all();
    }

    /**
     * 新增事件, 未指定创建时间时取当前时间
     * @return 分配的事件 id
     */
    public long addEvent(Event event) {
        if (event.getCreatedAt() == null) {
            event.setCreatedAt(clock.instant());
        }
        long id = events.set(event);
        log.info("[Event] added id={}, kind={}, level={}, alerts={}",
                id, event.getKind(), event.getLevel(), event.getAlerts().size());
        return id;
    }

    /**
     * 事件关联的告警
     * @throws IllegalArgumentException id 不是无符号整数
     * @throws NotFoundException 事件或其中任一告警不存在
     */
    public List<Alert> listEventAlerts(String eventId) {
        Event event = events.get(parseId(eventId));

        List<Alert> res = new ArrayList<>(event.getAlerts().size());
        for (String ids : event.getAlerts()) {
            Fingerprint fp;
            try {
                fp = Fingerprint.fromDecimal(ids);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid alert id '" + ids + "' in event " + eventId, e);
            }
            res.add(alerts.get(fp));
        }
        return res;
    }

    private static long parseId(String s) {
        try {
            return Long.parseUnsignedLong(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid event id '" + s + "'", e);
        }
    }
}
