package com.fastdispatch.core.store;

import com.fastdispatch.core.spi.EventStore;
import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存事件存储, 未配置数据源时使用
 */
public class MemEventStore implements EventStore {

    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentSkipListMap<Long, Event> events = new ConcurrentSkipListMap<>();

    @Override
    public long set(Event event) {
        long id = sequence.incrementAndGet();
        event.setId(id);
        events.put(id, copy(event));
        return id;
    }

    @Override
    public Event get(long id) {
        Event e = events.get(id);
        if (e == null) {
            throw new NotFoundException("event " + id + " not found");
        }
        return copy(e);
    }

    @Override
    public List<Event> all() {
        List<Event> res = new ArrayList<>(events.size());
        events.values().forEach(e -> res.add(copy(e)));
        return res;
    }

    private static Event copy(Event e) {
        return e.toBuilder().alerts(new ArrayList<>(e.getAlerts())).build();
    }
}
