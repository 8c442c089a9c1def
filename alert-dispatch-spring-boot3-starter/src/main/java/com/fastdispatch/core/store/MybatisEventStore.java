package com.fastdispatch.core.store;

import com.fastdispatch.core.spi.EventStore;
import com.fastdispatch.core.spi.PayloadSerializer;
import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.mapper.AlertEventMapper;
import com.fastdispatch.model.Event;
import com.fastdispatch.model.entity.AlertEventEntity;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * 基于 MyBatis-Plus 的事件存储
 * id 由数据库自增分配, 事件本体以 JSON 存放
 */
public class MybatisEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisEventStore.class);

    private static final TypeReference<Event> EVENT_TYPE = new TypeReference<>() {};

    private final AlertEventMapper mapper;

    private final PayloadSerializer serializer;

    public MybatisEventStore(AlertEventMapper mapper, PayloadSerializer serializer) {
        this.mapper = mapper;
        this.serializer = serializer;
    }

    @Override
    public long set(Event event) {
        AlertEventEntity entity = new AlertEventEntity();
        entity.setCreatedAt(event.getCreatedAt() == null ? null
                : LocalDateTime.ofInstant(event.getCreatedAt(), ZoneOffset.UTC));
        entity.setPayload(serializer.serialize(event));
        try {
            mapper.insert(entity);
        } catch (Exception e) {
            log.error("[EventStore] insert event failed, summary={}", event.getSummary(), e);
            throw e;
        }
        event.setId(entity.getId());
        return entity.getId();
    }

    @Override
    public Event get(long id) {
        AlertEventEntity entity = mapper.selectById(id);
        if (entity == null) {
            throw new NotFoundException("event " + id + " not found");
        }
        return toEvent(entity);
    }

    @Override
    public List<Event> all() {
        return mapper.selectAllOrdered().stream()
                .map(this::toEvent)
                .toList();
    }

    private Event toEvent(AlertEventEntity entity) {
        Event e = serializer.deserialize(entity.getPayload(), EVENT_TYPE);
        // 以存储分配的 id 为准
        e.setId(entity.getId());
        return e;
    }
}
