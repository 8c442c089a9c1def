package com.fastdispatch.core.spi;

import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Event;

import java.util.List;

/**
 * 历史事件存储
 */
public interface EventStore {

    /** 保存事件, 返回分配的顺序 id */
    long set(Event event);

    /**
     * @throws NotFoundException 事件不存在
     */
    Event get(long id);

    /** 按 id 升序返回全部事件 */
    List<Event> all();
}
