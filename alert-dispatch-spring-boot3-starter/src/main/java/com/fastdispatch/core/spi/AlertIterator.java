package com.fastdispatch.core.spi;

import com.fastdispatch.model.Alert;

/**
 * 告警流迭代器, 只能消费一次
 */
public interface AlertIterator extends AutoCloseable {

    /**
     * 阻塞直到下一条告警
     * @return 告警, 流结束返回 null
     */
    Alert next() throws InterruptedException;

    /** 最近一次错误, 没有则为 null */
    Throwable err();

    @Override
    void close();
}
