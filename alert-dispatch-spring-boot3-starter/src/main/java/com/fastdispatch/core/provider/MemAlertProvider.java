package com.fastdispatch.core.provider;

import com.fastdispatch.core.spi.AlertIterator;
import com.fastdispatch.core.spi.AlertProvider;
import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 内存告警来源
 * 新订阅者先收到当前全部告警, 之后收到每一次 put
 */
public class MemAlertProvider implements AlertProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemAlertProvider.class);

    /** 流结束标记 */
    private static final Object END = new Object();

    private final Map<Fingerprint, Alert> alerts = new ConcurrentHashMap<>();

    private final Set<MemIterator> subscribers = ConcurrentHashMap.newKeySet();

    /** 保证 put 与 subscribe 的先后一致 */
    private final Object mtx = new Object();

    private volatile boolean closed;

    @Override
    public AlertIterator subscribe() {
        synchronized (mtx) {
            MemIterator it = new MemIterator();
            alerts.values().forEach(it.queue::offer);
            if (closed) {
                it.queue.offer(END);
            } else {
                subscribers.add(it);
            }
            return it;
        }
    }

    @Override
    public void put(Alert... batch) {
        synchronized (mtx) {
            if (closed) {
                throw new IllegalStateException("alert provider closed");
            }
            for (Alert a : batch) {
                alerts.put(a.fingerprint(), a);
                for (MemIterator s : subscribers) {
                    s.queue.offer(a);
                }
            }
        }
    }

    @Override
    public Alert get(Fingerprint fp) {
        Alert a = alerts.get(fp);
        if (a == null) {
            throw new NotFoundException("alert " + fp + " not found");
        }
        return a;
    }

    /**
     * 关闭后所有订阅在消费完已入队告警后结束
     */
    @Override
    public void close() {
        synchronized (mtx) {
            if (closed) {
                return;
            }
            closed = true;
            subscribers.forEach(s -> s.queue.offer(END));
            subscribers.clear();
        }
        log.info("[AlertProvider] closed");
    }

    private class MemIterator implements AlertIterator {

        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

        @Override
        public Alert next() throws InterruptedException {
            Object o = queue.take();
            if (o == END) {
                // 重复调用仍返回结束
                queue.offer(END);
                return null;
            }
            return (Alert) o;
        }

        @Override
        public Throwable err() {
            return null;
        }

        @Override
        public void close() {
            subscribers.remove(this);
        }
    }
}
