package com.fastdispatch.core.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 结构化取消令牌
 * 取消父作用域会级联取消所有子作用域, 子作用域可独立取消且不影响兄弟
 */
public final class CancellationScope {

    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final CancellationScope parent;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final Set<CancellationScope> children = ConcurrentHashMap.newKeySet();

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationScope(CancellationScope parent) {
        this.parent = parent;
    }

    public static CancellationScope root() {
        return new CancellationScope(null);
    }

    /**
     * 派生子作用域, 父已取消时子作用域一出生即为取消状态
     */
    public CancellationScope child() {
        CancellationScope c = new CancellationScope(this);
        children.add(c);
        if (cancelled.get()) {
            c.cancel();
        }
        return c;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (CancellationScope c : children) {
            c.cancel();
        }
        children.clear();
        for (Runnable r : listeners) {
            // 与 onCancel 竞争, 谁先摘除谁执行
            if (listeners.remove(r)) {
                try {
                    r.run();
                } catch (RuntimeException e) {
                    log.warn("[Cancel] listener failed", e);
                }
            }
        }
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 注册取消回调, 已取消则立即执行
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    int childCount() {
        return children.size();
    }
}
