package com.fastdispatch.core.route;

import com.fastdispatch.core.spi.RouteMatcher;
import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.route.Route;

import java.util.ArrayList;
import java.util.List;

/**
 * 静态路由表
 * 返回全部等值匹配命中的路由, 一条都未命中时走默认路由
 */
public class StaticRouteMatcher implements RouteMatcher {

    private final List<Route> routes;

    /** 可为空, 为空时未命中即丢弃 */
    private final Route fallback;

    public StaticRouteMatcher(List<Route> routes, Route fallback) {
        this.routes = List.copyOf(routes);
        this.fallback = fallback;
    }

    @Override
    public List<Route> match(LabelSet labels) {
        List<Route> res = new ArrayList<>(2);
        for (Route r : routes) {
            if (r.matches(labels)) {
                res.add(r);
            }
        }
        if (res.isEmpty() && fallback != null) {
            res.add(fallback);
        }
        return res;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public Route getFallback() {
        return fallback;
    }
}
