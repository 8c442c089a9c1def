package com.fastdispatch.core.spi;

import com.fastdispatch.model.LabelSet;
import com.fastdispatch.model.route.Route;

import java.util.List;

/**
 * 路由匹配, 一个标签集可命中零或多条路由
 */
public interface RouteMatcher {

    List<Route> match(LabelSet labels);
}
