package com.fastdispatch.model.overview;

import com.fastdispatch.model.route.RouteOpts;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 同一路由下的一组告警
 */
@Getter
@AllArgsConstructor
public class AlertBlock {

    private final RouteOpts routeOpts;

    private final List<ApiAlert> alerts;
}
