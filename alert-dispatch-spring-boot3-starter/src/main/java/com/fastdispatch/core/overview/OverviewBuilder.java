package com.fastdispatch.core.overview;

import com.fastdispatch.core.group.AggregationGroup;
import com.fastdispatch.core.spi.Marker;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.overview.AlertBlock;
import com.fastdispatch.model.overview.AlertGroup;
import com.fastdispatch.model.overview.AlertOverview;
import com.fastdispatch.model.overview.ApiAlert;
import com.fastdispatch.model.route.Route;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把引擎内部分组投影为只读概览
 * 调用方负责持有引擎读锁
 */
public final class OverviewBuilder {

    private OverviewBuilder() {}

    public static AlertOverview build(Map<Route, Map<Fingerprint, AggregationGroup>> aggrGroups,
                                      Marker marker,
                                      Instant now) {
        Map<Fingerprint, AlertGroup> seen = new HashMap<>();
        List<AlertGroup> overview = new ArrayList<>();

        for (Map.Entry<Route, Map<Fingerprint, AggregationGroup>> e : aggrGroups.entrySet()) {
            for (AggregationGroup ag : e.getValue().values()) {
                List<ApiAlert> apiAlerts = new ArrayList<>();
                for (Alert a : ag.alertSlice()) {
                    if (!a.firingAt(now)) {
                        continue;
                    }
                    apiAlerts.add(new ApiAlert(a,
                            marker.inhibited(a.fingerprint()),
                            marker.silenced(a.fingerprint()).orElse(0L)));
                }
                if (apiAlerts.isEmpty()) {
                    continue;
                }
                AlertGroup group = seen.computeIfAbsent(ag.fingerprint(), fp -> {
                    AlertGroup g = new AlertGroup(ag.getLabels());
                    overview.add(g);
                    return g;
                });
                group.getBlocks().add(new AlertBlock(e.getKey().getOpts(), apiAlerts));
            }
        }

        overview.sort(Comparator.comparing(AlertGroup::getLabels));
        return new AlertOverview(overview);
    }
}
