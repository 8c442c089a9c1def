package com.fastdispatch.model.overview;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 当前全部活跃告警, 按分组标签排序
 */
public class AlertOverview {

    private final List<AlertGroup> groups;

    public AlertOverview(List<AlertGroup> groups) {
        this.groups = List.copyOf(groups);
    }

    @JsonValue
    public List<AlertGroup> getGroups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
