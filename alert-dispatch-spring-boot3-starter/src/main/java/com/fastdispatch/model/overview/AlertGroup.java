package com.fastdispatch.model.overview;

import com.fastdispatch.model.LabelSet;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 分组标签相同的告警块
 */
@Getter
public class AlertGroup {

    private final LabelSet labels;

    private final List<AlertBlock> blocks = new ArrayList<>();

    public AlertGroup(LabelSet labels) {
        this.labels = labels;
    }
}
