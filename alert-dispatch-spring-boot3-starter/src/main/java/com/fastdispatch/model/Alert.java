package com.fastdispatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * 告警
 * 上游产生, 分组只持有引用不做拷贝
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
public class Alert {

    /** 标签, 决定告警身份 */
    private final LabelSet labels;

    /** 注解, 不参与身份计算 */
    @Builder.Default
    private final Map<String, String> annotations = Map.of();

    private final Instant startsAt;

    /** 为空表示仍在触发 */
    private final Instant endsAt;

    private final Instant updatedAt;

    private final String generatorUrl;

    @JsonIgnore
    public Fingerprint fingerprint() {
        return labels.fingerprint();
    }

    /**
     * 在给定时刻是否已恢复
     */
    public boolean resolvedAt(Instant now) {
        return endsAt != null && !endsAt.isAfter(now);
    }

    /**
     * 在给定时刻是否仍在触发
     */
    public boolean firingAt(Instant now) {
        return endsAt == null || endsAt.isAfter(now);
    }

    @Override
    public String toString() {
        return labels + "[" + fingerprint() + "]" + (endsAt == null ? "" : "[resolved]");
    }
}
