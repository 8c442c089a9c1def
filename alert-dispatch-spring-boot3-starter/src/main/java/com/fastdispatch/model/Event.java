package com.fastdispatch.model;

import com.fastdispatch.model.enums.EventKind;
import com.fastdispatch.model.enums.EventLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 运维事件, 把若干告警归到一次事件下
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    /** 存储分配的顺序 id */
    private Long id;

    private Instant createdAt;

    private EventKind kind;

    private EventLevel level;

    /** 是否已安全 */
    @JsonProperty("is_safe")
    private boolean safe;

    private String summary;

    /** 告警 fingerprint, 无符号十进制 */
    @Builder.Default
    private List<String> alerts = new ArrayList<>();
}
