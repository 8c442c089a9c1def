package com.fastdispatch.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * 事件级别
 */
@AllArgsConstructor
@Getter
public enum EventLevel {
    INFO("info", "普通"),
    WARN("warn", "严重"),
    CRITICAL("critical", "重大")
    ;

    @JsonValue
    public final String code;
    public final String desc;

    @JsonCreator
    public static EventLevel from(String v) {
        return EventLevel.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
