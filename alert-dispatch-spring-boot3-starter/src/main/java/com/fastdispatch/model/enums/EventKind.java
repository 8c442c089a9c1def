package com.fastdispatch.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * 事件类型
 */
@AllArgsConstructor
@Getter
public enum EventKind {
    MAINTAIN("maintain", "维护"),
    ABNORMAL("abnormal", "异常"),
    PREWARNING("prewarning", "预警")
    ;

    @JsonValue
    public final String code;
    public final String desc;

    @JsonCreator
    public static EventKind from(String v) {
        return EventKind.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
