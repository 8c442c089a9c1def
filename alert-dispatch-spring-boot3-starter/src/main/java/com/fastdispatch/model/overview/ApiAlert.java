package com.fastdispatch.model.overview;

import com.fastdispatch.model.Alert;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 附带静默/抑制信息的告警
 */
@Getter
@AllArgsConstructor
public class ApiAlert {

    @JsonUnwrapped
    private final Alert alert;

    private final boolean inhibited;

    /** silence id, 0 表示未静默 */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private final long silenced;
}
