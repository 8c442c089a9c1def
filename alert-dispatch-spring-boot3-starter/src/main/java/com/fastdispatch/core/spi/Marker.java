package com.fastdispatch.core.spi;

import com.fastdispatch.model.Fingerprint;

import java.util.OptionalLong;

/**
 * 告警静默/抑制状态
 */
public interface Marker {

    /** 静默该告警的 silence id, 未静默为空 */
    OptionalLong silenced(Fingerprint fp);

    boolean inhibited(Fingerprint fp);
}
