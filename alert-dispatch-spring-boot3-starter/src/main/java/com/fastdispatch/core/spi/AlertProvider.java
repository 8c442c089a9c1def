package com.fastdispatch.core.spi;

import com.fastdispatch.exception.NotFoundException;
import com.fastdispatch.model.Alert;
import com.fastdispatch.model.Fingerprint;

/**
 * 告警来源
 */
public interface AlertProvider {

    /** 每次返回一个新的迭代器 */
    AlertIterator subscribe();

    void put(Alert... alerts);

    /**
     * @throws NotFoundException 告警不存在
     */
    Alert get(Fingerprint fp);
}
