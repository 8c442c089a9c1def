package com.fastdispatch.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 序列化
 */
public interface PayloadSerializer {

    /** 反序列化 JSON 为指定泛型类型 */
    <T> T deserialize(String json, TypeReference<T> typeRef);

    /** 将对象序列化为 JSON 字符串 */
    String serialize(Object obj);
}
