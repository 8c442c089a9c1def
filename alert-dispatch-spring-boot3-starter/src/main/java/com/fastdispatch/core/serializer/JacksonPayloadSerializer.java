package com.fastdispatch.core.serializer;

import com.fastdispatch.core.spi.PayloadSerializer;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 事件与告警概览的 JSON 编解码
 */
public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许宿主传入已有 ObjectMapper, 需自行注册 JavaTimeModule */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T deserialize(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot read " + typeRef.getType().getTypeName() + " from stored payload", e);
        }
    }

    @Override
    public String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot write " + payload.getClass().getSimpleName() + " as JSON", e);
        }
    }

    public static ObjectMapper createDefaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                // startsAt/endsAt 按 RFC3339 输出
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // 仍在触发的告警不输出 endsAt
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                // 旧版本事件多出的字段直接忽略
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
