package com.umitunal.qworker.serialization;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Map;

/**
 * Storage format for job payloads kept by a durable queue client.
 */
public enum PayloadFormat {
    JSON,
    KRYO;

    @SuppressWarnings("unchecked")
    public PayloadCodec<Map<String, Object>> codec() {
        return switch (this) {
            case JSON -> new JsonCodec<>(new TypeReference<Map<String, Object>>() { });
            case KRYO -> new KryoCodec<>((Class<Map<String, Object>>) (Class<?>) Map.class);
        };
    }
}
