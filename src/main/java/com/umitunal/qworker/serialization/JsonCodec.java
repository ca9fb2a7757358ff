package com.umitunal.qworker.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec using Jackson.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(Class<T> type) {
        this(createDefaultMapper(), type);
    }

    public JsonCodec(TypeReference<T> type) {
        this(createDefaultMapper(), type);
    }

    public JsonCodec(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    public JsonCodec(ObjectMapper mapper, TypeReference<T> type) {
        this.mapper = mapper;
        this.type = mapper.getTypeFactory().constructType(type);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize from JSON", e);
        }
    }

    static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
