package com.umitunal.qworker.model;

import com.umitunal.qworker.serialization.JsonCodec;
import com.umitunal.qworker.serialization.PayloadFormat;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkUnitSerializerTest {

    private final WorkUnitSerializer serializer = new WorkUnitSerializer(PayloadFormat.JSON.codec());

    @Test
    @DisplayName("Should preserve id, failed tries and payload")
    void testEnvelopeFields() {
        // Given
        WorkUnit original = new WorkUnit("job-1", Map.of("user_id", 42, "email_address", "a@b.c"), 2);

        // When
        WorkUnit deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getId()).isEqualTo("job-1");
        assertThat(deserialized.getFailedTries()).isEqualTo(2);
        assertThat(deserialized.getPayload()).containsEntry("user_id", 42).containsEntry("email_address", "a@b.c");
    }

    @Test
    @DisplayName("Should handle a job without id")
    void testNullId() {
        // Given
        WorkUnit original = WorkUnit.of("type", "remove");

        // When
        WorkUnit deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getId()).isNull();
        assertThat(deserialized.getFailedTries()).isZero();
    }

    @Test
    @DisplayName("Should keep payload key order")
    void testKeyOrder() {
        // Given
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("zeta", 1);
        payload.put("alpha", 2);
        payload.put("mid", 3);

        // When
        WorkUnit deserialized = serializer.deserialize(serializer.serialize(new WorkUnit(payload)));

        // Then
        assertThat(deserialized.getPayload().keySet()).containsExactly("zeta", "alpha", "mid");
    }

    @Test
    @DisplayName("Should work with Kryo payloads")
    void testKryoFormat() {
        // Given
        WorkUnitSerializer kryo = new WorkUnitSerializer(PayloadFormat.KRYO.codec());
        List<Long> messageIds = new ArrayList<>(List.of(1L, 2L));
        WorkUnit original = new WorkUnit("job-7", Map.of("user_profile_id", 5L, "message_ids", messageIds), 1);

        // When
        WorkUnit deserialized = kryo.deserialize(kryo.serialize(original));

        // Then
        assertThat(deserialized).isEqualTo(original);
    }

    @Test
    @DisplayName("Should accept any map codec")
    void testCustomCodec() {
        // Given
        WorkUnitSerializer custom = new WorkUnitSerializer(new JsonCodec<>(new TypeReference<Map<String, Object>>() { }));

        // When
        WorkUnit deserialized = custom.deserialize(custom.serialize(WorkUnit.of("query", "send_message")));

        // Then
        assertThat(deserialized.get("query")).isEqualTo("send_message");
    }

    @Test
    @DisplayName("Should handle Unicode ids and payloads")
    void testUnicode() {
        // Given
        String unicodeId = "job-日本語-🚀-中文";
        WorkUnit original = new WorkUnit(unicodeId, Map.of("message", "ótest 😀"), 0);

        // When
        WorkUnit deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getId()).isEqualTo(unicodeId);
        assertThat(deserialized.get("message")).isEqualTo("ótest 😀");
    }

    @Test
    @DisplayName("Should be deterministic (same input produces same output)")
    void testDeterminism() {
        // Given
        WorkUnit unit = new WorkUnit("job-10", Map.of("k", "v"), 1);

        // When
        byte[] serialized1 = serializer.serialize(unit);
        byte[] serialized2 = serializer.serialize(unit);

        // Then
        assertThat(serialized1).isEqualTo(serialized2);
    }
}
