package com.umitunal.qworker.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    @Test
    @DisplayName("Should decode payload maps with JSON types")
    void testPayloadMap() {
        // Given
        PayloadCodec<Map<String, Object>> codec = PayloadFormat.JSON.codec();

        // When
        Map<String, Object> decoded = codec.decode(
                "{\"user_profile_id\":7,\"time\":1.5,\"client\":\"ios\"}".getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(decoded).containsEntry("user_profile_id", 7)
                .containsEntry("time", 1.5)
                .containsEntry("client", "ios");
    }

    @Test
    @DisplayName("Should encode typed objects")
    void testTypedPayload() {
        // Given
        JsonCodec<Member> codec = new JsonCodec<>(Member.class);

        // When
        Member decoded = codec.decode(codec.encode(new Member("foo@bar.baz", "subscribed")));

        // Then
        assertThat(decoded.email_address).isEqualTo("foo@bar.baz");
        assertThat(decoded.status).isEqualTo("subscribed");
    }

    @Test
    @DisplayName("Should wrap parse failures")
    void testMalformed() {
        assertThatThrownBy(() -> PayloadFormat.JSON.codec().decode("[1,".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(UncheckedIOException.class);
    }

    public static class Member {
        public String email_address;
        public String status;

        public Member() {}

        public Member(String emailAddress, String status) {
            this.email_address = emailAddress;
            this.status = status;
        }
    }
}
