package com.umitunal.qworker.storage;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryQueueClientTest {

    private final InMemoryQueueClient client = new InMemoryQueueClient();

    @Test
    @DisplayName("Should drain the backlog once, then return nothing")
    void testDrain() {
        // Given
        client.publish("user_activity", WorkUnit.of("n", 1));
        client.publish("slow_queries", WorkUnit.of("n", 2));
        client.publish("user_activity", WorkUnit.of("n", 3));

        // When
        List<Job> first = client.drain("user_activity");
        List<Job> second = client.drain("user_activity");

        // Then
        assertThat(first).extracting(job -> job.get("n")).containsExactly(1, 3);
        assertThat(second).isEmpty();
        assertThat(client.backlogSize("slow_queries")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should honour the drain limit")
    void testDrainLimit() {
        // Given
        for (int i = 0; i < 5; i++) {
            client.publish("q", WorkUnit.of("n", i));
        }

        // When
        List<Job> drained = client.drain("q", 2);

        // Then
        assertThat(drained).extracting(job -> job.get("n")).containsExactly(0, 1);
        assertThat(client.backlogSize("q")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should deliver jobs published by a callback in the same run")
    void testRepublishDuringConsume() {
        // Given
        List<Integer> seen = new ArrayList<>();
        client.register("q", job -> {
            seen.add(job.getFailedTries());
            if (job.getFailedTries() < 2) {
                client.publish("q", job.withFailedTries(job.getFailedTries() + 1));
            }
        });
        client.publish("q", WorkUnit.of("n", 1));

        // When
        client.startConsuming();

        // Then
        assertThat(seen).containsExactly(0, 1, 2);
        assertThat(client.backlogSize("q")).isZero();
    }

    @Test
    @DisplayName("Should leave jobs of unregistered queues in place")
    void testUnregisteredQueue() {
        // Given
        List<Job> delivered = new ArrayList<>();
        client.register("a", delivered::add);
        client.publish("b", WorkUnit.of("n", 1));
        client.publish("a", WorkUnit.of("n", 2));

        // When
        client.startConsuming();

        // Then
        assertThat(delivered).extracting(job -> job.get("n")).containsExactly(2);
        assertThat(client.backlogSize("b")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop delivering after stopConsuming")
    void testStop() {
        // Given
        List<Job> delivered = new ArrayList<>();
        client.register("q", job -> {
            delivered.add(job);
            client.stopConsuming();
        });
        client.publish("q", WorkUnit.of("n", 1));
        client.publish("q", WorkUnit.of("n", 2));

        // When
        client.startConsuming();

        // Then
        assertThat(delivered).hasSize(1);
        assertThat(client.backlogSize("q")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep a job whose callback throws")
    void testCallbackFailureKeepsJob() {
        // Given
        client.register("q", job -> {
            throw new IllegalStateException("handler crashed");
        });
        client.publish("q", WorkUnit.of("n", 1));
        client.publish("q", WorkUnit.of("n", 2));

        // When
        assertThatThrownBy(client::startConsuming).isInstanceOf(IllegalStateException.class);

        // Then
        List<Job> remaining = client.drain("q");
        assertThat(remaining).extracting(job -> job.get("n")).containsExactly(1, 2);
    }
}
