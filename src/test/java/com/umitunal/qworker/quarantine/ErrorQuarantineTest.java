package com.umitunal.qworker.quarantine;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ErrorQuarantineTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should append one timestamped JSON array line per record")
    void testLineFormat() throws Exception {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:15:30Z"));
        ErrorQuarantine quarantine = new ErrorQuarantine(tempDir.resolve("queue_error"), clock);

        // When
        quarantine.record("signups", new WorkUnit("test_missed", Map.of("user_id", 10), 4));
        clock.advance(Duration.ofSeconds(1));
        quarantine.record("signups", List.of(WorkUnit.of("user_id", 11), WorkUnit.of("user_id", 12)));

        // Then
        List<String> lines = Files.readAllLines(tempDir.resolve("queue_error").resolve("signups.errors"));
        assertThat(lines).containsExactly(
                "2024-03-01T10:15:30Z\t[{\"user_id\":10,\"id\":\"test_missed\",\"failed_tries\":4}]",
                "2024-03-01T10:15:31Z\t[{\"user_id\":11},{\"user_id\":12}]");
    }

    @Test
    @DisplayName("Should read records back oldest first")
    void testRead() {
        // Given
        ErrorQuarantine quarantine = new ErrorQuarantine(tempDir);
        quarantine.record("email_senders", WorkUnit.of("to_emails", List.of("a@example.com")));
        quarantine.record("email_senders", List.of(WorkUnit.of("n", 1), WorkUnit.of("n", 2)));

        // When
        List<QuarantineRecord> records = quarantine.read("email_senders");

        // Then
        assertThat(records).hasSize(2);
        assertThat(records.get(0).getQueueName()).isEqualTo("email_senders");
        assertThat(records.get(0).getJobs().get(0).get("to_emails")).isEqualTo(List.of("a@example.com"));
        assertThat(records.get(1).getJobs()).extracting(job -> job.get("n")).containsExactly(1, 2);
        assertThat(records.get(0).getTimestamp()).isBeforeOrEqualTo(records.get(1).getTimestamp());
    }

    @Test
    @DisplayName("Should return nothing for a queue without a file")
    void testReadMissing() {
        assertThat(new ErrorQuarantine(tempDir).read("nothing_here")).isEmpty();
    }

    @Test
    @DisplayName("Should keep concurrent records on separate lines")
    void testConcurrentWriters() throws Exception {
        // Given
        ErrorQuarantine first = new ErrorQuarantine(tempDir);
        ErrorQuarantine second = new ErrorQuarantine(tempDir);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // When
        for (int i = 0; i < 200; i++) {
            ErrorQuarantine target = i % 2 == 0 ? first : second;
            int n = i;
            executor.submit(() -> target.record("shared", WorkUnit.of("n", n, "padding", "x".repeat(500))));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Then
        List<QuarantineRecord> records = first.read("shared");
        assertThat(records).hasSize(200);
        assertThat(records).allSatisfy(record -> assertThat(record.getJobs()).hasSize(1));
        assertThat(records.stream().map(r -> r.getJobs().get(0).get("n")).distinct().count()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject queue names that are not plain file names")
    void testInvalidQueueName() {
        ErrorQuarantine quarantine = new ErrorQuarantine(tempDir);
        Job job = WorkUnit.of("x", 1);

        assertThatThrownBy(() -> quarantine.record("../escape", job)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> quarantine.record("", job)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> quarantine.record(".hidden", job)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail on malformed lines")
    void testMalformedLine() throws Exception {
        // Given
        Files.writeString(tempDir.resolve("broken.errors"), "no tab here\n");

        // When / Then
        assertThatThrownBy(() -> new ErrorQuarantine(tempDir).read("broken"))
                .isInstanceOf(IllegalStateException.class);
    }
}
