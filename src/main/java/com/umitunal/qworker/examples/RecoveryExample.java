package com.umitunal.qworker.examples;

import com.umitunal.qworker.config.StorageConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.quarantine.QuarantineReplayer;
import com.umitunal.qworker.storage.RocksQueueClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Recovery example - jobs survive a restart of the durable client, and
 * quarantined jobs can be replayed.
 */
public class RecoveryExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Job Recovery Example ===\n");

        Path dataDir = Files.createTempDirectory("qworker-recovery");
        StorageConfig config = StorageConfig.newBuilder(dataDir.resolve("queues").toString())
                .build();

        try (RocksQueueClient client = RocksQueueClient.open(config)) {
            client.publish("signups", WorkUnit.of("user_id", 1, "email_address", "a@example.com"));
            client.publish("signups", WorkUnit.of("user_id", 2, "email_address", "b@example.com"));
            System.out.println("Published 2 jobs, backlog " + client.backlogSize("signups"));
        }

        System.out.println("\nClient closed (simulating restart)");

        ErrorQuarantine quarantine = new ErrorQuarantine(dataDir.resolve("queue_error"));
        try (RocksQueueClient client = RocksQueueClient.open(config)) {
            System.out.println("Backlog after restart: " + client.backlogSize("signups"));

            List<Job> jobs = client.drain("signups");
            for (Job job : jobs) {
                System.out.println("  Recovered " + job);
            }

            quarantine.record("signups", jobs.get(0).withFailedTries(4));
            int replayed = new QuarantineReplayer(quarantine).replay("signups", client);
            System.out.println("\nReplayed " + replayed + " quarantined job(s): " + client.drain("signups"));
        }
    }
}
