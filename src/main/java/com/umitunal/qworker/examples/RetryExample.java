package com.umitunal.qworker.examples;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.quarantine.QuarantineRecord;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Retry mechanism example - failing jobs are retried, then quarantined.
 */
public class RetryExample {

    static class FlakyApiWorker extends QueueProcessingWorker {
        FlakyApiWorker(WorkerContext context) {
            super(context);
        }

        @Override
        protected ProcessingResult consume(Job job) {
            System.out.println("  Attempt " + (job.getFailedTries() + 1) + " for " + job.get("call"));
            if ("broken".equals(job.get("call"))) {
                throw new IllegalStateException("Connection timeout");
            }
            if (job.getFailedTries() < 2) {
                return ProcessingResult.retry("Service unavailable");
            }
            return ProcessingResult.success();
        }
    }

    public static void main(String[] args) throws Exception {
        System.out.println("=== Retry Mechanism Example ===\n");

        Path quarantineDir = Files.createTempDirectory("qworker-retry");
        WorkerRegistry registry = new WorkerRegistry();
        registry.assignQueue("flaky_api", FlakyApiWorker.class, FlakyApiWorker::new);

        InMemoryQueueClient client = new InMemoryQueueClient();
        client.publish("flaky_api", WorkUnit.of("call", "recovers"));
        client.publish("flaky_api", WorkUnit.of("call", "broken"));

        WorkerConfig config = WorkerConfig.newBuilder()
                .withMaxRequestRetries(3)
                .withQuarantineDirectory(quarantineDir)
                .build();

        try (WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(config)
                .withClientFactory(() -> client)
                .build();
             QueueProcessingWorker worker = registry.createWorker("flaky_api", context)) {

            worker.setup();
            worker.start();

            System.out.println("\n" + worker.getMetrics());

            ErrorQuarantine quarantine = context.getQuarantine();
            System.out.println("\nQuarantined in " + quarantine.errorFile("flaky_api") + ":");
            for (QuarantineRecord record : quarantine.read("flaky_api")) {
                System.out.println("  " + record);
            }
        }
    }
}
