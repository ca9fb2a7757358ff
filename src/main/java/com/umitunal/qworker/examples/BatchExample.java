package com.umitunal.qworker.examples;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import com.umitunal.qworker.workers.StandardWorkers;
import com.umitunal.qworker.workers.UserActivityWorker;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Loop worker example - a background worker drains activity in batches.
 */
public class BatchExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Batch Loop Worker Example ===\n");

        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder()
                .withUserActivityRecorder(activity -> System.out.println("  Recorded " + activity))
                .registerInto(registry);

        InMemoryQueueClient client = new InMemoryQueueClient();
        double now = System.currentTimeMillis() / 1000.0;
        for (int i = 0; i < 5; i++) {
            client.publish(UserActivityWorker.QUEUE_NAME, WorkUnit.of(
                    "user_profile_id", 7, "client", i % 2 == 0 ? "ios" : "website",
                    "query", "send_message", "time", now + i));
        }
        System.out.println("Published 5 activity events");

        WorkerConfig config = WorkerConfig.newBuilder()
                .withLoopIdleInterval(Duration.ofMillis(200))
                .build();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(config)
                .withClientFactory(() -> client)
                .build();
             QueueProcessingWorker worker = registry.createWorker(UserActivityWorker.QUEUE_NAME, context)) {

            worker.setup();
            executor.submit(worker::start);

            Thread.sleep(1000);
            worker.stop();
            System.out.println("\n" + worker.getMetrics());
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
