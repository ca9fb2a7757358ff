package com.umitunal.qworker.examples;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import com.umitunal.qworker.workers.MissedMessageWorker;
import com.umitunal.qworker.workers.StandardWorkers;

import java.time.Duration;

/**
 * Deferred aggregation example - events per user are grouped into one digest.
 */
public class AggregationExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Deferred Aggregation Example ===\n");

        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder()
                .withMissedMessageNotifier((userId, events, count) ->
                        System.out.println("  Digest for user " + userId + ": " + count + " message(s)"))
                .registerInto(registry);

        InMemoryQueueClient client = new InMemoryQueueClient();
        client.publish(MissedMessageWorker.QUEUE_NAME, WorkUnit.of("user_profile_id", 10, "message_id", 1));
        client.publish(MissedMessageWorker.QUEUE_NAME, WorkUnit.of("user_profile_id", 10, "message_id", 2));
        client.publish(MissedMessageWorker.QUEUE_NAME, WorkUnit.of("user_profile_id", 11, "message_id", 3));
        client.publish(MissedMessageWorker.QUEUE_NAME, WorkUnit.of("user_profile_id", 10, "message_id", 4));

        WorkerConfig config = WorkerConfig.newBuilder()
                .withAggregationDelay(Duration.ofSeconds(1))
                .build();

        try (WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(config)
                .withClientFactory(() -> client)
                .build();
             QueueProcessingWorker worker = registry.createWorker(MissedMessageWorker.QUEUE_NAME, context)) {

            worker.setup();
            worker.start();
            System.out.println("Buffered 4 events, waiting for the aggregation window (1s)...");

            Thread.sleep(1500);
            System.out.println("\n" + worker.getMetrics());
        }
    }
}
