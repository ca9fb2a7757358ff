package com.umitunal.qworker.examples;

import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import com.umitunal.qworker.workers.EmailSendingWorker;
import com.umitunal.qworker.workers.StandardWorkers;

import java.util.List;

/**
 * Basic usage - register a built-in worker and consume its queue.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Worker Example ===\n");

        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder()
                .withEmailSender(message -> System.out.println("  Sending email to " + message.get("to_emails")))
                .registerInto(registry);

        InMemoryQueueClient client = new InMemoryQueueClient();
        for (int i = 1; i <= 3; i++) {
            client.publish(EmailSendingWorker.QUEUE_NAME, WorkUnit.of(
                    "to_emails", List.of("user" + i + "@example.com"),
                    "template_prefix", "welcome"));
        }
        System.out.println("Active queues: " + registry.getActiveWorkerQueues());

        try (WorkerContext context = WorkerContext.newBuilder(registry)
                .withClientFactory(() -> client)
                .build();
             QueueProcessingWorker worker = registry.createWorker(EmailSendingWorker.QUEUE_NAME, context)) {

            worker.setup();
            worker.start();

            System.out.println("\n" + worker.getMetrics());
        }
    }
}
