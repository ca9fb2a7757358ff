package com.umitunal.qworker.workers;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailSendingWorkerTest {

    private static final int MAX_REQUEST_RETRIES = 3;

    @TempDir
    Path tempDir;

    @Mock
    private EmailSender sender;

    private QueueProcessingWorker newWorker(InMemoryQueueClient client, ErrorQuarantine quarantine) {
        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder().withEmailSender(sender).registerInto(registry);
        WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(WorkerConfig.newBuilder().withMaxRequestRetries(MAX_REQUEST_RETRIES).build())
                .withQuarantine(quarantine)
                .withClientFactory(() -> client)
                .build();
        QueueProcessingWorker worker = registry.createWorker(EmailSendingWorker.QUEUE_NAME, context);
        worker.setup();
        return worker;
    }

    @Test
    @DisplayName("Should retry sending until the retries are used up")
    void testRetries() throws Exception {
        // Given
        InMemoryQueueClient client = new InMemoryQueueClient();
        ErrorQuarantine quarantine = new ErrorQuarantine(tempDir);
        client.publish(EmailSendingWorker.QUEUE_NAME, WorkUnit.of(
                "template_prefix", "zerver/emails/confirm_new_email",
                "to_emails", List.of("hamlet@acme.com"),
                "from_name", "Account Security"));
        doThrow(new IOException("SMTP server disconnected")).when(sender).send(anyMap());
        QueueProcessingWorker worker = newWorker(client, quarantine);

        // When
        worker.start();

        // Then
        verify(sender, times(1 + MAX_REQUEST_RETRIES)).send(anyMap());
        Job quarantined = quarantine.read(EmailSendingWorker.QUEUE_NAME).get(0).getJobs().get(0);
        assertThat(quarantined.getFailedTries()).isEqualTo(1 + MAX_REQUEST_RETRIES);
        assertThat(quarantined.get("to_emails")).isEqualTo(List.of("hamlet@acme.com"));
    }

    @Test
    @DisplayName("Should hand the payload to the sender")
    void testSend() throws Exception {
        // Given
        InMemoryQueueClient client = new InMemoryQueueClient();
        WorkUnit email = WorkUnit.of("to_emails", List.of("iago@acme.com"), "template_prefix", "welcome");
        client.publish(EmailSendingWorker.QUEUE_NAME, email);
        QueueProcessingWorker worker = newWorker(client, new ErrorQuarantine(tempDir));

        // When
        worker.start();

        // Then
        verify(sender).send(email.getPayload());
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }
}
