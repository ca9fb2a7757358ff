package com.umitunal.qworker.workers;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignupWorkerTest {

    private static final int MAX_REQUEST_RETRIES = 3;

    @TempDir
    Path tempDir;

    @Mock
    private MailingListClient mailingList;

    private InMemoryQueueClient client;
    private ErrorQuarantine quarantine;
    private QueueProcessingWorker worker;
    private Logger signupLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        client = new InMemoryQueueClient();
        quarantine = new ErrorQuarantine(tempDir);
        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder().withMailingListClient(mailingList).registerInto(registry);
        WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(WorkerConfig.newBuilder().withMaxRequestRetries(MAX_REQUEST_RETRIES).build())
                .withQuarantine(quarantine)
                .withClientFactory(() -> client)
                .build();
        worker = registry.createWorker(SignupWorker.QUEUE_NAME, context);
        worker.setup();

        signupLogger = (Logger) LoggerFactory.getLogger(SignupWorker.class);
        appender = new ListAppender<>();
        appender.start();
        signupLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        signupLogger.detachAppender(appender);
    }

    private void publishSignup() {
        client.publish(SignupWorker.QUEUE_NAME, new WorkUnit("test_missed",
                Map.of("user_id", 10, "email_address", "foo@bar.baz"), 0));
    }

    @Test
    @DisplayName("Should post the member without the user id")
    void testSubscribe() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(true);
        when(mailingList.subscribe(anyMap())).thenReturn(new MailingListResponse(200, "{}"));
        publishSignup();

        // When
        worker.start();

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> member = ArgumentCaptor.forClass(Map.class);
        verify(mailingList).subscribe(member.capture());
        assertThat(member.getValue()).containsOnly(
                entry("email_address", "foo@bar.baz"), entry("status", "subscribed"));
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry a bad request until the retries are used up")
    void testBadRequestRetries() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(true);
        when(mailingList.subscribe(anyMap())).thenReturn(new MailingListResponse(400, "{\"title\": \"\"}"));
        publishSignup();

        // When
        worker.start();

        // Then
        verify(mailingList, times(1 + MAX_REQUEST_RETRIES)).subscribe(anyMap());
        Job quarantined = quarantine.read(SignupWorker.QUEUE_NAME).get(0).getJobs().get(0);
        assertThat(quarantined.getFailedTries()).isEqualTo(1 + MAX_REQUEST_RETRIES);
        assertThat(quarantined.getId()).isEqualTo("test_missed");
    }

    @Test
    @DisplayName("Should warn and succeed for an existing member")
    void testExistingMember() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(true);
        when(mailingList.subscribe(anyMap()))
                .thenReturn(new MailingListResponse(400, "{\"title\": \"Member Exists\"}"));
        publishSignup();

        // When
        worker.start();

        // Then
        List<ILoggingEvent> warnings = appender.list.stream().filter(e -> e.getLevel() == Level.WARN).toList();
        assertThat(warnings).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Attempted to sign up already existing email to list: foo@bar.baz");
        verify(mailingList, times(1)).subscribe(anyMap());
        assertThat(Files.exists(quarantine.errorFile(SignupWorker.QUEUE_NAME))).isFalse();
    }

    @Test
    @DisplayName("Should quarantine other client errors without retrying")
    void testOtherClientError() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(true);
        when(mailingList.subscribe(anyMap()))
                .thenReturn(new MailingListResponse(444, "{\"title\": \"Member Exists\"}"));
        publishSignup();

        // When
        worker.start();

        // Then
        verify(mailingList, times(1)).subscribe(anyMap());
        assertThat(quarantine.read(SignupWorker.QUEUE_NAME)).hasSize(1);
        assertThat(worker.getMetrics().getRetriedJobs()).isZero();
    }

    @Test
    @DisplayName("Should retry server errors and transport failures")
    void testServerError() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(true);
        when(mailingList.subscribe(anyMap()))
                .thenReturn(new MailingListResponse(503, ""))
                .thenThrow(new IOException("connection reset"))
                .thenReturn(new MailingListResponse(200, "{}"));
        publishSignup();

        // When
        worker.start();

        // Then
        verify(mailingList, times(3)).subscribe(anyMap());
        assertThat(worker.getMetrics().getRetriedJobs()).isEqualTo(2);
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip signups without mailing list credentials")
    void testNotConfigured() throws Exception {
        // Given
        when(mailingList.isConfigured()).thenReturn(false);
        publishSignup();

        // When
        worker.start();

        // Then
        verify(mailingList, never()).subscribe(anyMap());
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }
}
