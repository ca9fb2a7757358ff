package com.umitunal.qworker.workers;

import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.model.WorkUnit;
import com.umitunal.qworker.quarantine.ErrorQuarantine;
import com.umitunal.qworker.registry.WorkerRegistry;
import com.umitunal.qworker.storage.InMemoryQueueClient;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConfirmationEmailWorkerTest {

    private static final long INVITER = 7L;
    private static final long ALICE_INVITE = 101L;
    private static final long BOB_INVITE = 102L;
    private static final String BOB = "bob@example.org";

    @TempDir
    Path tempDir;

    @Mock
    private InvitationService invitations;

    private InMemoryQueueClient client;
    private ErrorQuarantine quarantine;
    private QueueProcessingWorker worker;

    @BeforeEach
    void setUp() {
        client = new InMemoryQueueClient();
        quarantine = new ErrorQuarantine(tempDir);
        WorkerRegistry registry = new WorkerRegistry();
        StandardWorkers.newBuilder().withInvitationService(invitations).registerInto(registry);
        WorkerContext context = WorkerContext.newBuilder(registry)
                .withConfig(WorkerConfig.newBuilder().build())
                .withQuarantine(quarantine)
                .withClientFactory(() -> client)
                .build();
        worker = registry.createWorker(ConfirmationEmailWorker.QUEUE_NAME, context);
        worker.setup();
    }

    @Test
    @DisplayName("Should send existing invitations and skip deleted ones")
    void testInvites() throws Exception {
        // Given
        when(invitations.invitationExists(ALICE_INVITE)).thenReturn(true);
        when(invitations.invitationExists(-1L)).thenReturn(false);
        when(invitations.invitationExists(BOB_INVITE)).thenReturn(true);
        when(invitations.latestInvitationFor(BOB)).thenReturn(OptionalLong.of(BOB_INVITE));

        client.publish(ConfirmationEmailWorker.QUEUE_NAME,
                WorkUnit.of("prereg_id", ALICE_INVITE, "referrer_id", INVITER, "email_body", null));
        // Invitation deleted before the job ran
        client.publish(ConfirmationEmailWorker.QUEUE_NAME,
                WorkUnit.of("prereg_id", -1, "referrer_id", INVITER, "email_body", null));
        // Older producers send the address instead of the invitation id
        client.publish(ConfirmationEmailWorker.QUEUE_NAME,
                WorkUnit.of("email", BOB, "referrer_id", INVITER, "email_body", null));

        // When
        worker.start();

        // Then
        verify(invitations, times(2)).sendInvitation(anyLong(), anyLong(), any());
        verify(invitations).sendInvitation(ALICE_INVITE, INVITER, null);
        verify(invitations).sendInvitation(eq(BOB_INVITE), eq(INVITER), isNull());
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(3);
        assertThat(quarantine.read(ConfirmationEmailWorker.QUEUE_NAME)).isEmpty();
    }

    @Test
    @DisplayName("Should skip a legacy job with no invitation for the address")
    void testLegacyWithoutInvitation() throws Exception {
        // Given
        when(invitations.latestInvitationFor(BOB)).thenReturn(OptionalLong.empty());
        client.publish(ConfirmationEmailWorker.QUEUE_NAME, WorkUnit.of("email", BOB, "referrer_id", INVITER));

        // When
        worker.start();

        // Then
        verify(invitations, never()).sendInvitation(anyLong(), anyLong(), any());
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry when sending the invitation fails")
    void testSendFailure() throws Exception {
        // Given
        when(invitations.invitationExists(ALICE_INVITE)).thenReturn(true);
        doThrow(new IllegalStateException("smtp down")).doNothing()
                .when(invitations).sendInvitation(ALICE_INVITE, INVITER, "Join us");
        client.publish(ConfirmationEmailWorker.QUEUE_NAME,
                WorkUnit.of("prereg_id", ALICE_INVITE, "referrer_id", INVITER, "email_body", "Join us"));

        // When
        worker.start();

        // Then
        verify(invitations, times(2)).sendInvitation(ALICE_INVITE, INVITER, "Join us");
        assertThat(worker.getMetrics().getRetriedJobs()).isEqualTo(1);
        assertThat(worker.getMetrics().getProcessedJobs()).isEqualTo(1);
    }
}
