package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Sends invitation e-mails.
 *
 * Jobs carry {@code prereg_id}; older producers send the invitee {@code email}
 * instead, which resolves to that address's latest invitation. Invitations
 * deleted before the job runs are skipped.
 */
public class ConfirmationEmailWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(ConfirmationEmailWorker.class);

    public static final String QUEUE_NAME = "invites";

    private final InvitationService invitations;

    public ConfirmationEmailWorker(WorkerContext context, InvitationService invitations) {
        super(context);
        this.invitations = Objects.requireNonNull(invitations, "invitations");
    }

    @Override
    protected ProcessingResult consume(Job job) throws Exception {
        long referrerId = Payloads.requireLong(job, "referrer_id");

        long preregId;
        String legacyEmail = Payloads.optionalString(job, "email");
        if (legacyEmail != null) {
            OptionalLong latest = invitations.latestInvitationFor(legacyEmail);
            if (latest.isEmpty()) {
                log.info("No invitation found for {}, skipping", legacyEmail);
                return ProcessingResult.success();
            }
            preregId = latest.getAsLong();
        } else {
            preregId = Payloads.requireLong(job, "prereg_id");
        }

        if (!invitations.invitationExists(preregId)) {
            log.info("Invitation {} was deleted, skipping", preregId);
            return ProcessingResult.success();
        }

        log.info("Sending invitation {} from user {}", preregId, referrerId);
        invitations.sendInvitation(preregId, referrerId, Payloads.optionalString(job, "email_body"));
        return ProcessingResult.success();
    }
}
