package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends queued e-mails. Delivery failures are retried by the framework.
 */
public class EmailSendingWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(EmailSendingWorker.class);

    public static final String QUEUE_NAME = "email_senders";

    private final EmailSender sender;

    public EmailSendingWorker(WorkerContext context, EmailSender sender) {
        super(context);
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    protected ProcessingResult consume(Job job) throws Exception {
        sender.send(job.getPayload());
        return ProcessingResult.success();
    }

    @Override
    protected void onRetriesExhausted(Job job, ProcessingResult lastResult) {
        log.error("Failed to send email to {} after {} attempts", job.get("to_emails"), job.getFailedTries());
    }
}
