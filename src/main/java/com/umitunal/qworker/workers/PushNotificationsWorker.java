package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Dispatches mobile notification events. Events of type {@code remove} revoke
 * earlier notifications; anything else is a new-message notification.
 */
public class PushNotificationsWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(PushNotificationsWorker.class);

    public static final String QUEUE_NAME = "missedmessage_mobile_notifications";
    static final String REMOVE_TYPE = "remove";

    private final PushNotificationService service;

    public PushNotificationsWorker(WorkerContext context, PushNotificationService service) {
        super(context);
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    protected ProcessingResult consume(Job job) {
        long userProfileId = Payloads.requireLong(job, "user_profile_id");
        try {
            if (REMOVE_TYPE.equals(job.get("type"))) {
                service.handleRemove(userProfileId, Payloads.longList(job, "message_ids"));
            } else {
                service.handleNew(userProfileId, job.getPayload());
            }
        } catch (PushNotificationBouncerRetryLaterException e) {
            return ProcessingResult.retry(e);
        }
        return ProcessingResult.success();
    }

    @Override
    protected void onRetriesExhausted(Job job, ProcessingResult lastResult) {
        log.warn("Maximum retries exceeded for trigger:{} event:push_notification", job.get("user_profile_id"));
    }
}
