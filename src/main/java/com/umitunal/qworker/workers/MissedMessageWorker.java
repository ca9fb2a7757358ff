package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.DeferredAggregationWorker;
import com.umitunal.qworker.worker.WorkerContext;

import java.util.List;
import java.util.Objects;

/**
 * Batches missed-message events per user so that messages arriving close
 * together end up in a single e-mail.
 */
public class MissedMessageWorker extends DeferredAggregationWorker<Long> {

    public static final String QUEUE_NAME = "missedmessage_emails";

    private final MissedMessageNotifier notifier;

    public MissedMessageWorker(WorkerContext context, MissedMessageNotifier notifier) {
        super(context);
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    @Override
    protected Long aggregationKey(Job job) {
        return Payloads.requireLong(job, "user_profile_id");
    }

    @Override
    protected void flush(Long userProfileId, List<Job> events, int count) throws Exception {
        notifier.sendMissedMessageNotifications(userProfileId, events, count);
    }
}
