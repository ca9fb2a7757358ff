package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.LoopQueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses activity events of a batch by user, client and query, then
 * records one counter update per group.
 */
public class UserActivityWorker extends LoopQueueProcessingWorker {

    public static final String QUEUE_NAME = "user_activity";

    private final UserActivityRecorder recorder;

    public UserActivityWorker(WorkerContext context, UserActivityRecorder recorder) {
        super(context);
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    @Override
    protected void consumeBatch(List<Job> jobs) throws Exception {
        Map<List<Object>, UserActivity> collapsed = new LinkedHashMap<>();
        for (Job job : jobs) {
            long userProfileId = Payloads.requireLong(job, "user_profile_id");
            String client = Payloads.requireString(job, "client");
            String query = Payloads.requireString(job, "query");
            Instant visit = visitTime(job);

            collapsed.merge(List.of(userProfileId, client, query),
                    new UserActivity(userProfileId, client, query, 1, visit),
                    (existing, fresh) -> existing.merge(visit));
        }
        for (UserActivity activity : collapsed.values()) {
            recorder.record(activity);
        }
    }

    /**
     * Event time in fractional epoch seconds.
     */
    private static Instant visitTime(Job job) {
        Object time = job.get("time");
        if (!(time instanceof Number)) {
            throw new IllegalArgumentException("Missing numeric field time in " + job);
        }
        long micros = Math.round(((Number) time).doubleValue() * 1_000_000);
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }
}
