package com.umitunal.qworker.quarantine;

import com.umitunal.qworker.core.Job;

import java.time.Instant;
import java.util.List;

/**
 * One line of a quarantine log: the jobs that failed together and when.
 */
public final class QuarantineRecord {
    private final Instant timestamp;
    private final String queueName;
    private final List<Job> jobs;

    public QuarantineRecord(Instant timestamp, String queueName, List<Job> jobs) {
        this.timestamp = timestamp;
        this.queueName = queueName;
        this.jobs = List.copyOf(jobs);
    }

    public Instant getTimestamp() { return timestamp; }
    public String getQueueName() { return queueName; }
    public List<Job> getJobs() { return jobs; }

    @Override
    public String toString() {
        return "QuarantineRecord{" + timestamp + ", queue=" + queueName + ", jobs=" + jobs.size() + "}";
    }
}
