package com.umitunal.qworker.core;

/**
 * Counters of a single worker, taken as a snapshot.
 */
public class QueueMetrics {
    private final String queueName;
    private final long processedJobs;
    private final long retriedJobs;
    private final long quarantinedJobs;
    private final long failedBatches;

    public QueueMetrics(String queueName, long processedJobs, long retriedJobs,
                        long quarantinedJobs, long failedBatches) {
        this.queueName = queueName;
        this.processedJobs = processedJobs;
        this.retriedJobs = retriedJobs;
        this.quarantinedJobs = quarantinedJobs;
        this.failedBatches = failedBatches;
    }

    public String getQueueName() { return queueName; }
    public long getProcessedJobs() { return processedJobs; }
    public long getRetriedJobs() { return retriedJobs; }
    public long getQuarantinedJobs() { return quarantinedJobs; }
    public long getFailedBatches() { return failedBatches; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{queue=%s, processed=%d, retried=%d, quarantined=%d, failedBatches=%d}",
            queueName, processedJobs, retriedJobs, quarantinedJobs, failedBatches
        );
    }
}
