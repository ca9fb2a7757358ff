package com.umitunal.qworker.core;

import java.util.List;
import java.util.function.Consumer;

/**
 * Transport capability consumed by workers.
 *
 * Implementations may be process-local or broker-backed; workers rely only on
 * the operations below.
 */
public interface QueueClient extends AutoCloseable {

    /**
     * Register the callback that receives jobs delivered for a queue.
     * A later registration for the same queue replaces the earlier one.
     */
    void register(String queueName, Consumer<Job> callback);

    /**
     * Deliver jobs to the registered callbacks. Returns when the underlying
     * consumption loop returns. A delivered job is removed only once its callback
     * returns normally; an exception from the callback propagates and the job
     * stays queued.
     */
    void startConsuming();

    /**
     * Ask a running consumption loop to return.
     */
    void stopConsuming();

    /**
     * Remove and return up to {@code maxJobs} jobs currently buffered for a queue,
     * oldest first. Never blocks.
     */
    List<Job> drain(String queueName, int maxJobs);

    /**
     * Publish a job onto a queue.
     */
    void publish(String queueName, Job job);

    /**
     * Remove and return the whole current backlog of a queue.
     */
    default List<Job> drain(String queueName) {
        return drain(queueName, Integer.MAX_VALUE);
    }

    @Override
    void close();
}
