package com.umitunal.qworker.worker;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.QueueClient;
import com.umitunal.qworker.core.QueueClientFactory;
import com.umitunal.qworker.core.QueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes one queue, one job at a time.
 *
 * Every delivered job goes through {@link #consume(Job)}. A {@code RETRY}
 * outcome, or any exception, re-publishes the job onto the same queue with its
 * failed attempt count incremented, until the count exceeds
 * {@code maxRequestRetries}; the job is then written to the error quarantine and
 * dropped. A {@code FATAL} outcome is quarantined without retrying.
 *
 * The queue name comes from the {@link com.umitunal.qworker.registry.WorkerRegistry};
 * a subclass with no queue assigned cannot be instantiated.
 */
public abstract class QueueProcessingWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueProcessingWorker.class);

    private final WorkerContext context;
    private final String queueName;
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong retriedCount = new AtomicLong();
    private final AtomicLong quarantinedCount = new AtomicLong();
    private final AtomicLong failedBatchCount = new AtomicLong();

    private volatile QueueClient client;

    protected QueueProcessingWorker(WorkerContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.queueName = context.getRegistry().queueNameOf(getClass())
                .orElseThrow(() -> new WorkerDeclarationException(
                        "No queue assigned to worker " + getClass().getName()));
    }

    /**
     * Handle one job.
     *
     * @return the outcome; null counts as success
     * @throws Exception treated as a retryable failure
     */
    protected abstract ProcessingResult consume(Job job) throws Exception;

    /**
     * Called once when a job has used up its retries, just before it is quarantined.
     */
    protected void onRetriesExhausted(Job job, ProcessingResult lastResult) {
    }

    /**
     * Acquire the queue client. Calling it again is a no-op.
     */
    public synchronized void setup() {
        if (client != null) {
            return;
        }
        QueueClientFactory factory = context.getClientFactory();
        if (factory == null) {
            throw new IllegalStateException("No queue client factory configured for queue " + queueName);
        }
        client = factory.create();
        log.debug("Worker for queue {} acquired client {}", queueName, client.getClass().getSimpleName());
    }

    /**
     * Register with the client and consume until the client's loop returns.
     */
    public void start() {
        QueueClient queueClient = requireClient();
        queueClient.register(queueName, this::consumeWrapper);
        log.info("Worker for queue {} started", queueName);
        queueClient.startConsuming();
    }

    public void stop() {
        QueueClient queueClient = client;
        if (queueClient != null) {
            queueClient.stopConsuming();
        }
    }

    @Override
    public synchronized void close() {
        stop();
        if (client != null) {
            client.close();
            client = null;
        }
    }

    /**
     * Callback registered with the client for every delivered job. Workers that
     * do not handle jobs one at a time override it.
     */
    public void consumeWrapper(Job job) {
        log.debug("Queue {} consuming {}", queueName, job);
        ProcessingResult result;
        try {
            result = consume(job);
        } catch (Exception e) {
            result = ProcessingResult.retry(e);
        }
        if (result == null) {
            result = ProcessingResult.success();
        }

        switch (result.getOutcome()) {
            case SUCCESS -> processedCount.incrementAndGet();
            case RETRY -> retryOrQuarantine(job, result);
            case FATAL -> {
                logProblem(result);
                quarantine(List.of(job));
            }
        }
    }

    private void retryOrQuarantine(Job job, ProcessingResult result) {
        int maxRetries = context.getConfig().getMaxRequestRetries();
        int failedTries = job.getFailedTries() + 1;
        Job retry = job.withFailedTries(failedTries);
        if (retry.getId() == null) {
            retry = retry.withId(UUID.randomUUID().toString());
        }

        if (failedTries <= maxRetries) {
            log.warn("Retrying job {} on queue {} ({} of {} retries): {}",
                    retry.getId(), queueName, failedTries, maxRetries, result.getMessage());
            requireClient().publish(queueName, retry);
            retriedCount.incrementAndGet();
        } else {
            logProblem(result);
            onRetriesExhausted(retry, result);
            quarantine(List.of(retry));
        }
    }

    /**
     * Quarantine a whole batch after its handler failed. No retry tier applies.
     */
    protected final void handleBatchFailure(List<Job> jobs, Exception cause) {
        log.error("Problem handling data on queue {}", queueName, cause);
        failedBatchCount.incrementAndGet();
        quarantine(jobs);
    }

    protected final void recordProcessed(int jobs) {
        processedCount.addAndGet(jobs);
    }

    private void quarantine(List<Job> jobs) {
        context.getQuarantine().record(queueName, jobs);
        quarantinedCount.addAndGet(jobs.size());
    }

    private void logProblem(ProcessingResult result) {
        if (result.getCause() != null) {
            log.error("Problem handling data on queue {}", queueName, result.getCause());
        } else {
            log.error("Problem handling data on queue {}: {}", queueName, result.getMessage());
        }
    }

    protected final QueueClient requireClient() {
        QueueClient queueClient = client;
        if (queueClient == null) {
            throw new IllegalStateException("setup() must be called before using the worker for queue " + queueName);
        }
        return queueClient;
    }

    protected final WorkerContext getContext() {
        return context;
    }

    public final String getQueueName() {
        return queueName;
    }

    public QueueMetrics getMetrics() {
        return new QueueMetrics(queueName, processedCount.get(), retriedCount.get(),
                quarantinedCount.get(), failedBatchCount.get());
    }
}
