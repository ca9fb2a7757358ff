package com.umitunal.qworker.worker;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.QueueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes a queue in batches.
 *
 * {@link #start()} loops: drain up to {@link #getMaxBatchSize()} buffered jobs,
 * hand them to {@link #consumeBatch(List)} in one call, and sleep
 * {@link #getIdleInterval()} whenever the queue was empty. The loop runs until
 * {@link #stop()} or the thread is interrupted.
 *
 * Durability is weaker than per-message consumption: if the batch handler
 * throws, every job of that batch is quarantined as one record and dropped,
 * with no retry and no per-job granularity.
 */
public abstract class LoopQueueProcessingWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(LoopQueueProcessingWorker.class);

    private final AtomicBoolean running = new AtomicBoolean(false);

    protected LoopQueueProcessingWorker(WorkerContext context) {
        super(context);
    }

    protected abstract void consumeBatch(List<Job> jobs) throws Exception;

    protected Duration getIdleInterval() {
        return getContext().getConfig().getLoopIdleInterval();
    }

    protected int getMaxBatchSize() {
        return getContext().getConfig().getLoopMaxBatchSize();
    }

    @Override
    public void start() {
        QueueClient client = requireClient();
        running.set(true);
        log.info("Loop worker for queue {} started", getQueueName());

        try {
            while (running.get()) {
                List<Job> jobs = client.drain(getQueueName(), getMaxBatchSize());
                if (!jobs.isEmpty()) {
                    consumeBatchWrapper(jobs);
                    continue;
                }
                getContext().getSleeper().sleep(getIdleInterval());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Loop worker for queue {} interrupted", getQueueName());
        } finally {
            running.set(false);
        }
    }

    @Override
    public void stop() {
        running.set(false);
        super.stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void consumeBatchWrapper(List<Job> jobs) {
        log.debug("Queue {} consuming batch of {}", getQueueName(), jobs.size());
        try {
            consumeBatch(jobs);
            recordProcessed(jobs.size());
        } catch (Exception e) {
            handleBatchFailure(jobs, e);
        }
    }

    /**
     * A job delivered on its own is a batch of one, with the same no-retry
     * failure handling.
     */
    @Override
    public void consumeWrapper(Job job) {
        consumeBatchWrapper(List.of(job));
    }

    /**
     * Loop workers only consume through {@link #consumeBatch(List)}.
     */
    @Override
    protected final ProcessingResult consume(Job job) {
        throw new UnsupportedOperationException("Queue " + getQueueName() + " is consumed in batches");
    }
}
