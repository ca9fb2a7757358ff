package com.umitunal.qworker.worker;

import com.umitunal.qworker.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Buffers events per aggregation key and handles each key's events together.
 *
 * The first event of an idle key arms a single-shot timer of
 * {@link #getAggregationDelay()}; later events for that key are appended without
 * touching the timer, so the window is anchored at the first arrival. When the
 * timer fires, or on {@link #flushPending()}, the key's buffer is taken and
 * cleared under the lock and {@link #flush(Object, List, int)} runs outside it.
 * Events arriving during a flush start a new window. A batch restored after a
 * failed flush without a timer is re-armed by the next event for its key.
 *
 * @param <K> the aggregation key type
 */
public abstract class DeferredAggregationWorker<K> extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(DeferredAggregationWorker.class);

    private final Object lock = new Object();
    private final Map<K, PendingBatch> pending = new LinkedHashMap<>();

    protected DeferredAggregationWorker(WorkerContext context) {
        super(context);
    }

    protected abstract K aggregationKey(Job job);

    /**
     * Handle every event buffered for one key, in arrival order.
     */
    protected abstract void flush(K key, List<Job> events, int count) throws Exception;

    protected Duration getAggregationDelay() {
        return getContext().getConfig().getAggregationDelay();
    }

    @Override
    protected final ProcessingResult consume(Job job) {
        K key = aggregationKey(job);
        synchronized (lock) {
            PendingBatch batch = pending.get(key);
            if (batch == null) {
                batch = new PendingBatch(key);
                pending.put(key, batch);
            }
            batch.events.add(job);
            if (batch.timer == null) {
                arm(batch);
            }
        }
        return ProcessingResult.success();
    }

    /**
     * Flush every key now, cancelling their timers. Used on shutdown and in tests;
     * grouping and ordering are the same as for timer-driven flushes.
     *
     * Every key is attempted. A key whose failed batch could not be quarantined
     * keeps its events pending, and the first such failure is rethrown once all
     * keys were attempted.
     */
    public void flushPending() {
        Map<K, List<Job>> snapshot = new LinkedHashMap<>();
        synchronized (lock) {
            for (PendingBatch batch : pending.values()) {
                if (batch.timer != null) {
                    batch.timer.cancel(false);
                }
                snapshot.put(batch.key, List.copyOf(batch.events));
            }
            pending.clear();
        }

        RuntimeException failure = null;
        for (Map.Entry<K, List<Job>> entry : snapshot.entrySet()) {
            try {
                deliver(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                restore(entry.getKey(), entry.getValue(), false);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public boolean isTimerLive(K key) {
        synchronized (lock) {
            PendingBatch batch = pending.get(key);
            return batch != null && batch.timer != null && !batch.timer.isDone();
        }
    }

    public List<K> pendingKeys() {
        synchronized (lock) {
            return new ArrayList<>(pending.keySet());
        }
    }

    /**
     * Flushes whatever is still buffered before releasing the client.
     */
    @Override
    public void stop() {
        super.stop();
        flushPending();
    }

    private void onTimer(PendingBatch batch) {
        List<Job> events;
        synchronized (lock) {
            // A manual flush may already have taken this batch
            if (pending.get(batch.key) != batch) {
                return;
            }
            pending.remove(batch.key);
            events = List.copyOf(batch.events);
        }
        try {
            deliver(batch.key, events);
        } catch (RuntimeException e) {
            log.error("Timer flush of {} on queue {} failed, keeping {} event(s) pending",
                    batch.key, getQueueName(), events.size(), e);
            restore(batch.key, events, true);
        }
    }

    /**
     * Put undelivered events back in front of anything buffered for the key since.
     */
    private void restore(K key, List<Job> events, boolean rearm) {
        synchronized (lock) {
            PendingBatch batch = pending.get(key);
            if (batch == null) {
                batch = new PendingBatch(key);
                pending.put(key, batch);
            }
            batch.events.addAll(0, events);
            if (rearm && batch.timer == null) {
                arm(batch);
            }
        }
    }

    private void arm(PendingBatch batch) {
        batch.timer = getContext().getTimerScheduler().schedule(
                () -> onTimer(batch), getAggregationDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void deliver(K key, List<Job> events) {
        log.debug("Queue {} flushing {} event(s) for {}", getQueueName(), events.size(), key);
        try {
            flush(key, events, events.size());
        } catch (Exception e) {
            handleBatchFailure(events, e);
        }
    }

    private final class PendingBatch {
        private final K key;
        private final List<Job> events = new ArrayList<>();
        private ScheduledFuture<?> timer;

        private PendingBatch(K key) {
            this.key = key;
        }
    }
}
