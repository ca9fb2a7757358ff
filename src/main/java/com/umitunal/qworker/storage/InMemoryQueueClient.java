package com.umitunal.qworker.storage;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.QueueClient;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local client keeping every queue in one FIFO backlog.
 *
 * {@link #startConsuming()} delivers every job that has a registered callback,
 * including jobs published while it runs, and returns once none is left. Jobs
 * of queues without a callback stay in the backlog. A job leaves the backlog
 * only after its callback returns; if the callback throws, the exception
 * propagates and the job stays at the head of its queue.
 */
public class InMemoryQueueClient implements QueueClient {
    private final Map<String, Consumer<Job>> consumers = new ConcurrentHashMap<>();
    private final LinkedList<QueuedJob> backlog = new LinkedList<>();
    private volatile boolean stopRequested;

    @Override
    public void register(String queueName, Consumer<Job> callback) {
        consumers.put(queueName, callback);
    }

    @Override
    public void startConsuming() {
        stopRequested = false;
        while (!stopRequested) {
            QueuedJob next = nextDeliverable();
            if (next == null) {
                return;
            }
            // Callbacks run outside the lock so they may publish
            consumers.get(next.queueName).accept(next.job);
            acknowledge(next);
        }
    }

    @Override
    public void stopConsuming() {
        stopRequested = true;
    }

    @Override
    public synchronized List<Job> drain(String queueName, int maxJobs) {
        List<Job> drained = new ArrayList<>();
        Iterator<QueuedJob> iter = backlog.iterator();
        while (iter.hasNext() && drained.size() < maxJobs) {
            QueuedJob queued = iter.next();
            if (queued.queueName.equals(queueName)) {
                drained.add(queued.job);
                iter.remove();
            }
        }
        return drained;
    }

    @Override
    public synchronized void publish(String queueName, Job job) {
        backlog.add(new QueuedJob(queueName, job));
    }

    /**
     * Number of jobs waiting on a queue.
     */
    public synchronized int backlogSize(String queueName) {
        int size = 0;
        for (QueuedJob queued : backlog) {
            if (queued.queueName.equals(queueName)) {
                size++;
            }
        }
        return size;
    }

    @Override
    public void close() {
        stopConsuming();
    }

    private synchronized QueuedJob nextDeliverable() {
        Iterator<QueuedJob> iter = backlog.iterator();
        while (iter.hasNext()) {
            QueuedJob queued = iter.next();
            if (consumers.containsKey(queued.queueName)) {
                return queued;
            }
        }
        return null;
    }

    private synchronized void acknowledge(QueuedJob delivered) {
        Iterator<QueuedJob> iter = backlog.iterator();
        while (iter.hasNext()) {
            if (iter.next() == delivered) {
                iter.remove();
                return;
            }
        }
    }

    private static final class QueuedJob {
        private final String queueName;
        private final Job job;

        private QueuedJob(String queueName, Job job) {
            this.queueName = queueName;
            this.job = job;
        }
    }
}
