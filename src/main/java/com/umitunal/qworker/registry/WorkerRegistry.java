package com.umitunal.qworker.registry;

import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide map from queue name to the worker class consuming it.
 *
 * Populated once at startup by {@code assignQueue} calls; supervisors read the
 * active queue names to decide which workers to spawn.
 */
public class WorkerRegistry {
    public static final String DEFAULT_QUEUE_TYPE = "consumer";

    private final Map<String, Registration<?>> registrations = new LinkedHashMap<>();
    private final Map<Class<?>, String> queueByType = new HashMap<>();

    public <W extends QueueProcessingWorker> void assignQueue(String queueName, Class<W> type,
                                                              WorkerFactory<W> factory) {
        assignQueue(queueName, DEFAULT_QUEUE_TYPE, true, type, factory);
    }

    /**
     * Bind a worker class to a queue. Each queue and each class may be bound once.
     *
     * @param queueType category used to filter {@link #getActiveWorkerQueues(String)}
     * @param enabled   disabled registrations stay resolvable but are not reported as active
     */
    public synchronized <W extends QueueProcessingWorker> void assignQueue(String queueName, String queueType,
                                                                           boolean enabled, Class<W> type,
                                                                           WorkerFactory<W> factory) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        if (registrations.containsKey(queueName)) {
            throw new IllegalStateException("Queue " + queueName + " already has worker "
                    + registrations.get(queueName).type.getName());
        }
        if (queueByType.containsKey(type)) {
            throw new IllegalStateException("Worker " + type.getName() + " is already bound to queue "
                    + queueByType.get(type));
        }
        registrations.put(queueName, new Registration<>(queueName, queueType, enabled, type, factory));
        queueByType.put(type, queueName);
    }

    public synchronized Optional<String> queueNameOf(Class<?> type) {
        return Optional.ofNullable(queueByType.get(type));
    }

    /**
     * Names of all enabled queues, sorted.
     */
    public List<String> getActiveWorkerQueues() {
        return getActiveWorkerQueues(null);
    }

    /**
     * Names of enabled queues of one type, sorted. A null type matches all.
     */
    public synchronized List<String> getActiveWorkerQueues(String queueType) {
        List<String> names = new ArrayList<>();
        for (Registration<?> registration : registrations.values()) {
            if (registration.enabled && (queueType == null || queueType.equals(registration.queueType))) {
                names.add(registration.queueName);
            }
        }
        Collections.sort(names);
        return names;
    }

    public QueueProcessingWorker createWorker(String queueName, WorkerContext context) {
        Registration<?> registration;
        synchronized (this) {
            registration = registrations.get(queueName);
        }
        if (registration == null) {
            throw new IllegalArgumentException("No worker assigned to queue " + queueName);
        }
        return registration.factory.create(context);
    }

    /**
     * Drop every registration. Used on shutdown and between tests.
     */
    public synchronized void clear() {
        registrations.clear();
        queueByType.clear();
    }

    private static final class Registration<W extends QueueProcessingWorker> {
        private final String queueName;
        private final String queueType;
        private final boolean enabled;
        private final Class<W> type;
        private final WorkerFactory<W> factory;

        private Registration(String queueName, String queueType, boolean enabled,
                             Class<W> type, WorkerFactory<W> factory) {
            this.queueName = queueName;
            this.queueType = queueType;
            this.enabled = enabled;
            this.type = type;
            this.factory = factory;
        }
    }
}
