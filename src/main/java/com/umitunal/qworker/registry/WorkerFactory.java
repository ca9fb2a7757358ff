package com.umitunal.qworker.registry;

import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;

/**
 * Builds the worker registered for a queue.
 *
 * @param <W> the worker type
 */
@FunctionalInterface
public interface WorkerFactory<W extends QueueProcessingWorker> {

    W create(WorkerContext context);
}
