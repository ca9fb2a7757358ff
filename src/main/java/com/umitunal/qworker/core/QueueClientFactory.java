package com.umitunal.qworker.core;

/**
 * Creates the client a worker acquires in {@code setup()}.
 */
@FunctionalInterface
public interface QueueClientFactory {

    QueueClient create();
}
