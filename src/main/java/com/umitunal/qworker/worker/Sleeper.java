package com.umitunal.qworker.worker;

import java.time.Duration;

/**
 * Idle wait of a loop worker.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
