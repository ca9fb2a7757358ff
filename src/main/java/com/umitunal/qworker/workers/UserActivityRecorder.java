package com.umitunal.qworker.workers;

/**
 * Adds collapsed activity to the stored per-user counters.
 */
public interface UserActivityRecorder {

    void record(UserActivity activity) throws Exception;
}
