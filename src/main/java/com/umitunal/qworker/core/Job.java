package com.umitunal.qworker.core;

import java.util.Map;

/**
 * A unit of work pulled from a named queue.
 *
 * The payload is an open JSON-compatible mapping defined by each worker type.
 * Retry bookkeeping is kept on the envelope, not inside the payload.
 */
public interface Job {

    /**
     * Gets the identifier stamped on this job, or null if none was assigned yet.
     */
    String getId();

    /**
     * Gets the read-only job payload, without bookkeeping fields.
     */
    Map<String, Object> getPayload();

    /**
     * Gets the number of failed attempts recorded so far (0 for a fresh job).
     */
    int getFailedTries();

    /**
     * Returns a copy of this job with the given failed attempt count.
     */
    Job withFailedTries(int failedTries);

    /**
     * Returns a copy of this job with the given identifier.
     */
    Job withId(String id);

    /**
     * Gets a single payload field.
     */
    default Object get(String key) {
        return getPayload().get(key);
    }
}
