package com.umitunal.qworker.model;

import com.umitunal.qworker.core.Job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable {@link Job} envelope: the open payload plus retry bookkeeping.
 */
public final class WorkUnit implements Job {
    private final String id;
    private final Map<String, Object> payload;
    private final int failedTries;

    public WorkUnit(Map<String, ?> payload) {
        this(null, payload, 0);
    }

    public WorkUnit(String id, Map<String, ?> payload, int failedTries) {
        if (failedTries < 0) {
            throw new IllegalArgumentException("failedTries must be >= 0: " + failedTries);
        }
        this.id = id;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.failedTries = failedTries;
    }

    /**
     * Shortcut for building test and example jobs from alternating key/value pairs.
     */
    public static WorkUnit of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new WorkUnit(payload);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public int getFailedTries() {
        return failedTries;
    }

    @Override
    public WorkUnit withFailedTries(int failedTries) {
        return new WorkUnit(id, payload, failedTries);
    }

    @Override
    public WorkUnit withId(String id) {
        return new WorkUnit(id, payload, failedTries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkUnit)) return false;
        WorkUnit other = (WorkUnit) o;
        return failedTries == other.failedTries
                && Objects.equals(id, other.id)
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, payload, failedTries);
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id='%s', failedTries=%d, payload=%s}", id, failedTries, payload);
    }
}
