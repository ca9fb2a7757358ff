package com.umitunal.qworker.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.model.WorkUnit;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps jobs to and from the flat JSON objects seen on the wire and in quarantine logs.
 *
 * Bookkeeping is stamped into the object as {@code id} and {@code failed_tries}
 * and lifted back out when decoding.
 */
public final class JobJson {
    public static final String ID_FIELD = "id";
    public static final String FAILED_TRIES_FIELD = "failed_tries";

    private static final ObjectMapper MAPPER = JsonCodec.createDefaultMapper();
    private static final TypeReference<List<Map<String, Object>>> WIRE_LIST =
            new TypeReference<List<Map<String, Object>>>() { };

    private JobJson() {
    }

    public static Map<String, Object> toWireMap(Job job) {
        Map<String, Object> wire = new LinkedHashMap<>(job.getPayload());
        if (job.getId() != null) {
            wire.put(ID_FIELD, job.getId());
        }
        if (job.getFailedTries() > 0) {
            wire.put(FAILED_TRIES_FIELD, job.getFailedTries());
        }
        return wire;
    }

    public static Job fromWireMap(Map<String, ?> wire) {
        Map<String, Object> payload = new LinkedHashMap<>(wire);
        Object id = payload.remove(ID_FIELD);
        Object failedTries = payload.remove(FAILED_TRIES_FIELD);

        int tries = 0;
        if (failedTries instanceof Number) {
            tries = ((Number) failedTries).intValue();
        } else if (failedTries != null) {
            try {
                tries = Integer.parseInt(failedTries.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + FAILED_TRIES_FIELD + ": " + failedTries, e);
            }
        }
        return new WorkUnit(id != null ? id.toString() : null, payload, tries);
    }

    public static String writeJobs(List<? extends Job> jobs) {
        List<Map<String, Object>> wire = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            wire.add(toWireMap(job));
        }
        return write(wire);
    }

    public static List<Job> readJobs(String json) {
        List<Job> jobs = new ArrayList<>();
        for (Map<String, Object> wire : read(json, WIRE_LIST)) {
            jobs.add(fromWireMap(wire));
        }
        return jobs;
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize job to JSON", e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to deserialize job from JSON", e);
        }
    }
}
