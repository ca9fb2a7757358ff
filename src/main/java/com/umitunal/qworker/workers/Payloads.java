package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed access to decoded payload fields. JSON numbers may arrive as any
 * {@link Number} subtype depending on the codec.
 */
final class Payloads {

    private Payloads() {
    }

    static long requireLong(Job job, String field) {
        Object value = job.get(field);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field " + field + " is not a number: " + value, e);
            }
        }
        throw new IllegalArgumentException("Missing numeric field " + field + " in " + job);
    }

    static String requireString(Job job, String field) {
        Object value = job.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing field " + field + " in " + job);
        }
        return value.toString();
    }

    static String optionalString(Job job, String field) {
        Object value = job.get(field);
        return value == null ? null : value.toString();
    }

    static List<Long> longList(Job job, String field) {
        Object value = job.get(field);
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Field " + field + " is not a list in " + job);
        }
        List<Long> result = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof Number)) {
                throw new IllegalArgumentException("Field " + field + " has a non-numeric element: " + element);
            }
            result.add(((Number) element).longValue());
        }
        return result;
    }
}
