package com.umitunal.qworker.ratelimit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * At most {@code maxCount} actions within any window of {@code windowSeconds}.
 */
public final class RateLimitRule {
    private final long windowSeconds;
    private final int maxCount;

    public RateLimitRule(long windowSeconds, int maxCount) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
        }
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount must be >= 0: " + maxCount);
        }
        this.windowSeconds = windowSeconds;
        this.maxCount = maxCount;
    }

    public long getWindowSeconds() { return windowSeconds; }
    public int getMaxCount() { return maxCount; }

    /**
     * Parse rules written as {@code window:max} pairs separated by commas, e.g. {@code "10:2,3600:50"}.
     */
    public static List<RateLimitRule> parseRules(String spec) {
        List<RateLimitRule> rules = new ArrayList<>();
        if (spec == null || spec.isBlank()) {
            return rules;
        }
        for (String part : spec.split(",")) {
            String[] pieces = part.trim().split(":");
            if (pieces.length != 2) {
                throw new IllegalArgumentException("Invalid rate limit rule '" + part + "', expected window:max");
            }
            try {
                rules.add(new RateLimitRule(Long.parseLong(pieces[0].trim()), Integer.parseInt(pieces[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid rate limit rule '" + part + "'", e);
            }
        }
        return Collections.unmodifiableList(rules);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimitRule)) return false;
        RateLimitRule other = (RateLimitRule) o;
        return windowSeconds == other.windowSeconds && maxCount == other.maxCount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(windowSeconds) * 31 + maxCount;
    }

    @Override
    public String toString() {
        return windowSeconds + "s:" + maxCount;
    }
}
