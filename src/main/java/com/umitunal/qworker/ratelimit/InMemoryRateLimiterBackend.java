package com.umitunal.qworker.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Process-local sliding-window backend. Each entity keeps the timestamps of its
 * recent actions, trimmed to the longest window among its rules.
 */
public class InMemoryRateLimiterBackend implements RateLimiterBackend {
    private final Clock clock;
    private final Map<String, Deque<Instant>> history = new HashMap<>();

    public InMemoryRateLimiterBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryRateLimiterBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized RateLimitStatus isRateLimited(RateLimitedObject entity) {
        Deque<Instant> actions = history.getOrDefault(entity.key(), new ArrayDeque<>());
        Instant now = clock.instant();
        double longestWait = 0;
        boolean limited = false;

        for (RateLimitRule rule : entity.rules()) {
            Instant windowStart = now.minusSeconds(rule.getWindowSeconds());
            int count = 0;
            Instant oldestInWindow = null;

            // Deque is ordered newest first
            for (Instant action : actions) {
                if (!action.isAfter(windowStart)) {
                    break;
                }
                count++;
                oldestInWindow = action;
            }

            if (count >= rule.getMaxCount()) {
                limited = true;
                double wait = oldestInWindow == null
                        ? rule.getWindowSeconds()
                        : Duration.between(windowStart, oldestInWindow).toMillis() / 1000.0;
                longestWait = Math.max(longestWait, wait);
            }
        }

        return limited ? RateLimitStatus.limited(longestWait) : RateLimitStatus.allowed();
    }

    @Override
    public synchronized void incrementUsage(RateLimitedObject entity) {
        Instant now = clock.instant();
        Deque<Instant> actions = history.computeIfAbsent(entity.key(), key -> new ArrayDeque<>());
        actions.addFirst(now);
        trim(actions, entity, now);
    }

    @Override
    public synchronized void clearHistory(RateLimitedObject entity) {
        history.remove(entity.key());
    }

    private void trim(Deque<Instant> actions, RateLimitedObject entity, Instant now) {
        long longestWindow = 0;
        for (RateLimitRule rule : entity.rules()) {
            longestWindow = Math.max(longestWindow, rule.getWindowSeconds());
        }
        Instant horizon = now.minusSeconds(longestWindow);
        Iterator<Instant> oldestFirst = actions.descendingIterator();
        while (oldestFirst.hasNext()) {
            if (oldestFirst.next().isAfter(horizon)) {
                break;
            }
            oldestFirst.remove();
        }
    }
}
