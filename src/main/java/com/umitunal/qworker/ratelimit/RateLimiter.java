package com.umitunal.qworker.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks and records an entity's usage in one step.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimiterBackend backend;

    public RateLimiter(RateLimiterBackend backend) {
        this.backend = backend;
    }

    /**
     * Record an action for the entity unless it is over budget.
     *
     * @return true if the action must be dropped
     */
    public boolean rateLimit(RateLimitedObject entity) {
        RateLimiterBackend.RateLimitStatus status = backend.isRateLimited(entity);
        if (status.isLimited()) {
            log.debug("{} is rate limited for another {}s", entity.key(), status.getSecondsUntilFree());
            return true;
        }

        try {
            backend.incrementUsage(entity);
            return false;
        } catch (RateLimiterLockingException e) {
            // Contention counts as limited
            log.warn("Deadlock trying to increment rate limit for {}", entity.key());
            return true;
        }
    }

    public void clearHistory(RateLimitedObject entity) {
        backend.clearHistory(entity);
    }
}
