package com.umitunal.qworker.ratelimit;

/**
 * Storage of per-entity usage history.
 */
public interface RateLimiterBackend {

    /**
     * Check the entity's history against its rules without recording anything.
     */
    RateLimitStatus isRateLimited(RateLimitedObject entity);

    /**
     * Record one action for the entity.
     *
     * @throws RateLimiterLockingException if the history is locked by a concurrent writer
     */
    void incrementUsage(RateLimitedObject entity) throws RateLimiterLockingException;

    /**
     * Forget everything recorded for the entity.
     */
    void clearHistory(RateLimitedObject entity);

    /**
     * Result of a rate limit check.
     */
    final class RateLimitStatus {
        private static final RateLimitStatus ALLOWED = new RateLimitStatus(false, 0);

        private final boolean limited;
        private final double secondsUntilFree;

        private RateLimitStatus(boolean limited, double secondsUntilFree) {
            this.limited = limited;
            this.secondsUntilFree = secondsUntilFree;
        }

        public boolean isLimited() { return limited; }
        public double getSecondsUntilFree() { return secondsUntilFree; }

        public static RateLimitStatus allowed() {
            return ALLOWED;
        }

        public static RateLimitStatus limited(double secondsUntilFree) {
            return new RateLimitStatus(true, secondsUntilFree);
        }
    }
}
