package com.umitunal.qworker.ratelimit;

/**
 * The backend could not take the lock guarding an entity's usage history.
 */
public class RateLimiterLockingException extends Exception {

    public RateLimiterLockingException(String message) {
        super(message);
    }
}
