package com.umitunal.qworker.ratelimit;

import java.util.List;

/**
 * Something whose actions are counted against a set of rules, identified by a key.
 */
public interface RateLimitedObject {

    /**
     * Storage key of this entity's usage history, e.g. {@code RateLimitedTenantMirror:acme}.
     */
    String key();

    List<RateLimitRule> rules();
}
