package com.umitunal.qworker.ratelimit;

import java.util.List;

/**
 * Inbound mail mirrored into one tenant.
 */
public class RateLimitedTenantMirror implements RateLimitedObject {
    private final String tenant;
    private final List<RateLimitRule> rules;

    public RateLimitedTenantMirror(String tenant, List<RateLimitRule> rules) {
        this.tenant = tenant;
        this.rules = List.copyOf(rules);
    }

    public String getTenant() {
        return tenant;
    }

    @Override
    public String key() {
        return getClass().getSimpleName() + ":" + tenant;
    }

    @Override
    public List<RateLimitRule> rules() {
        return rules;
    }
}
