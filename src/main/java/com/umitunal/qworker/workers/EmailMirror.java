package com.umitunal.qworker.workers;

import java.util.Map;

/**
 * Turns an inbound e-mail into a message on the recipient's tenant.
 */
public interface EmailMirror {

    /**
     * Resolve the tenant owning a mirror address.
     */
    String tenantFor(String recipient);

    void mirror(Map<String, Object> email) throws Exception;
}
