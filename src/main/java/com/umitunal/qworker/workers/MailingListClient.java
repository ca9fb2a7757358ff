package com.umitunal.qworker.workers;

import java.io.IOException;
import java.util.Map;

/**
 * Subscribes new users to the announcement mailing list.
 */
public interface MailingListClient {

    /**
     * Whether credentials are available. Signups are skipped otherwise.
     */
    boolean isConfigured();

    /**
     * Post one member. HTTP error statuses are returned, not thrown.
     *
     * @throws IOException if the request could not be completed
     */
    MailingListResponse subscribe(Map<String, Object> member) throws IOException;
}
