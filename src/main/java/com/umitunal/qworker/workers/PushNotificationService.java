package com.umitunal.qworker.workers;

import java.util.List;
import java.util.Map;

/**
 * Delivers mobile push notifications for one user.
 */
public interface PushNotificationService {

    void handleNew(long userProfileId, Map<String, Object> notification)
            throws PushNotificationBouncerRetryLaterException;

    void handleRemove(long userProfileId, List<Long> messageIds)
            throws PushNotificationBouncerRetryLaterException;
}
