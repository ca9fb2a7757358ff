package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;

import java.util.List;

/**
 * Sends one digest e-mail for a user's missed messages.
 */
public interface MissedMessageNotifier {

    void sendMissedMessageNotifications(long userProfileId, List<Job> events, int count) throws Exception;
}
