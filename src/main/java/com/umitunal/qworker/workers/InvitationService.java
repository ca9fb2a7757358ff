package com.umitunal.qworker.workers;

import java.util.OptionalLong;

/**
 * Looks up pending invitations and sends them.
 */
public interface InvitationService {

    /**
     * Whether the invitation still exists; revoked or accepted invitations do not.
     */
    boolean invitationExists(long preregId);

    /**
     * Most recent invitation sent to an address, if any.
     */
    OptionalLong latestInvitationFor(String email);

    /**
     * Send the invitation e-mail and schedule its reminder.
     *
     * @param emailBody custom text from the inviter, may be null
     */
    void sendInvitation(long preregId, long referrerId, String emailBody) throws Exception;
}
