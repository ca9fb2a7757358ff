package com.umitunal.qworker.workers;

import java.io.IOException;
import java.util.Map;

/**
 * Renders and delivers one queued e-mail.
 */
public interface EmailSender {

    void send(Map<String, Object> message) throws IOException;
}
