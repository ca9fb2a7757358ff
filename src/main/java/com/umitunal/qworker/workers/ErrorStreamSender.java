package com.umitunal.qworker.workers;

/**
 * Posts operational reports to the errors stream.
 */
public interface ErrorStreamSender {

    void send(String topic, String content) throws Exception;
}
