package com.umitunal.qworker.workers;

/**
 * The push notification bouncer asked us to try again later.
 */
public class PushNotificationBouncerRetryLaterException extends Exception {

    public PushNotificationBouncerRetryLaterException(String message) {
        super(message);
    }

    public PushNotificationBouncerRetryLaterException(String message, Throwable cause) {
        super(message, cause);
    }
}
