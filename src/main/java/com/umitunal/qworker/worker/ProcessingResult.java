package com.umitunal.qworker.worker;

/**
 * Result of handling one job.
 */
public final class ProcessingResult {
    private static final ProcessingResult SUCCESS = new ProcessingResult(Outcome.SUCCESS, null, null);

    private final Outcome outcome;
    private final String message;
    private final Throwable cause;

    private ProcessingResult(Outcome outcome, String message, Throwable cause) {
        this.outcome = outcome;
        this.message = message;
        this.cause = cause;
    }

    public Outcome getOutcome() { return outcome; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public static ProcessingResult success() {
        return SUCCESS;
    }

    /**
     * Failed, but another attempt may succeed.
     */
    public static ProcessingResult retry(String message) {
        return new ProcessingResult(Outcome.RETRY, message, null);
    }

    public static ProcessingResult retry(Throwable cause) {
        return new ProcessingResult(Outcome.RETRY, cause.toString(), cause);
    }

    /**
     * Failed in a way no retry will fix; the job goes straight to quarantine.
     */
    public static ProcessingResult fatal(String message) {
        return new ProcessingResult(Outcome.FATAL, message, null);
    }

    public static ProcessingResult fatal(String message, Throwable cause) {
        return new ProcessingResult(Outcome.FATAL, message, cause);
    }

    @Override
    public String toString() {
        return message == null ? outcome.toString() : outcome + "(" + message + ")";
    }

    public enum Outcome {
        SUCCESS,
        RETRY,
        FATAL
    }
}
