package com.umitunal.qworker.worker;

/**
 * A worker was instantiated without a queue assigned to its class.
 */
public class WorkerDeclarationException extends RuntimeException {

    public WorkerDeclarationException(String message) {
        super(message);
    }
}
