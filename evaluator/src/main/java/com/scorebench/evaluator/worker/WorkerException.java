package com.scorebench.evaluator.worker;

/**
 * Thrown when the evaluation service rejects a worker callback or is unreachable.
 */
public class WorkerException extends RuntimeException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
