package com.scorebench.evaluator.dispatch;

/**
 * A run could not be handed to the compute queue (broker unreachable,
 * payload not serializable).
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
