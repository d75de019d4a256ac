package com.scorebench.evaluator.bundle;

/**
 * A required artifact reference (program, results) is missing or cannot be
 * signed. The phase must not be dispatched.
 */
public class MissingPreconditionException extends RuntimeException {

    public MissingPreconditionException(String message) {
        super(message);
    }
}
