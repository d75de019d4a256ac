package com.scorebench.evaluator.service;

/**
 * A worker callback presented a secret that does not match the submission's.
 * The callback is rejected without touching the submission.
 */
public class CallbackAuthenticationException extends RuntimeException {

    public CallbackAuthenticationException(String message) {
        super(message);
    }
}
