package com.scorebench.evaluator.service;

import java.util.Map;

/**
 * One status report from a compute worker, already unwrapped from the HTTP body.
 *
 * @param status    raw status string; unknown values are handled as failures
 * @param secret    the submission's capability token
 * @param traceback worker traceback of a failed run, may be null
 * @param metadata  free-form run metadata, may be null or empty
 */
public record CallbackUpdate(String status, String secret, String traceback, Map<String, Object> metadata) {

    /** The callback synthesized when a run could not be dispatched or timed out. */
    public static CallbackUpdate failed(String secret) {
        return new CallbackUpdate(WorkerStatus.FAILED.wireName(), secret, null, null);
    }

    public boolean hasMetadata() {
        return metadata != null && !metadata.isEmpty();
    }
}
