package com.scorebench.evaluator.dispatch;

import java.util.UUID;

/**
 * Outbound task envelope:
 * {"id": "<job id>", "task_type": "run", "task_args": {...}}
 */
public record RunEnvelope(UUID id, String task_type, RunTaskArgs task_args) {

    public static final String RUN = "run";

    public static RunEnvelope run(UUID jobId, RunTaskArgs args) {
        return new RunEnvelope(jobId, RUN, args);
    }
}
