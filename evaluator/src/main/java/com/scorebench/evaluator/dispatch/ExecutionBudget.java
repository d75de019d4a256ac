package com.scorebench.evaluator.dispatch;

import com.scorebench.evaluator.model.Phase;

import java.time.Duration;

/** Soft wall-clock budget a worker is expected to enforce on itself. */
public final class ExecutionBudget {

    public static final Duration DEFAULT = Duration.ofMinutes(10);

    private ExecutionBudget() {}

    /** The phase limit in seconds, or 10 minutes when it is unset or not positive. */
    public static Duration softLimit(Phase phase) {
        Integer seconds = phase.getExecutionTimeLimit();
        if (seconds == null || seconds <= 0) {
            return DEFAULT;
        }
        return Duration.ofSeconds(seconds);
    }
}
