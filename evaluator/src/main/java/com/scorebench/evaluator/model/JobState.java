package com.scorebench.evaluator.model;

/**
 * State of a tracking Job.
 *
 *   CREATED  → RUNNING   (a phase was dispatched and the worker reported progress)
 *   RUNNING  → FINISHED  (callback processed, pipeline step concluded)
 *   any      → FAILED    (dispatch or reconciliation failed)
 */
public enum JobState {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED
}
