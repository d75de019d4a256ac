package com.scorebench.evaluator.model;

import java.util.UUID;

/**
 * Durable record of which pipeline phases were dispatched for a submission,
 * and under which job ids.
 *
 * Persisted as {"predict": "<job id>", "score": "<job id>"} by
 * {@link ExecutionKeyConverter}. The value only grows: a phase key, once set,
 * is never removed or replaced.
 */
public record ExecutionKey(UUID predictJobId, UUID scoreJobId) {

    public enum Stage {
        NOT_STARTED,
        PREDICT_DISPATCHED,
        SCORE_DISPATCHED
    }

    public static final ExecutionKey NOT_STARTED = new ExecutionKey(null, null);

    public Stage stage() {
        if (scoreJobId != null)   return Stage.SCORE_DISPATCHED;
        if (predictJobId != null) return Stage.PREDICT_DISPATCHED;
        return Stage.NOT_STARTED;
    }

    public boolean hasPredict() { return predictJobId != null; }
    public boolean hasScore()   { return scoreJobId != null; }

    /** Record the dispatch of the prediction phase. */
    public ExecutionKey withPredict(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (predictJobId != null || scoreJobId != null) {
            throw new IllegalStateException("Prediction can only be dispatched first; current stage " + stage());
        }
        return new ExecutionKey(jobId, null);
    }

    /** Record the dispatch of the scoring phase. Keeps the prediction job id, if any. */
    public ExecutionKey withScore(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (scoreJobId != null) {
            throw new IllegalStateException("Scoring already dispatched as job " + scoreJobId);
        }
        return new ExecutionKey(predictJobId, jobId);
    }
}
