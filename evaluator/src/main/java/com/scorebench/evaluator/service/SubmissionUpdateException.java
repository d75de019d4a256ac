package com.scorebench.evaluator.service;

/**
 * Processing a worker callback failed for a known submission.
 * Carries the submission id so the outer handler can force it to FAILED.
 */
public class SubmissionUpdateException extends RuntimeException {

    private final Long submissionId;

    public SubmissionUpdateException(Long submissionId, Throwable cause) {
        super("Failed to update submission " + submissionId + ": " + cause.getMessage(), cause);
        this.submissionId = submissionId;
    }

    public Long getSubmissionId() {
        return submissionId;
    }
}
