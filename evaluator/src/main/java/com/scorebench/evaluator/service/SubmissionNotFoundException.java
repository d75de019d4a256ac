package com.scorebench.evaluator.service;

public class SubmissionNotFoundException extends RuntimeException {

    public SubmissionNotFoundException(Long submissionId) {
        super("Submission not found: " + submissionId);
    }
}
