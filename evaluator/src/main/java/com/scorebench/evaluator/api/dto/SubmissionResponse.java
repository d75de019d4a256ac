package com.scorebench.evaluator.api.dto;

import com.scorebench.evaluator.model.ExecutionKey;
import com.scorebench.evaluator.model.Submission;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /submissions/{id} and POST /submissions/{id}/cancel.
 */
public record SubmissionResponse(
        Long    id,
        String  status,
        String  participant,
        int     phaseNumber,
        int     submissionNumber,
        Instant submittedAt,
        String  executionStage,
        UUID    predictJobId,
        UUID    scoreJobId,
        String  exceptionDetails
) {
    public static SubmissionResponse from(Submission s) {
        ExecutionKey key = s.getExecutionKey();
        return new SubmissionResponse(
                s.getId(),
                s.getStatus().codename(),
                s.getParticipant().getUsername(),
                s.getPhase().getPhaseNumber(),
                s.getSubmissionNumber(),
                s.getSubmittedAt(),
                key.stage().name(),
                key.predictJobId(),
                key.scoreJobId(),
                s.getExceptionDetails()
        );
    }
}
