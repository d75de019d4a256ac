package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The only writer of {@link Submission#getStatus()}.
 *
 * Worker callbacks, the orchestrator, the dispatch-failure fallback and admin
 * actions all race on the same rows and may arrive in any order. Every change
 * runs in one transaction holding SELECT ... FOR UPDATE on the submission, and
 * {@link SubmissionStatus#canTransitionTo} refuses to leave a terminal state,
 * so a late "running" or a duplicate "finished" cannot undo a final result.
 */
@Service
public class SubmissionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SubmissionStateMachine.class);

    private final SubmissionRepository submissionRepo;

    public SubmissionStateMachine(SubmissionRepository submissionRepo) {
        this.submissionRepo = submissionRepo;
    }

    /**
     * Move a submission to a new status.
     *
     * @return true if the status was written, false if the transition was
     *         refused because the submission is already terminal
     * @throws SubmissionNotFoundException if no such submission exists
     */
    @Transactional
    public boolean transition(Long submissionId, SubmissionStatus target) {
        Submission submission = lock(submissionId);
        SubmissionStatus current = submission.getStatus();

        if (!current.canTransitionTo(target)) {
            log.info("Skipping status update of submission {}: invalid transition {} -> {}",
                    submissionId, current.codename(), target.codename());
            return false;
        }
        submission.setStatus(target);
        submissionRepo.save(submission);
        if (current != target) {
            log.info("Submission {} status {} -> {}", submissionId, current.codename(), target.codename());
        }
        return true;
    }

    /**
     * Apply a multi-field change (execution key, artifact paths, traceback)
     * under the same row lock as {@link #transition}.
     *
     * The mutator must not change the status; status changes go through
     * {@link #transition} so the terminal latch is always applied.
     *
     * @return the updated submission, with participant, phase and competition loaded
     */
    @Transactional
    public Submission update(Long submissionId, Consumer<Submission> mutator) {
        Submission submission = lock(submissionId);
        SubmissionStatus before = submission.getStatus();

        mutator.accept(submission);

        if (submission.getStatus() != before) {
            throw new IllegalStateException("Status of submission " + submissionId
                    + " may only change through transition()");
        }
        return submissionRepo.save(submission);
    }

    /**
     * Reserve the scoring phase of a submission, under the row lock.
     *
     * Only the first caller wins: when the submission is terminal or scoring
     * was already dispatched, nothing is written and no job is minted. The
     * winner's job comes from {@code newJob}, called inside the same
     * transaction, and is recorded as the execution key's score job.
     *
     * @return the reserved score job id, or empty if the caller lost
     */
    @Transactional
    public Optional<UUID> claimScoring(Long submissionId, Supplier<UUID> newJob) {
        Submission submission = lock(submissionId);
        if (submission.getStatus().isTerminal()) {
            log.info("Not scoring submission {}: already {}", submissionId, submission.getStatus().codename());
            return Optional.empty();
        }
        if (submission.getExecutionKey().hasScore()) {
            log.info("Not scoring submission {}: scoring already dispatched as job {}",
                    submissionId, submission.getExecutionKey().scoreJobId());
            return Optional.empty();
        }
        UUID jobId = newJob.get();
        submission.setExecutionKey(submission.getExecutionKey().withScore(jobId));
        submissionRepo.save(submission);
        return Optional.of(jobId);
    }

    private Submission lock(Long submissionId) {
        return submissionRepo.findByIdForUpdate(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }
}
