package com.scorebench.evaluator.service;

import com.scorebench.evaluator.bundle.ResultBundle;
import com.scorebench.evaluator.bundle.ScoresFile;
import com.scorebench.evaluator.model.ExecutionKey;
import com.scorebench.evaluator.model.Job;
import com.scorebench.evaluator.model.JobState;
import com.scorebench.evaluator.model.ScoreDef;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionScore;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.ScoreDefRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import com.scorebench.evaluator.repository.SubmissionScoreRepository;
import com.scorebench.evaluator.storage.StorageBackend;
import com.scorebench.evaluator.storage.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies worker callbacks to submissions.
 *
 *   running   → RUNNING
 *   finished  → prediction done: dispatch scoring under a new job
 *               scoring done:    record scores.txt, FINISHED, leaderboard, notification
 *   failed    → store traceback, FAILED (unknown statuses are treated the same way)
 *
 * A callback must carry the submission's secret. Any error while applying an
 * authenticated callback forces the submission to FAILED, so no submission is
 * left waiting for a callback that will never come.
 */
@Service
public class ResultReconciler {

    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    private final JobService                jobService;
    private final SubmissionRepository      submissionRepo;
    private final SubmissionStateMachine    stateMachine;
    private final EvaluationPhases          phases;
    private final StorageBackend            storage;
    private final ScoreDefRepository        scoreDefRepo;
    private final SubmissionScoreRepository scoreRepo;
    private final LeaderboardPromoter       promoter;
    private final SubmissionMetadataService metadataService;
    private final CompletionNotifier        notifier;
    private final MeterRegistry             meterRegistry;
    private final String                    siteUrl;

    public ResultReconciler(JobService jobService,
                            SubmissionRepository submissionRepo,
                            SubmissionStateMachine stateMachine,
                            EvaluationPhases phases,
                            StorageBackend storage,
                            ScoreDefRepository scoreDefRepo,
                            SubmissionScoreRepository scoreRepo,
                            LeaderboardPromoter promoter,
                            SubmissionMetadataService metadataService,
                            CompletionNotifier notifier,
                            MeterRegistry meterRegistry,
                            @Value("${scorebench.site-url:http://localhost:8080}") String siteUrl) {
        this.jobService      = jobService;
        this.submissionRepo  = submissionRepo;
        this.stateMachine    = stateMachine;
        this.phases          = phases;
        this.storage         = storage;
        this.scoreDefRepo    = scoreDefRepo;
        this.scoreRepo       = scoreRepo;
        this.promoter        = promoter;
        this.metadataService = metadataService;
        this.notifier        = notifier;
        this.meterRegistry   = meterRegistry;
        this.siteUrl         = siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Apply one worker callback.
     *
     * @return the resulting state of the job, also recorded on the job
     * @throws JobNotFoundException             if the job id is unknown
     * @throws SubmissionNotFoundException      if the job's submission is gone
     * @throws CallbackAuthenticationException  if the secret does not match; nothing is changed
     */
    public JobState handleCallback(UUID jobId, CallbackUpdate update) {
        Job job = jobService.getJob(jobId);
        Long submissionId = jobService.evaluationTask(job).submissionId();

        MDC.put("submissionId", String.valueOf(submissionId));
        MDC.put("jobId", jobId.toString());
        try {
            Submission submission = submissionRepo.findWithContextById(submissionId)
                    .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
            authenticate(submission, update, jobId);

            JobState result;
            String outcome = "ok";
            try {
                result = apply(submission, jobId, update);
            } catch (SubmissionUpdateException e) {
                log.error("Failed to update submission {} (job {}, status {})",
                        e.getSubmissionId(), jobId, update.status(), e.getCause());
                stateMachine.transition(e.getSubmissionId(), SubmissionStatus.FAILED);
                result = JobState.FAILED;
                outcome = "error";
            }
            jobService.markState(jobId, result);
            count(update, outcome);
            return result;
        } finally {
            MDC.remove("submissionId");
            MDC.remove("jobId");
        }
    }

    private void authenticate(Submission submission, CallbackUpdate update, UUID jobId) {
        byte[] expected = submission.getSecret().getBytes(StandardCharsets.UTF_8);
        byte[] given = update.secret() == null ? new byte[0] : update.secret().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, given)) {
            log.error("Rejected {} callback for submission {} (job {}): secret does not match",
                    update.status(), submission.getId(), jobId);
            count(update, "rejected");
            throw new CallbackAuthenticationException("Secret does not match for job " + jobId);
        }
    }

    private JobState apply(Submission submission, UUID jobId, CallbackUpdate update) {
        try {
            if (update.hasMetadata()) {
                boolean predict = !submission.getExecutionKey().hasScore();
                metadataService.merge(submission, predict, update.metadata());
            }
            Optional<WorkerStatus> status = WorkerStatus.parse(update.status());
            if (status.isEmpty()) {
                log.error("Invalid status: {} (submission {})", update.status(), submission.getId());
                return failed(submission, update.traceback());
            }
            switch (status.get()) {
                case RUNNING:
                    stateMachine.transition(submission.getId(), SubmissionStatus.RUNNING);
                    return JobState.RUNNING;
                case FINISHED:
                    return finished(submission, jobId);
                default:
                    return failed(submission, update.traceback());
            }
        } catch (RuntimeException e) {
            throw new SubmissionUpdateException(submission.getId(), e);
        }
    }

    // ------------------------------------------------------------------
    // finished
    // ------------------------------------------------------------------

    private JobState finished(Submission submission, UUID jobId) {
        ExecutionKey key = submission.getExecutionKey();
        if (!key.hasScore()) {
            startScoring(submission, jobId);
            return JobState.FINISHED;
        }
        if (jobId.equals(key.predictJobId())) {
            log.info("Ignoring late 'finished' of prediction job {}; scoring already dispatched as {}",
                    jobId, key.scoreJobId());
            return JobState.FINISHED;
        }
        return collectScores(submission);
    }

    /**
     * Prediction succeeded; hand the output to the scoring program. The score
     * job is reserved under the row lock first, so a duplicate callback or a
     * submission that went terminal meanwhile dispatches nothing. When the
     * scoring run cannot be dispatched the submission fails, with the reason
     * stored as its exception details.
     */
    private void startScoring(Submission submission, UUID predictJobId) {
        Optional<UUID> claimed = stateMachine.claimScoring(submission.getId(),
                () -> jobService.createEvaluationJob(submission.getId(), false).getId());
        if (claimed.isEmpty()) {
            log.info("Ignoring 'finished' of prediction job {} for submission {}", predictJobId, submission.getId());
            return;
        }
        UUID scoreJobId = claimed.get();
        log.debug("Submission {} entering scoring phase", submission.getId());
        try {
            phases.score(submission, scoreJobId);
            log.debug("Submission {} scoring phase entered as job {}", submission.getId(), scoreJobId);
        } catch (RuntimeException e) {
            log.error("Submission {} failed to enter scoring phase", submission.getId(), e);
            jobService.markState(scoreJobId, JobState.FAILED);
            failed(submission, "Scoring could not be started: " + e.getMessage());
        }
    }

    private JobState collectScores(Submission submission) {
        Optional<ScoresFile> scores = readScores(submission);
        if (scores.isEmpty()) {
            log.error("scores.txt not found, unable to process submission {}", submission.getId());
            stateMachine.transition(submission.getId(), SubmissionStatus.FAILED);
            return JobState.FAILED;
        }
        for (String line : scores.get().rejected()) {
            log.warn("Skipping malformed score line '{}' (submission {})", line, submission.getId());
        }

        Long competitionId = submission.getPhase().getCompetition().getId();
        for (ScoresFile.Score score : scores.get().scores()) {
            Optional<ScoreDef> def = scoreDefRepo.findByCompetitionIdAndKey(competitionId, score.label());
            if (def.isEmpty()) {
                log.warn("Score {} does not exist (submission {})", score.label(), submission.getId());
                continue;
            }
            recordScore(submission, def.get(), score.value());
        }

        boolean finishedNow = stateMachine.transition(submission.getId(), SubmissionStatus.FINISHED);
        if (!finishedNow) {
            return JobState.FINISHED;
        }
        promoter.evaluate(submission);

        if (submission.getParticipant().isEmailOnSubmissionFinished()) {
            notifier.submissionFinished(submission,
                    siteUrl + "/competitions/" + submission.getPhase().getCompetition().getId());
        }
        return JobState.FINISHED;
    }

    private Optional<ScoresFile> readScores(Submission submission) {
        byte[] archive;
        try {
            archive = storage.read(submission.getOutputFile());
        } catch (StorageException e) {
            log.error("Output of submission {} is unreadable: {}", submission.getId(), e.getMessage());
            return Optional.empty();
        }
        try {
            return ResultBundle.fromZip(archive)
                    .find(ScoresFile.FILE_NAME)
                    .map(entry -> ScoresFile.parse(entry.text()));
        } catch (IllegalArgumentException e) {
            log.error("Output of submission {} is not a valid archive: {}", submission.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    // A score is recorded at most once per definition; a repeated label overwrites it.
    private void recordScore(Submission submission, ScoreDef def, double value) {
        SubmissionScore score = scoreRepo.findBySubmissionIdAndScoreDefId(submission.getId(), def.getId())
                .orElseGet(() -> new SubmissionScore(submission, def, value));
        score.setValue(value);
        scoreRepo.save(score);
    }

    // ------------------------------------------------------------------
    // failed
    // ------------------------------------------------------------------

    private JobState failed(Submission submission, String traceback) {
        if (traceback != null && !traceback.isEmpty()) {
            stateMachine.update(submission.getId(), s -> {
                if (!s.getStatus().isTerminal()) {
                    s.setExceptionDetails(traceback);
                }
            });
        }
        stateMachine.transition(submission.getId(), SubmissionStatus.FAILED);
        return JobState.FAILED;
    }

    private void count(CallbackUpdate update, String outcome) {
        String status = WorkerStatus.parse(update.status()).map(WorkerStatus::wireName).orElse("invalid");
        Counter.builder("scorebench.callbacks")
                .tag("status", status)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
