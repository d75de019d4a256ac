package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Job;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point of the evaluation pipeline.
 *
 * Decides between prediction + scoring and scoring only, and guarantees that
 * a submission whose run cannot be dispatched still ends up terminal: any
 * failure is turned into a synthesized "failed" callback for the same job.
 */
@Service
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    private final SubmissionRepository submissionRepo;
    private final JobService           jobService;
    private final EvaluationPhases     phases;
    private final ResultReconciler     reconciler;
    private final TaskWorkers          taskWorkers;

    public EvaluationOrchestrator(SubmissionRepository submissionRepo,
                                  JobService jobService,
                                  EvaluationPhases phases,
                                  ResultReconciler reconciler,
                                  TaskWorkers taskWorkers) {
        this.submissionRepo = submissionRepo;
        this.jobService     = jobService;
        this.phases         = phases;
        this.reconciler     = reconciler;
        this.taskWorkers    = taskWorkers;
    }

    /** Queue an evaluation on the site-worker pool. */
    public void evaluateAsync(Long submissionId, boolean scoringOnly) {
        taskWorkers.siteWorker(() -> {
            try {
                evaluate(submissionId, scoringOnly);
            } catch (Exception e) {
                log.error("Evaluation of submission {} could not start: {}", submissionId, e.getMessage(), e);
            }
        });
    }

    /**
     * Start evaluating a submission.
     *
     * @param scoringOnly true to skip the prediction phase (participant uploaded results)
     * @return the id of the job minted for the first dispatched phase
     * @throws SubmissionNotFoundException if the submission does not exist
     */
    public UUID evaluate(Long submissionId, boolean scoringOnly) {
        boolean predict = !scoringOnly;
        Job job = jobService.createEvaluationJob(submissionId, predict);
        UUID jobId = job.getId();

        Submission submission = submissionRepo.findWithContextById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));

        MDC.put("submissionId", String.valueOf(submissionId));
        MDC.put("jobId", jobId.toString());
        String phase = predict ? "prediction" : "scoring";
        try {
            log.debug("Dispatching {} for submission {} (job {})", phase, submissionId, jobId);
            if (predict) {
                phases.predict(submission, jobId);
            } else {
                phases.score(submission, jobId);
            }
        } catch (Exception e) {
            log.error("Dispatch of {} failed for submission {} (job {})", phase, submissionId, jobId, e);
            String secret = submission.getSecret();
            taskWorkers.submissionUpdates(() -> reconciler.handleCallback(jobId, CallbackUpdate.failed(secret)));
        } finally {
            MDC.remove("submissionId");
            MDC.remove("jobId");
        }
        return jobId;
    }
}
