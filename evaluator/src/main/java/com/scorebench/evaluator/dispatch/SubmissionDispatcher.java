package com.scorebench.evaluator.dispatch;

import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.storage.SignedUrlService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Hands one phase of a submission to the compute workers.
 *
 * Signs the phase-appropriate artifacts, wraps them in a {@link RunEnvelope}
 * and publishes it with the phase's soft time budget, on the competition's
 * isolated route when it has one. Wall-clock enforcement is the worker's job.
 */
@Component
public class SubmissionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SubmissionDispatcher.class);

    private final SignedUrlService signer;
    private final WorkQueue        queue;
    private final MeterRegistry    meterRegistry;
    private final String           defaultDockerImage;
    private final String           computeQueue;

    public SubmissionDispatcher(SignedUrlService signer,
                                WorkQueue queue,
                                MeterRegistry meterRegistry,
                                @Value("${scorebench.evaluation.default-docker-image}") String defaultDockerImage,
                                @Value("${scorebench.queue.compute-queue:compute-worker}") String computeQueue) {
        this.signer             = signer;
        this.queue              = queue;
        this.meterRegistry      = meterRegistry;
        this.defaultDockerImage = defaultDockerImage;
        this.computeQueue       = computeQueue;
    }

    /**
     * @param isPrediction true for the prediction run, false for scoring
     * @throws DispatchException if the queue rejects the run
     */
    public RunEnvelope dispatch(UUID jobId, Submission submission, boolean isPrediction) {
        Phase phase = submission.getPhase();

        String bundle = isPrediction ? submission.getPredictionRunFile()    : submission.getRunFile();
        String stdout = isPrediction ? submission.getPredictionStdoutFile() : submission.getStdoutFile();
        String stderr = isPrediction ? submission.getPredictionStderrFile() : submission.getStderrFile();
        String output = isPrediction ? submission.getPredictionOutputFile() : submission.getOutputFile();

        RunTaskArgs args = new RunTaskArgs(
                submission.getId(),
                dockerImage(submission),
                signer.read(bundle),
                signer.write(stdout),
                signer.write(stderr),
                signer.write(output),
                signer.write(submission.getDetailedResultsFile()),
                signer.write(submission.getPrivateOutputFile()),
                submission.getSecret(),
                phase.getExecutionTimeLimit(),
                isPrediction);
        RunEnvelope envelope = RunEnvelope.run(jobId, args);

        Duration budget = ExecutionBudget.softLimit(phase);
        QueueRoute route = QueueRoute.forCompetition(phase.getCompetition());
        String phaseTag = isPrediction ? "predict" : "score";

        try {
            queue.publish(computeQueue, envelope, budget, route);
        } catch (RuntimeException e) {
            count(phaseTag, route, "error");
            throw e;
        }
        count(phaseTag, route, "ok");
        log.info("Dispatched {} run for submission {} as job {} (budget {}s, route {})",
                phaseTag, submission.getId(), jobId, budget.toSeconds(),
                route.isolated() ? route.vhost() : "default");
        return envelope;
    }

    private String dockerImage(Submission submission) {
        String image = submission.getDockerImage();
        return image == null || image.isBlank() ? defaultDockerImage : image;
    }

    private void count(String phase, QueueRoute route, String outcome) {
        Counter.builder("scorebench.dispatch")
                .tag("phase", phase)
                .tag("route", route.tag())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
