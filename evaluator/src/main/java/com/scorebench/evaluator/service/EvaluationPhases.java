package com.scorebench.evaluator.service;

import com.scorebench.evaluator.bundle.BundleComposer;
import com.scorebench.evaluator.bundle.CoopetitionArchiveBuilder;
import com.scorebench.evaluator.bundle.Manifest;
import com.scorebench.evaluator.bundle.ResultsCsvExporter;
import com.scorebench.evaluator.bundle.SubmissionPaths;
import com.scorebench.evaluator.dispatch.SubmissionDispatcher;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * The two dispatchable phases of an evaluation.
 *
 * Each phase prepares its artifacts in storage, records the phase in the
 * execution key under the submission row lock, then publishes the run. The
 * publish happens after the lock is released; the status is re-affirmed
 * through the state machine afterwards.
 */
@Service
public class EvaluationPhases {

    private static final Logger log = LoggerFactory.getLogger(EvaluationPhases.class);

    private static final byte[] EMPTY = new byte[0];

    private final StorageBackend            storage;
    private final BundleComposer            composer;
    private final ResultsCsvExporter        resultsExporter;
    private final CoopetitionArchiveBuilder coopetitionBuilder;
    private final SubmissionDispatcher      dispatcher;
    private final SubmissionStateMachine    stateMachine;

    public EvaluationPhases(StorageBackend storage,
                            BundleComposer composer,
                            ResultsCsvExporter resultsExporter,
                            CoopetitionArchiveBuilder coopetitionBuilder,
                            SubmissionDispatcher dispatcher,
                            SubmissionStateMachine stateMachine) {
        this.storage            = storage;
        this.composer           = composer;
        this.resultsExporter    = resultsExporter;
        this.coopetitionBuilder = coopetitionBuilder;
        this.dispatcher         = dispatcher;
        this.stateMachine       = stateMachine;
    }

    // ------------------------------------------------------------------
    // Prediction
    // ------------------------------------------------------------------

    /**
     * Run the participant's program on the phase input data.
     *
     * @param submission loaded with participant, phase and competition
     */
    public void predict(Submission submission, UUID jobId) {
        submission.setStdoutFile(SubmissionPaths.scoring(submission, "stdout.txt"));
        submission.setStderrFile(SubmissionPaths.scoring(submission, "stderr.txt"));
        submission.setPredictionStdoutFile(SubmissionPaths.prediction(submission, "stdout.txt"));
        submission.setPredictionStderrFile(SubmissionPaths.prediction(submission, "stderr.txt"));
        submission.setPredictionOutputFile(SubmissionPaths.prediction(submission, "output.zip"));
        submission.setPredictionRunFile(SubmissionPaths.prediction(submission, "run.txt"));

        // Fails before anything is written when the program is missing.
        Manifest run = composer.predictRunManifest(submission);

        byte[] stdout = filler("Standard output", submission);
        byte[] stderr = filler("Standard error", submission);
        storage.save(submission.getStdoutFile(), stdout);
        storage.save(submission.getPredictionStdoutFile(), stdout);
        storage.save(submission.getStderrFile(), stderr);
        storage.save(submission.getPredictionStderrFile(), stderr);
        storage.save(submission.getPredictionOutputFile(), EMPTY);
        storage.save(submission.getPredictionRunFile(), run.toBytes());

        log.info("Running prediction for submission {} as job {}", submission.getId(), jobId);
        Submission saved = stateMachine.update(submission.getId(), s -> {
            copyArtifacts(submission, s);
            s.setExecutionKey(s.getExecutionKey().withPredict(jobId));
        });

        dispatcher.dispatch(jobId, saved, true);
        stateMachine.transition(saved.getId(), SubmissionStatus.SUBMITTED);
    }

    // ------------------------------------------------------------------
    // Scoring
    // ------------------------------------------------------------------

    /**
     * Run the phase scoring program on the results, either the output of a
     * previous prediction run or the results the participant uploaded.
     *
     * @param submission loaded with participant, phase and competition
     */
    public void score(Submission submission, UUID jobId) {
        boolean hasGeneratedPredictions = submission.getExecutionKey().hasPredict();

        submission.setHistoryFile(SubmissionPaths.scoring(submission, "history.txt"));
        submission.setScoresFile(SubmissionPaths.scoring(submission, "scores.txt"));
        submission.setCoopetitionFile(SubmissionPaths.scoring(submission, "coopetition.zip"));

        // History of earlier output is reserved; the file is shipped empty.
        storage.save(submission.getHistoryFile(), EMPTY);
        storage.save(submission.getScoresFile(),
                resultsExporter.export(submission.getPhase(), false).getBytes(StandardCharsets.UTF_8));
        storage.save(submission.getCoopetitionFile(), coopetitionBuilder.build(submission));

        submission.setInputFile(SubmissionPaths.scoring(submission, "input.txt"));
        Manifest input = composer.inputManifest(submission, hasGeneratedPredictions);
        storage.save(submission.getInputFile(), input.toBytes());

        submission.setRunFile(SubmissionPaths.scoring(submission, "run.txt"));
        submission.setStdoutFile(SubmissionPaths.scoring(submission, "stdout.txt"));
        submission.setStderrFile(SubmissionPaths.scoring(submission, "stderr.txt"));
        submission.setOutputFile(SubmissionPaths.scoring(submission, "output_file.zip"));
        submission.setPrivateOutputFile(SubmissionPaths.scoring(submission, "private_output_file.zip"));
        submission.setDetailedResultsFile(SubmissionPaths.scoring(submission, "detailed_results_file.zip"));

        Manifest run = composer.scoringRunManifest(submission);
        storage.save(submission.getRunFile(), run.toBytes());

        if (!hasGeneratedPredictions) {
            storage.save(submission.getStdoutFile(), filler("Standard output", submission));
            storage.save(submission.getStderrFile(), filler("Standard error", submission));
        }
        storage.save(submission.getOutputFile(), EMPTY);
        storage.save(submission.getPrivateOutputFile(), EMPTY);
        storage.save(submission.getDetailedResultsFile(), EMPTY);

        log.info("Running scoring for submission {} as job {} (after prediction: {})",
                submission.getId(), jobId, hasGeneratedPredictions);
        Submission saved = stateMachine.update(submission.getId(), s -> {
            copyArtifacts(submission, s);
            // A reserved score job is already on the key.
            if (!jobId.equals(s.getExecutionKey().scoreJobId())) {
                s.setExecutionKey(s.getExecutionKey().withScore(jobId));
            }
        });

        dispatcher.dispatch(jobId, saved, false);

        if (!hasGeneratedPredictions) {
            stateMachine.transition(saved.getId(), SubmissionStatus.SUBMITTED);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static byte[] filler(String stream, Submission submission) {
        String text = stream + " for submission #" + submission.getSubmissionNumber()
                + " by " + submission.getParticipant().getUsername() + ".\n";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static void copyArtifacts(Submission from, Submission to) {
        to.setRunFile(from.getRunFile());
        to.setInputFile(from.getInputFile());
        to.setStdoutFile(from.getStdoutFile());
        to.setStderrFile(from.getStderrFile());
        to.setOutputFile(from.getOutputFile());
        to.setPrivateOutputFile(from.getPrivateOutputFile());
        to.setDetailedResultsFile(from.getDetailedResultsFile());
        to.setHistoryFile(from.getHistoryFile());
        to.setScoresFile(from.getScoresFile());
        to.setCoopetitionFile(from.getCoopetitionFile());
        to.setPredictionRunFile(from.getPredictionRunFile());
        to.setPredictionStdoutFile(from.getPredictionStdoutFile());
        to.setPredictionStderrFile(from.getPredictionStderrFile());
        to.setPredictionOutputFile(from.getPredictionOutputFile());
    }
}
