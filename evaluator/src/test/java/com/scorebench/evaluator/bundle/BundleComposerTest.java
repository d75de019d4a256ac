package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.repository.SubmissionRepository;
import com.scorebench.evaluator.storage.SignedUrlService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BundleComposerTest {

    @Mock SignedUrlService     signer;
    @Mock SubmissionRepository submissionRepo;

    BundleComposer composer;
    Submission submission;

    @BeforeEach
    void setUp() {
        composer = new BundleComposer(signer, submissionRepo);
        submission = Fixtures.submission(42L);
        submission.setPredictionStdoutFile(SubmissionPaths.prediction(submission, "stdout.txt"));
        submission.setPredictionStderrFile(SubmissionPaths.prediction(submission, "stderr.txt"));
        submission.setPredictionOutputFile(SubmissionPaths.prediction(submission, "output.zip"));
        submission.setInputFile(SubmissionPaths.scoring(submission, "input.txt"));
        submission.setStdoutFile(SubmissionPaths.scoring(submission, "stdout.txt"));
        submission.setStderrFile(SubmissionPaths.scoring(submission, "stderr.txt"));
        submission.setOutputFile(SubmissionPaths.scoring(submission, "output_file.zip"));
        submission.setPrivateOutputFile(SubmissionPaths.scoring(submission, "private_output_file.zip"));
        submission.setHistoryFile(SubmissionPaths.scoring(submission, "history.txt"));
        submission.setScoresFile(SubmissionPaths.scoring(submission, "scores.txt"));
        submission.setCoopetitionFile(SubmissionPaths.scoring(submission, "coopetition.zip"));

        lenient().when(signer.read(any())).thenAnswer(inv -> signed("GET", inv.getArgument(0)));
        lenient().when(signer.write(any())).thenAnswer(inv -> signed("PUT", inv.getArgument(0)));
    }

    static String signed(String method, String path) {
        return path == null || path.isBlank() ? "" : "https://store/" + method + "/" + path;
    }

    // ------------------------------------------------------------------
    // Prediction run manifest
    // ------------------------------------------------------------------

    @Test
    void predictRunManifest_signsProgramInputAndOutputs() {
        Manifest manifest = composer.predictRunManifest(submission);

        assertThat(manifest.entries()).containsExactly(
                entry("program", "https://store/GET/uploads/42/submission.zip"),
                entry("input",   "https://store/GET/bundles/phase-1/input.zip"),
                entry("stdout",  "https://store/PUT/competition/7/1/submissions/42/predict/stdout.txt"),
                entry("stderr",  "https://store/PUT/competition/7/1/submissions/42/predict/stderr.txt"));
    }

    @Test
    void predictRunManifest_withoutPhaseInput_omitsInputLine() {
        submission.getPhase().setInputData(null);

        assertThat(composer.predictRunManifest(submission).get("input")).isEmpty();
    }

    @Test
    void predictRunManifest_unsignableProgram_isMissingPrecondition() {
        when(signer.read("uploads/42/submission.zip")).thenReturn("");

        assertThatThrownBy(() -> composer.predictRunManifest(submission))
                .isInstanceOf(MissingPreconditionException.class)
                .hasMessage("Program is missing.");
    }

    // ------------------------------------------------------------------
    // Input manifest
    // ------------------------------------------------------------------

    @Test
    void inputManifest_uploadedResults_pointAtParticipantBundle() {
        Manifest manifest = composer.inputManifest(submission, false);

        assertThat(manifest.get("res")).contains("https://store/GET/uploads/42/submission.zip");
        assertThat(manifest.get("ref")).contains("https://store/GET/bundles/phase-1/reference.zip");
        assertThat(manifest.get("submitted-by")).contains("alice");
        assertThat(manifest.get("competition-submission")).contains("1");
        assertThat(manifest.get("competition-phase")).contains("1");
        assertThat(manifest.get("automatic-submission")).contains("False");
    }

    @Test
    void inputManifest_generatedPredictions_pointAtPredictionOutput() {
        Manifest manifest = composer.inputManifest(submission, true);

        assertThat(manifest.get("res"))
                .contains("https://store/GET/competition/7/1/submissions/42/predict/output.zip");
    }

    @Test
    void inputManifest_missingResults_isMissingPrecondition() {
        submission.setPredictionOutputFile(null);

        assertThatThrownBy(() -> composer.inputManifest(submission, true))
                .isInstanceOf(MissingPreconditionException.class)
                .hasMessage("Results are missing.");
    }

    @Test
    void submittedAt_isUtcTruncatedToSeconds() {
        assertThat(BundleComposer.submittedAt(submission)).isEqualTo("2024-03-01T10:15:30");
    }

    @Test
    void automaticSubmission_onlyForFirstSubmissionInAutoMigratingPhase() {
        submission.getPhase().setAutoMigration(true);
        when(submissionRepo.countByPhaseIdAndParticipantId(11L, 3L)).thenReturn(1L, 2L);

        assertThat(composer.inputManifest(submission, false).get("automatic-submission")).contains("True");
        assertThat(composer.inputManifest(submission, false).get("automatic-submission")).contains("False");
    }

    @Test
    void automaticSubmission_notQueriedWithoutAutoMigration() {
        composer.inputManifest(submission, false);

        verifyNoInteractions(submissionRepo);
    }

    // ------------------------------------------------------------------
    // Scoring run manifest
    // ------------------------------------------------------------------

    @Test
    void scoringRunManifest_runsPhaseScoringProgramOnInputManifest() {
        Manifest manifest = composer.scoringRunManifest(submission);

        assertThat(manifest.entries().keySet())
                .containsExactly("program", "input", "stdout", "stderr", "private_output", "output");
        assertThat(manifest.get("program")).contains("https://store/GET/bundles/phase-1/scoring.zip");
        assertThat(manifest.get("input"))
                .contains("https://store/GET/competition/7/1/submissions/42/input.txt");
        assertThat(manifest.get("output"))
                .contains("https://store/PUT/competition/7/1/submissions/42/output_file.zip");
    }

    @Test
    void scoringRunManifest_noScoringProgram_isMissingPrecondition() {
        submission.getPhase().setScoringProgram(" ");

        assertThatThrownBy(() -> composer.scoringRunManifest(submission))
                .isInstanceOf(MissingPreconditionException.class)
                .hasMessage("Program is missing.");
        verify(signer, never()).read(" ");
    }

    private static java.util.Map.Entry<String, String> entry(String key, String value) {
        return java.util.Map.entry(key, value);
    }
}
