package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.repository.SubmissionRepository;
import com.scorebench.evaluator.storage.SignedUrlService;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Builds the manifests a compute worker and a scoring program read.
 *
 * Every file reference becomes a signed URL; the artifact paths must already
 * be set on the submission passed in. Nothing is written to storage here.
 *
 * Run manifest for the prediction phase:
 *   program: <GET url of the participant's bundle>
 *   input:   <GET url of the phase input data>        (optional)
 *   stdout:  <PUT url>
 *   stderr:  <PUT url>
 *
 * Run manifest for the scoring phase adds private_output and output, and its
 * input is the input manifest (input.txt) built by {@link #inputManifest}.
 */
@Component
public class BundleComposer {

    static final String PROGRAM_MISSING = "Program is missing.";
    static final String RESULTS_MISSING = "Results are missing.";

    private final SignedUrlService     signer;
    private final SubmissionRepository submissionRepository;

    public BundleComposer(SignedUrlService signer, SubmissionRepository submissionRepository) {
        this.signer               = signer;
        this.submissionRepository = submissionRepository;
    }

    public Manifest predictRunManifest(Submission submission) {
        Manifest manifest = new Manifest()
                .put("program", required(submission.getFileRef(), PROGRAM_MISSING));

        String input = signer.read(submission.getPhase().getInputData());
        if (!input.isEmpty()) {
            manifest.put("input", input);
        }
        return manifest
                .put("stdout", signer.write(submission.getPredictionStdoutFile()))
                .put("stderr", signer.write(submission.getPredictionStderrFile()));
    }

    /**
     * The scoring program's view of the submission.
     *
     * @param hasGeneratedPredictions true when a prediction run produced the
     *                                results; otherwise the participant uploaded them
     */
    public Manifest inputManifest(Submission submission, boolean hasGeneratedPredictions) {
        Phase phase = submission.getPhase();
        Manifest manifest = new Manifest();

        String ref = signer.read(phase.getReferenceData());
        if (!ref.isEmpty()) {
            manifest.put("ref", ref);
        }
        String results = hasGeneratedPredictions ? submission.getPredictionOutputFile() : submission.getFileRef();
        manifest.put("res", required(results, RESULTS_MISSING));

        return manifest
                .put("history",                signer.read(submission.getHistoryFile()))
                .put("scores",                 signer.read(submission.getScoresFile()))
                .put("coopetition",            signer.read(submission.getCoopetitionFile()))
                .put("submitted-by",           submission.getParticipant().getUsername())
                .put("submitted-at",           submittedAt(submission))
                .put("competition-submission", submission.getSubmissionNumber())
                .put("competition-phase",      phase.getPhaseNumber())
                .put("automatic-submission",   isAutomaticSubmission(submission) ? "True" : "False");
    }

    public Manifest scoringRunManifest(Submission submission) {
        return new Manifest()
                .put("program",        required(submission.getPhase().getScoringProgram(), PROGRAM_MISSING))
                .put("input",          signer.read(submission.getInputFile()))
                .put("stdout",         signer.write(submission.getStdoutFile()))
                .put("stderr",         signer.write(submission.getStderrFile()))
                .put("private_output", signer.write(submission.getPrivateOutputFile()))
                .put("output",         signer.write(submission.getOutputFile()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String required(String path, String message) {
        if (path == null || path.isBlank()) {
            throw new MissingPreconditionException(message);
        }
        String url = signer.read(path);
        if (url.isEmpty()) {
            throw new MissingPreconditionException(message);
        }
        return url;
    }

    // First submission of the participant in a phase that auto-migrates.
    private boolean isAutomaticSubmission(Submission submission) {
        Phase phase = submission.getPhase();
        if (!phase.isAutoMigration()) {
            return false;
        }
        return submissionRepository.countByPhaseIdAndParticipantId(
                phase.getId(), submission.getParticipant().getId()) == 1;
    }

    static String submittedAt(Submission submission) {
        return LocalDateTime.ofInstant(submission.getSubmittedAt(), ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
