package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.model.DownloadRecord;
import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.ReactionKind;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.DownloadRecordRepository;
import com.scorebench.evaluator.repository.PhaseRepository;
import com.scorebench.evaluator.repository.SubmissionReactionRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Cross-submission statistics for "coopetition" scoring programs, one zip:
 *
 *   coopetition_phase_N.txt         finished submissions of phase N with visibility,
 *                                   timing, download and like/dislike counts
 *   coopetition_scores_phase_N.txt  all finished scores of phase N, leaderboard or not
 *   coopetition_downloads.txt       every download event of the competition
 *   current_user.txt                username of the submitter being scored
 */
@Component
public class CoopetitionArchiveBuilder {

    static final List<String> SUBMISSION_COLUMNS = List.of(
            "participant__user__username", "pk", "when_made_public", "when_unmade_public",
            "started_at", "completed_at", "download_count", "submission_number",
            "like_count", "dislike_count");

    static final List<String> DOWNLOAD_COLUMNS = List.of(
            "submission_pk", "submission_owner", "downloaded_by", "time_of_download");

    private final PhaseRepository              phaseRepository;
    private final SubmissionRepository         submissionRepository;
    private final SubmissionReactionRepository reactionRepository;
    private final DownloadRecordRepository     downloadRepository;
    private final ResultsCsvExporter           resultsExporter;

    public CoopetitionArchiveBuilder(PhaseRepository phaseRepository,
                                     SubmissionRepository submissionRepository,
                                     SubmissionReactionRepository reactionRepository,
                                     DownloadRecordRepository downloadRepository,
                                     ResultsCsvExporter resultsExporter) {
        this.phaseRepository      = phaseRepository;
        this.submissionRepository = submissionRepository;
        this.reactionRepository   = reactionRepository;
        this.downloadRepository   = downloadRepository;
        this.resultsExporter      = resultsExporter;
    }

    @Transactional(readOnly = true)
    public byte[] build(Submission submission) {
        Long competitionId = submission.getPhase().getCompetition().getId();
        List<Phase> phases = phaseRepository.findByCompetitionIdOrderByPhaseNumberAsc(competitionId);

        ResultBundle bundle = new ResultBundle();
        for (Phase phase : phases) {
            bundle.add("coopetition_phase_" + phase.getPhaseNumber() + ".txt", submissionsCsv(phase));
        }
        for (Phase phase : phases) {
            bundle.add("coopetition_scores_phase_" + phase.getPhaseNumber() + ".txt",
                    resultsExporter.export(phase, true));
        }
        bundle.add("coopetition_downloads.txt", downloadsCsv(competitionId));
        bundle.add("current_user.txt", submission.getParticipant().getUsername());
        return bundle.toZip();
    }

    private String submissionsCsv(Phase phase) {
        CsvWriter csv = new CsvWriter().row(SUBMISSION_COLUMNS);
        for (Submission s : submissionRepository.findByPhaseIdAndStatusOrderBySubmittedAtAsc(
                phase.getId(), SubmissionStatus.FINISHED)) {
            csv.row(s.getParticipant().getUsername(),
                    s.getId(),
                    timestamp(s.getWhenMadePublic()),
                    timestamp(s.getWhenUnmadePublic()),
                    timestamp(s.getStartedAt()),
                    timestamp(s.getCompletedAt()),
                    s.getDownloadCount(),
                    s.getSubmissionNumber(),
                    reactionRepository.countBySubmissionIdAndKind(s.getId(), ReactionKind.LIKE),
                    reactionRepository.countBySubmissionIdAndKind(s.getId(), ReactionKind.DISLIKE));
        }
        return csv.toString();
    }

    private String downloadsCsv(Long competitionId) {
        CsvWriter csv = new CsvWriter().row(DOWNLOAD_COLUMNS);
        for (DownloadRecord d : downloadRepository.findBySubmissionPhaseCompetitionIdOrderByTimestampAsc(competitionId)) {
            csv.row(d.getSubmission().getId(),
                    d.getSubmission().getParticipant().getUsername(),
                    d.getDownloadedBy().getUsername(),
                    timestamp(d.getTimestamp()));
        }
        return csv.toString();
    }

    private static String timestamp(Instant t) {
        return t == null ? "" : t.toString();
    }
}
