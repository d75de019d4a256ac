package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.ScoreDef;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionScore;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.LeaderboardEntryRepository;
import com.scorebench.evaluator.repository.ScoreDefRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import com.scorebench.evaluator.repository.SubmissionScoreRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-phase results table handed to scoring programs (scores.txt of the
 * input manifest, and coopetition_scores_phase_N.txt).
 *
 *   submission_pk,username,submission_number,<label of each score def...>
 *
 * Rows are the finished submissions of the phase, oldest first. Without
 * includeHidden only submissions on the leaderboard are listed.
 */
@Component
public class ResultsCsvExporter {

    private final SubmissionRepository       submissionRepository;
    private final ScoreDefRepository         scoreDefRepository;
    private final SubmissionScoreRepository  scoreRepository;
    private final LeaderboardEntryRepository leaderboardRepository;

    public ResultsCsvExporter(SubmissionRepository submissionRepository,
                              ScoreDefRepository scoreDefRepository,
                              SubmissionScoreRepository scoreRepository,
                              LeaderboardEntryRepository leaderboardRepository) {
        this.submissionRepository  = submissionRepository;
        this.scoreDefRepository    = scoreDefRepository;
        this.scoreRepository       = scoreRepository;
        this.leaderboardRepository = leaderboardRepository;
    }

    @Transactional(readOnly = true)
    public String export(Phase phase, boolean includeHidden) {
        List<ScoreDef> defs = scoreDefRepository.findByCompetitionIdOrderByOrderingAsc(phase.getCompetition().getId());

        List<Object> header = new ArrayList<>(List.of("submission_pk", "username", "submission_number"));
        defs.forEach(d -> header.add(d.getLabel()));

        CsvWriter csv = new CsvWriter().row(header);
        for (Submission s : submissionRepository.findByPhaseIdAndStatusOrderBySubmittedAtAsc(
                phase.getId(), SubmissionStatus.FINISHED)) {
            if (!includeHidden && !leaderboardRepository.existsBySubmissionId(s.getId())) {
                continue;
            }
            Map<Long, Double> values = scoreRepository.findBySubmissionId(s.getId()).stream()
                    .collect(Collectors.toMap(sc -> sc.getScoreDef().getId(), SubmissionScore::getValue, (a, b) -> b));

            List<Object> row = new ArrayList<>(List.of(s.getId(), s.getParticipant().getUsername(), s.getSubmissionNumber()));
            for (ScoreDef def : defs) {
                Double value = values.get(def.getId());
                row.add(value == null ? "" : value.toString());
            }
            csv.row(row);
        }
        return csv.toString();
    }
}
