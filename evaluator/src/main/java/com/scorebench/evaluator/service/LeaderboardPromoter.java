package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Competition;
import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.ScoreDef;
import com.scorebench.evaluator.model.SortOrder;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionScore;
import com.scorebench.evaluator.repository.ScoreDefRepository;
import com.scorebench.evaluator.repository.SubmissionScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a freshly finished submission goes on the leaderboard.
 *
 * Three rules, checked in this order; more than one may fire, promotion is idempotent:
 *   1. blind phase, not best-only                     → promote
 *   2. competition forces every submission, phase not best-only → promote
 *   3. phase best-only → promote iff this submission's default score is at
 *      least as good as every score recorded in the phase (ties promote)
 */
@Service
public class LeaderboardPromoter {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardPromoter.class);

    private final LeaderboardService        leaderboard;
    private final ScoreDefRepository        scoreDefRepo;
    private final SubmissionScoreRepository scoreRepo;

    public LeaderboardPromoter(LeaderboardService leaderboard,
                               ScoreDefRepository scoreDefRepo,
                               SubmissionScoreRepository scoreRepo) {
        this.leaderboard  = leaderboard;
        this.scoreDefRepo = scoreDefRepo;
        this.scoreRepo    = scoreRepo;
    }

    /**
     * @param submission loaded with participant, phase and competition
     * @return true if the submission is on the leaderboard after this call
     *         because of one of the rules
     */
    public boolean evaluate(Submission submission) {
        Phase phase = submission.getPhase();
        Competition competition = phase.getCompetition();
        boolean bestOnly = phase.isForceBestSubmissionToLeaderboard();
        boolean promoted = false;

        if (phase.isBlind() && !bestOnly) {
            leaderboard.promote(submission);
            promoted = true;
        }
        if (competition.isForceSubmissionToLeaderboard() && !bestOnly) {
            leaderboard.promote(submission);
            promoted = true;
        }
        if (bestOnly && isBestInPhase(submission)) {
            leaderboard.promote(submission);
            promoted = true;
        }
        return promoted;
    }

    private boolean isBestInPhase(Submission submission) {
        Optional<ScoreDef> defaultDef = scoreDefRepo.findFirstByCompetitionIdOrderByOrderingAsc(
                submission.getPhase().getCompetition().getId());
        if (defaultDef.isEmpty()) {
            log.warn("Phase {} keeps only the best submission but its competition has no score definition",
                    submission.getPhase().getId());
            return false;
        }
        ScoreDef def = defaultDef.get();
        Optional<SubmissionScore> own = scoreRepo.findBySubmissionIdAndScoreDefId(submission.getId(), def.getId());
        if (own.isEmpty()) {
            log.info("Submission {} has no '{}' score; not a best-submission candidate", submission.getId(), def.getKey());
            return false;
        }
        List<Double> phaseValues = scoreRepo.findBySubmissionPhaseIdAndScoreDefId(submission.getPhase().getId(), def.getId())
                .stream().map(SubmissionScore::getValue).toList();

        boolean best = isBest(own.get().getValue(), phaseValues, def.getSorting());
        log.debug("Submission {} score {} best in phase ({}): {}",
                submission.getId(), own.get().getValue(), def.getSorting(), best);
        return best;
    }

    /**
     * Ascending: lower is better, best iff value ≤ min. Descending: higher is
     * better, best iff value ≥ max. An empty phase makes any value the best.
     */
    static boolean isBest(double value, Collection<Double> phaseValues, SortOrder sorting) {
        if (sorting == SortOrder.ASC) {
            double min = phaseValues.stream().mapToDouble(Double::doubleValue).min().orElse(value);
            return value <= min;
        }
        double max = phaseValues.stream().mapToDouble(Double::doubleValue).max().orElse(value);
        return value >= max;
    }
}
