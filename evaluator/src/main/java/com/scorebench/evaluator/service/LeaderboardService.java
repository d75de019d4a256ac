package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.LeaderboardEntry;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.repository.LeaderboardEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Leaderboard membership. A participant has at most one entry per phase;
 * promoting a newer submission replaces the participant's previous entry.
 */
@Service
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private final LeaderboardEntryRepository entryRepo;

    public LeaderboardService(LeaderboardEntryRepository entryRepo) {
        this.entryRepo = entryRepo;
    }

    /**
     * Put a submission on its phase leaderboard. Idempotent.
     *
     * @return true if an entry was created, false if it was already there
     */
    @Transactional
    public boolean promote(Submission submission) {
        if (entryRepo.existsBySubmissionId(submission.getId())) {
            return false;
        }
        List<LeaderboardEntry> previous = entryRepo.findByPhaseIdAndSubmissionParticipantId(
                submission.getPhase().getId(), submission.getParticipant().getId());
        if (!previous.isEmpty()) {
            entryRepo.deleteAll(previous);
            entryRepo.flush();
        }
        entryRepo.save(new LeaderboardEntry(submission.getPhase(), submission));
        log.info("Submission {} added to the leaderboard of phase {}",
                submission.getId(), submission.getPhase().getPhaseNumber());
        return true;
    }
}
