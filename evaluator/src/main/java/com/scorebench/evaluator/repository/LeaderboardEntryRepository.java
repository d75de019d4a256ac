package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.LeaderboardEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LeaderboardEntryRepository extends JpaRepository<LeaderboardEntry, Long> {

    boolean existsBySubmissionId(Long submissionId);

    /** The participant's current entries in a phase. */
    List<LeaderboardEntry> findByPhaseIdAndSubmissionParticipantId(Long phaseId, Long participantId);
}
