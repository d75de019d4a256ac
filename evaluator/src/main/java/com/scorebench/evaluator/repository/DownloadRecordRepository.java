package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.DownloadRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DownloadRecordRepository extends JpaRepository<DownloadRecord, Long> {

    /** Every download across all phases of a competition, oldest first. */
    List<DownloadRecord> findBySubmissionPhaseCompetitionIdOrderByTimestampAsc(Long competitionId);
}
