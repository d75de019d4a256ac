package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.SubmissionScore;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SubmissionScoreRepository extends JpaRepository<SubmissionScore, Long> {

    Optional<SubmissionScore> findBySubmissionIdAndScoreDefId(Long submissionId, Long scoreDefId);

    /** Every recorded value of one score definition across a phase. */
    List<SubmissionScore> findBySubmissionPhaseIdAndScoreDefId(Long phaseId, Long scoreDefId);

    List<SubmissionScore> findBySubmissionId(Long submissionId);
}
