package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.SubmissionMetadata;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SubmissionMetadataRepository extends JpaRepository<SubmissionMetadata, Long> {

    Optional<SubmissionMetadata> findBySubmissionIdAndPredict(Long submissionId, boolean predict);
}
