package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.ReactionKind;
import com.scorebench.evaluator.model.SubmissionReaction;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubmissionReactionRepository extends JpaRepository<SubmissionReaction, Long> {

    long countBySubmissionIdAndKind(Long submissionId, ReactionKind kind);
}
