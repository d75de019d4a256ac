package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.Phase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PhaseRepository extends JpaRepository<Phase, Long> {

    List<Phase> findByCompetitionIdOrderByPhaseNumberAsc(Long competitionId);
}
