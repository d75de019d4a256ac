package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.ScoreDef;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ScoreDefRepository extends JpaRepository<ScoreDef, Long> {

    /** Exact key match, scoped to one competition. */
    Optional<ScoreDef> findByCompetitionIdAndKey(Long competitionId, String key);

    /** The competition's default score definition: lowest ordering wins. */
    Optional<ScoreDef> findFirstByCompetitionIdOrderByOrderingAsc(Long competitionId);

    List<ScoreDef> findByCompetitionIdOrderByOrderingAsc(Long competitionId);
}
