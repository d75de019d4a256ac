package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + locking queries for the submissions table.
 */
public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    /**
     * Load a submission with SELECT ... FOR UPDATE.
     *
     * Two callbacks for the same submission serialize on this row lock, so
     * their read-modify-write of status cannot interleave. Must run inside a
     * @Transactional method; the lock is released on commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @EntityGraph(attributePaths = {"participant", "phase", "phase.competition"})
    @Query("SELECT s FROM Submission s WHERE s.id = :id")
    Optional<Submission> findByIdForUpdate(@Param("id") Long id);

    /**
     * Load a submission with participant, phase and competition fetched, so
     * it stays usable after the transaction that loaded it has ended.
     */
    @EntityGraph(attributePaths = {"participant", "phase", "phase.competition"})
    @Query("SELECT s FROM Submission s WHERE s.id = :id")
    Optional<Submission> findWithContextById(@Param("id") Long id);

    /** Finished submissions of a phase, oldest first (coopetition + results export). */
    List<Submission> findByPhaseIdAndStatusOrderBySubmittedAtAsc(Long phaseId, SubmissionStatus status);

    /** Every submission of a phase, oldest first (phase re-run). */
    List<Submission> findByPhaseIdOrderBySubmittedAtAsc(Long phaseId);

    long countByPhaseIdAndParticipantId(Long phaseId, Long participantId);

    @Query("SELECT COALESCE(MAX(s.submissionNumber), 0) FROM Submission s "
         + "WHERE s.phase.id = :phaseId AND s.participant.id = :participantId")
    int maxSubmissionNumber(@Param("phaseId") Long phaseId, @Param("participantId") Long participantId);
}
