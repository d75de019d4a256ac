package com.scorebench.evaluator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A submission shown on its phase's leaderboard.
 *
 * DB table: leaderboard_entries
 */
@Entity
@Table(name = "leaderboard_entries")
public class LeaderboardEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "phase_id", nullable = false)
    private Phase phase;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "submission_id", nullable = false, unique = true)
    private Submission submission;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected LeaderboardEntry() {}   // required by JPA

    public LeaderboardEntry(Phase phase, Submission submission) {
        this.phase      = phase;
        this.submission = submission;
    }

    public Long       getId()         { return id; }
    public Phase      getPhase()      { return phase; }
    public Submission getSubmission() { return submission; }
    public Instant    getCreatedAt()  { return createdAt; }
}
