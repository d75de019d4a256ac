package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * Measured value of one score definition for one submission.
 * At most one row per (submission, score def).
 *
 * DB table: submission_scores
 */
@Entity
@Table(name = "submission_scores",
       uniqueConstraints = @UniqueConstraint(columnNames = {"submission_id", "score_def_id"}))
public class SubmissionScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "submission_id", nullable = false)
    private Submission submission;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "score_def_id", nullable = false)
    private ScoreDef scoreDef;

    @Column(nullable = false)
    private double value;

    protected SubmissionScore() {}   // required by JPA

    public SubmissionScore(Submission submission, ScoreDef scoreDef, double value) {
        this.submission = submission;
        this.scoreDef   = scoreDef;
        this.value      = value;
    }

    public Long       getId()         { return id; }
    public Submission getSubmission() { return submission; }
    public ScoreDef   getScoreDef()   { return scoreDef; }
    public double     getValue()      { return value; }

    public void setValue(double value) { this.value = value; }
}
