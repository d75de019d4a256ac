package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * Worker-reported run metadata (hostname, durations, memory usage, ...),
 * one record for the prediction run and one for the scoring run.
 *
 * DB table: submission_metadata
 */
@Entity
@Table(name = "submission_metadata",
       uniqueConstraints = @UniqueConstraint(columnNames = {"submission_id", "is_predict"}))
public class SubmissionMetadata {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "submission_id", nullable = false)
    private Submission submission;

    @Column(name = "is_predict", nullable = false)
    private boolean predict;

    @Column(name = "is_scoring", nullable = false)
    private boolean scoring;

    // Merged key/value pairs, JSON object.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String attributes = "{}";

    protected SubmissionMetadata() {}   // required by JPA

    public SubmissionMetadata(Submission submission, boolean predict) {
        this.submission = submission;
        this.predict    = predict;
        this.scoring    = !predict;
    }

    public Long       getId()         { return id; }
    public Submission getSubmission() { return submission; }
    public boolean    isPredict()     { return predict; }
    public boolean    isScoring()     { return scoring; }
    public String     getAttributes() { return attributes; }

    public void setAttributes(String attributes) { this.attributes = attributes; }
}
