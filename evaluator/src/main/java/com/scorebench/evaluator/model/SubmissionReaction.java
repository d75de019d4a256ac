package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * A like or dislike of a public submission. Written by the site, read here for
 * the coopetition statistics.
 *
 * DB table: submission_reactions
 */
@Entity
@Table(name = "submission_reactions")
public class SubmissionReaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "submission_id", nullable = false)
    private Submission submission;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "participant_id", nullable = false)
    private Participant participant;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReactionKind kind;

    protected SubmissionReaction() {}   // required by JPA

    public SubmissionReaction(Submission submission, Participant participant, ReactionKind kind) {
        this.submission  = submission;
        this.participant = participant;
        this.kind        = kind;
    }

    public Long         getId()          { return id; }
    public Submission   getSubmission()  { return submission; }
    public Participant  getParticipant() { return participant; }
    public ReactionKind getKind()        { return kind; }
}
