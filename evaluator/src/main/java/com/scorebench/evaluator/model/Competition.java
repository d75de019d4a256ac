package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * The slice of a competition the evaluation pipeline reads.
 * Competitions are authored elsewhere; this service never writes them.
 *
 * DB table: competitions
 */
@Entity
@Table(name = "competitions")
public class Competition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    // Isolated broker namespace for this competition's compute workers.
    // Null means runs go to the shared default queue.
    @Column(name = "queue_vhost")
    private String queueVhost;

    @Column(name = "force_submission_to_leaderboard", nullable = false)
    private boolean forceSubmissionToLeaderboard;

    protected Competition() {}   // required by JPA

    public Competition(String title) {
        this.title = title;
    }

    public Long    getId()                             { return id; }
    public String  getTitle()                          { return title; }
    public String  getQueueVhost()                     { return queueVhost; }
    public boolean isForceSubmissionToLeaderboard()    { return forceSubmissionToLeaderboard; }

    public void setQueueVhost(String queueVhost)                     { this.queueVhost = queueVhost; }
    public void setForceSubmissionToLeaderboard(boolean v)           { this.forceSubmissionToLeaderboard = v; }
}
