package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * DB table: participants
 */
@Entity
@Table(name = "participants")
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    private String email;

    @Column(name = "email_on_submission_finished", nullable = false)
    private boolean emailOnSubmissionFinished;

    protected Participant() {}   // required by JPA

    public Participant(String username, String email) {
        this.username = username;
        this.email    = email;
    }

    public Long    getId()                          { return id; }
    public String  getUsername()                    { return username; }
    public String  getEmail()                       { return email; }
    public boolean isEmailOnSubmissionFinished()    { return emailOnSubmissionFinished; }

    public void setEmailOnSubmissionFinished(boolean v) { this.emailOnSubmissionFinished = v; }
}
