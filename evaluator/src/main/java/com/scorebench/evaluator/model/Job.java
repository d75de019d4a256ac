package com.scorebench.evaluator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracking record minted once per dispatch.
 *
 * Its only purpose is to let an asynchronous worker callback find the
 * submission it belongs to. A fresh Job is created for every phase, so the
 * prediction and scoring runs of one submission carry different job ids.
 *
 * DB table: jobs
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_type", nullable = false)
    private String taskType;

    // Opaque task arguments, JSON-encoded.
    @Column(name = "task_args", nullable = false, columnDefinition = "TEXT")
    private String taskArgs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state = JobState.CREATED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Job() {}   // required by JPA

    public Job(String taskType, String taskArgs) {
        this.taskType = taskType;
        this.taskArgs = taskArgs;
    }

    public UUID     getId()        { return id; }
    public String   getTaskType()  { return taskType; }
    public String   getTaskArgs()  { return taskArgs; }
    public JobState getState()     { return state; }
    public Instant  getCreatedAt() { return createdAt; }
    public Instant  getUpdatedAt() { return updatedAt; }

    public void setState(JobState state) { this.state = state; }
}
