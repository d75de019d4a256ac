package com.scorebench.evaluator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One download of a public submission by another participant.
 *
 * DB table: download_records
 */
@Entity
@Table(name = "download_records")
public class DownloadRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "submission_id", nullable = false)
    private Submission submission;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "downloaded_by_id", nullable = false)
    private Participant downloadedBy;

    @Column(nullable = false)
    private Instant timestamp = Instant.now();

    protected DownloadRecord() {}   // required by JPA

    public DownloadRecord(Submission submission, Participant downloadedBy, Instant timestamp) {
        this.submission   = submission;
        this.downloadedBy = downloadedBy;
        this.timestamp    = timestamp;
    }

    public Long        getId()           { return id; }
    public Submission  getSubmission()   { return submission; }
    public Participant getDownloadedBy() { return downloadedBy; }
    public Instant     getTimestamp()    { return timestamp; }
}
