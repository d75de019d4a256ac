package com.scorebench.evaluator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One participant submission to a competition phase: the unit of work of the
 * evaluation pipeline.
 *
 * A submission is created by the upload flow in SUBMITTED with no execution key.
 * Afterwards its status only changes through SubmissionStateMachine, and
 * multi-field updates (execution key + artifact paths) go through
 * SubmissionStateMachine.update() under a row lock.
 *
 * Artifact columns hold storage paths, not URLs. URLs are signed per dispatch.
 *
 * DB table: submissions
 */
@Entity
@Table(name = "submissions")
public class Submission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "participant_id", nullable = false)
    private Participant participant;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "phase_id", nullable = false)
    private Phase phase;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubmissionStatus status = SubmissionStatus.SUBMITTED;

    @Convert(converter = ExecutionKeyConverter.class)
    @Column(name = "execution_key", nullable = false, columnDefinition = "TEXT")
    private ExecutionKey executionKey = ExecutionKey.NOT_STARTED;

    // Capability token handed to the worker; every callback must present it.
    @Column(nullable = false, updatable = false)
    private String secret = UUID.randomUUID().toString();

    // Per participant per phase, strictly increasing.
    @Column(name = "submission_number", nullable = false)
    private int submissionNumber;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt = Instant.now();

    // Overrides the platform default worker image when set.
    @Column(name = "docker_image")
    private String dockerImage;

    // Worker traceback of a failed run.
    @Column(name = "exception_details", columnDefinition = "TEXT")
    private String exceptionDetails;

    // The participant's upload: a program (predict + score) or results (score only).
    @Column(name = "file_ref")
    private String fileRef;

    // Scoring-phase artifacts.
    @Column(name = "run_file")              private String runFile;
    @Column(name = "input_file")            private String inputFile;
    @Column(name = "stdout_file")           private String stdoutFile;
    @Column(name = "stderr_file")           private String stderrFile;
    @Column(name = "output_file")           private String outputFile;
    @Column(name = "private_output_file")   private String privateOutputFile;
    @Column(name = "detailed_results_file") private String detailedResultsFile;
    @Column(name = "history_file")          private String historyFile;
    @Column(name = "scores_file")           private String scoresFile;
    @Column(name = "coopetition_file")      private String coopetitionFile;

    // Prediction-phase artifacts.
    @Column(name = "prediction_run_file")    private String predictionRunFile;
    @Column(name = "prediction_stdout_file") private String predictionStdoutFile;
    @Column(name = "prediction_stderr_file") private String predictionStderrFile;
    @Column(name = "prediction_output_file") private String predictionOutputFile;

    // Coopetition statistics, maintained by the site.
    @Column(name = "when_made_public")   private Instant whenMadePublic;
    @Column(name = "when_unmade_public") private Instant whenUnmadePublic;
    @Column(name = "started_at")         private Instant startedAt;
    @Column(name = "completed_at")       private Instant completedAt;
    @Column(name = "download_count", nullable = false) private int downloadCount;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Submission() {}   // required by JPA

    public Submission(Participant participant, Phase phase, int submissionNumber, String fileRef) {
        this.participant      = participant;
        this.phase            = phase;
        this.submissionNumber = submissionNumber;
        this.fileRef          = fileRef;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long             getId()               { return id; }
    public Participant      getParticipant()      { return participant; }
    public Phase            getPhase()            { return phase; }
    public SubmissionStatus getStatus()           { return status; }
    public ExecutionKey     getExecutionKey()     { return executionKey; }
    public String           getSecret()           { return secret; }
    public int              getSubmissionNumber() { return submissionNumber; }
    public Instant          getSubmittedAt()      { return submittedAt; }
    public String           getDockerImage()      { return dockerImage; }
    public String           getExceptionDetails() { return exceptionDetails; }
    public String           getFileRef()          { return fileRef; }

    /** Only SubmissionStateMachine calls this. */
    public void setStatus(SubmissionStatus status)          { this.status = status; }
    public void setExecutionKey(ExecutionKey executionKey)  { this.executionKey = executionKey; }
    public void setDockerImage(String dockerImage)          { this.dockerImage = dockerImage; }
    public void setExceptionDetails(String v)               { this.exceptionDetails = v; }

    public String getRunFile()                  { return runFile; }
    public String getInputFile()                { return inputFile; }
    public String getStdoutFile()               { return stdoutFile; }
    public String getStderrFile()               { return stderrFile; }
    public String getOutputFile()               { return outputFile; }
    public String getPrivateOutputFile()        { return privateOutputFile; }
    public String getDetailedResultsFile()      { return detailedResultsFile; }
    public String getHistoryFile()              { return historyFile; }
    public String getScoresFile()               { return scoresFile; }
    public String getCoopetitionFile()          { return coopetitionFile; }
    public String getPredictionRunFile()        { return predictionRunFile; }
    public String getPredictionStdoutFile()     { return predictionStdoutFile; }
    public String getPredictionStderrFile()     { return predictionStderrFile; }
    public String getPredictionOutputFile()     { return predictionOutputFile; }

    public void setRunFile(String v)                { this.runFile = v; }
    public void setInputFile(String v)              { this.inputFile = v; }
    public void setStdoutFile(String v)             { this.stdoutFile = v; }
    public void setStderrFile(String v)             { this.stderrFile = v; }
    public void setOutputFile(String v)             { this.outputFile = v; }
    public void setPrivateOutputFile(String v)      { this.privateOutputFile = v; }
    public void setDetailedResultsFile(String v)    { this.detailedResultsFile = v; }
    public void setHistoryFile(String v)            { this.historyFile = v; }
    public void setScoresFile(String v)             { this.scoresFile = v; }
    public void setCoopetitionFile(String v)        { this.coopetitionFile = v; }
    public void setPredictionRunFile(String v)      { this.predictionRunFile = v; }
    public void setPredictionStdoutFile(String v)   { this.predictionStdoutFile = v; }
    public void setPredictionStderrFile(String v)   { this.predictionStderrFile = v; }
    public void setPredictionOutputFile(String v)   { this.predictionOutputFile = v; }

    public Instant getWhenMadePublic()      { return whenMadePublic; }
    public Instant getWhenUnmadePublic()    { return whenUnmadePublic; }
    public Instant getStartedAt()           { return startedAt; }
    public Instant getCompletedAt()         { return completedAt; }
    public int     getDownloadCount()       { return downloadCount; }

    public void setWhenMadePublic(Instant t)    { this.whenMadePublic = t; }
    public void setWhenUnmadePublic(Instant t)  { this.whenUnmadePublic = t; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setCompletedAt(Instant t)       { this.completedAt = t; }
    public void setDownloadCount(int v)         { this.downloadCount = v; }
}
