package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * One phase of a competition: the scoring program, the data it runs on, and
 * the leaderboard policy applied to results.
 *
 * DB table: phases
 */
@Entity
@Table(name = "phases")
public class Phase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "competition_id", nullable = false)
    private Competition competition;

    @Column(name = "phase_number", nullable = false)
    private int phaseNumber;

    // Soft execution budget in seconds. Null or <= 0 means "use the default".
    @Column(name = "execution_time_limit")
    private Integer executionTimeLimit;

    @Column(name = "is_blind", nullable = false)
    private boolean blind;

    @Column(name = "force_best_submission_to_leaderboard", nullable = false)
    private boolean forceBestSubmissionToLeaderboard;

    @Column(name = "auto_migration", nullable = false)
    private boolean autoMigration;

    // Participants upload results directly; no prediction step.
    @Column(name = "is_scoring_only", nullable = false)
    private boolean scoringOnly;

    // Storage paths of organizer-provided bundles.
    @Column(name = "input_data")
    private String inputData;

    @Column(name = "reference_data")
    private String referenceData;

    @Column(name = "scoring_program")
    private String scoringProgram;

    protected Phase() {}   // required by JPA

    public Phase(Competition competition, int phaseNumber) {
        this.competition = competition;
        this.phaseNumber = phaseNumber;
    }

    public Long        getId()                                  { return id; }
    public Competition getCompetition()                         { return competition; }
    public int         getPhaseNumber()                         { return phaseNumber; }
    public Integer     getExecutionTimeLimit()                  { return executionTimeLimit; }
    public boolean     isBlind()                                { return blind; }
    public boolean     isForceBestSubmissionToLeaderboard()     { return forceBestSubmissionToLeaderboard; }
    public boolean     isAutoMigration()                        { return autoMigration; }
    public boolean     isScoringOnly()                          { return scoringOnly; }
    public String      getInputData()                           { return inputData; }
    public String      getReferenceData()                       { return referenceData; }
    public String      getScoringProgram()                      { return scoringProgram; }

    public void setExecutionTimeLimit(Integer v)                { this.executionTimeLimit = v; }
    public void setBlind(boolean v)                             { this.blind = v; }
    public void setForceBestSubmissionToLeaderboard(boolean v)  { this.forceBestSubmissionToLeaderboard = v; }
    public void setAutoMigration(boolean v)                     { this.autoMigration = v; }
    public void setScoringOnly(boolean v)                       { this.scoringOnly = v; }
    public void setInputData(String v)                          { this.inputData = v; }
    public void setReferenceData(String v)                      { this.referenceData = v; }
    public void setScoringProgram(String v)                     { this.scoringProgram = v; }
}
