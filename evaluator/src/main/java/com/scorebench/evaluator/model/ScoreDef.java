package com.scorebench.evaluator.model;

import jakarta.persistence.*;

/**
 * A named leaderboard metric of a competition.
 *
 * The key is what the scoring program writes in scores.txt. The definition
 * with the lowest ordering is the competition's default score.
 *
 * DB table: score_defs
 */
@Entity
@Table(name = "score_defs")
public class ScoreDef {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "competition_id", nullable = false)
    private Competition competition;

    @Column(name = "score_key", nullable = false)
    private String key;

    @Column(nullable = false)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SortOrder sorting = SortOrder.DESC;

    @Column(nullable = false)
    private int ordering;

    protected ScoreDef() {}   // required by JPA

    public ScoreDef(Competition competition, String key, String label, SortOrder sorting, int ordering) {
        this.competition = competition;
        this.key         = key;
        this.label       = label;
        this.sorting     = sorting;
        this.ordering    = ordering;
    }

    public Long        getId()          { return id; }
    public Competition getCompetition() { return competition; }
    public String      getKey()         { return key; }
    public String      getLabel()       { return label; }
    public SortOrder   getSorting()     { return sorting; }
    public int         getOrdering()    { return ordering; }
}
