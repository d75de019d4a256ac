package com.scorebench.evaluator.model;

/**
 * Ranking direction of a scoring definition.
 * ASC means lower is better, DESC means higher is better.
 */
public enum SortOrder {
    ASC,
    DESC
}
