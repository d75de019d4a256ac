package com.scorebench.evaluator.model;

public enum ReactionKind {
    LIKE,
    DISLIKE
}
