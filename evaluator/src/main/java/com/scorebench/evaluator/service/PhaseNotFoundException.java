package com.scorebench.evaluator.service;

public class PhaseNotFoundException extends RuntimeException {

    public PhaseNotFoundException(Long phaseId) {
        super("Phase not found: " + phaseId);
    }
}
