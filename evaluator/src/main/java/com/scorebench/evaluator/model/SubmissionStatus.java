package com.scorebench.evaluator.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a competition submission.
 *
 * Transitions:
 *   SUBMITTED → RUNNING   (worker reported it picked the run up)
 *   SUBMITTED/RUNNING → FINISHED | FAILED | CANCELLED
 *   SUBMITTED → SUBMITTED (a scoring-only run re-affirms on dispatch)
 *
 * FINISHED, FAILED and CANCELLED are terminal: once a submission reaches one
 * of them no callback, retry or admin action can move it again.
 */
public enum SubmissionStatus {
    SUBMITTED("submitted"),
    RUNNING("running"),
    FINISHED("finished"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private static final Set<SubmissionStatus> TERMINAL = EnumSet.of(FINISHED, FAILED, CANCELLED);

    private final String codename;

    SubmissionStatus(String codename) {
        this.codename = codename;
    }

    public String codename() {
        return codename;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Source states from which a submission may move into this state. */
    public Set<SubmissionStatus> allowedSources() {
        // Every target accepts exactly the non-terminal states.
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    public boolean canTransitionTo(SubmissionStatus target) {
        return target.allowedSources().contains(this);
    }

    public static SubmissionStatus fromCodename(String codename) {
        return Arrays.stream(values())
                .filter(s -> s.codename.equalsIgnoreCase(codename))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown submission status: " + codename));
    }
}
