package com.scorebench.evaluator.service;

import java.util.Arrays;
import java.util.Optional;

/** Status values a compute worker may report in a callback. */
public enum WorkerStatus {
    RUNNING("running"),
    FINISHED("finished"),
    FAILED("failed");

    private final String wireName;

    WorkerStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Empty for anything the protocol does not define. */
    public static Optional<WorkerStatus> parse(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value))
                .findFirst();
    }
}
