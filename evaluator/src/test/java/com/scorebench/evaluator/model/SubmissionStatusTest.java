package com.scorebench.evaluator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionStatusTest {

    @ParameterizedTest
    @EnumSource(value = SubmissionStatus.class, names = {"FINISHED", "FAILED", "CANCELLED"})
    void terminalStatus_acceptsNoTransition(SubmissionStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (SubmissionStatus target : SubmissionStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(value = SubmissionStatus.class, names = {"SUBMITTED", "RUNNING"})
    void activeStatus_mayMoveAnywhere(SubmissionStatus active) {
        assertThat(active.isTerminal()).isFalse();
        for (SubmissionStatus target : SubmissionStatus.values()) {
            assertThat(active.canTransitionTo(target)).isTrue();
        }
    }

    @Test
    void fromCodename_isCaseInsensitive() {
        assertThat(SubmissionStatus.fromCodename("finished")).isEqualTo(SubmissionStatus.FINISHED);
        assertThat(SubmissionStatus.fromCodename("Running")).isEqualTo(SubmissionStatus.RUNNING);
    }

    @Test
    void fromCodename_unknown_throws() {
        assertThatThrownBy(() -> SubmissionStatus.fromCodename("paused"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
