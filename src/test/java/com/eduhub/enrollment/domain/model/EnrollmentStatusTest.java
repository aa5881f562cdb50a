package com.eduhub.enrollment.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EnrollmentStatus Transition Tests")
class EnrollmentStatusTest {

    @Test
    @DisplayName("PENDING can become ENROLLED, WAITLISTED or DENIED")
    void pending_Transitions() {
        assertThat(EnrollmentStatus.PENDING.canTransitionTo(EnrollmentStatus.ENROLLED)).isTrue();
        assertThat(EnrollmentStatus.PENDING.canTransitionTo(EnrollmentStatus.WAITLISTED)).isTrue();
        assertThat(EnrollmentStatus.PENDING.canTransitionTo(EnrollmentStatus.DENIED)).isTrue();
        assertThat(EnrollmentStatus.PENDING.canTransitionTo(EnrollmentStatus.DROPPED)).isFalse();
    }

    @Test
    @DisplayName("ENROLLED can only be dropped")
    void enrolled_Transitions() {
        assertThat(EnrollmentStatus.ENROLLED.canTransitionTo(EnrollmentStatus.DROPPED)).isTrue();
        assertThat(EnrollmentStatus.ENROLLED.canTransitionTo(EnrollmentStatus.WAITLISTED)).isFalse();
        assertThat(EnrollmentStatus.ENROLLED.canTransitionTo(EnrollmentStatus.ENROLLED)).isFalse();
    }

    @Test
    @DisplayName("WAITLISTED can be enrolled from an offer or dropped")
    void waitlisted_Transitions() {
        assertThat(EnrollmentStatus.WAITLISTED.canTransitionTo(EnrollmentStatus.ENROLLED)).isTrue();
        assertThat(EnrollmentStatus.WAITLISTED.canTransitionTo(EnrollmentStatus.DROPPED)).isTrue();
        assertThat(EnrollmentStatus.WAITLISTED.canTransitionTo(EnrollmentStatus.DENIED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = EnrollmentStatus.class, names = {"DROPPED", "DENIED"})
    @DisplayName("Terminal states have no outgoing transitions")
    void terminalStates_NoTransitions(EnrollmentStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (EnrollmentStatus target : EnrollmentStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }
}
