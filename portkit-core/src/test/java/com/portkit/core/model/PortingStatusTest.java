package com.portkit.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PortingStatus}.
 */
class PortingStatusTest {

    @Test
    void canTransitionTo_unstarted_onlyStartsGenerating() {
        assertThat(PortingStatus.UNSTARTED.canTransitionTo(PortingStatus.GENERATING)).isTrue();
        assertThat(PortingStatus.UNSTARTED.canTransitionTo(PortingStatus.VALIDATING)).isFalse();
        assertThat(PortingStatus.UNSTARTED.canTransitionTo(PortingStatus.VERIFIED)).isFalse();
    }

    @Test
    void canTransitionTo_validating_retriesOrDecides() {
        assertThat(PortingStatus.VALIDATING.canTransitionTo(PortingStatus.GENERATING)).isTrue();
        assertThat(PortingStatus.VALIDATING.canTransitionTo(PortingStatus.VERIFIED)).isTrue();
        assertThat(PortingStatus.VALIDATING.canTransitionTo(PortingStatus.FAILED)).isTrue();
    }

    @Test
    void canTransitionTo_generating_cannotSkipValidation() {
        assertThat(PortingStatus.GENERATING.canTransitionTo(PortingStatus.VERIFIED)).isFalse();
        assertThat(PortingStatus.GENERATING.canTransitionTo(PortingStatus.GENERATING)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = PortingStatus.class, names = {"VERIFIED", "FAILED"})
    void canTransitionTo_terminalStatus_allowsNothing(PortingStatus terminal) {
        for (PortingStatus next : PortingStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
        }
    }
}
