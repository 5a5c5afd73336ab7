package com.portkit.core.task;

import com.portkit.core.checkpoint.ResumeDecision;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.CheckpointRecord;
import com.portkit.core.model.ErrorKind;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.PortingStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResumePoint}.
 */
class ResumePointTest {

    private static final ErrorSummary ERROR = new ErrorSummary(ErrorKind.COMPILE_FAILURE, "[compile] boom");

    @Test
    void from_failedRecord_continuesAfterRecordedAttempts() {
        CheckpointRecord record = record(PortingStatus.FAILED, 4);

        ResumePoint point = ResumePoint.from(ResumeDecision.RETRY_FAILED, record);

        assertThat(point.completedAttempts()).isEqualTo(4);
        assertThat(point.carriedError()).isEqualTo(ERROR);
        assertThat(point.previousFingerprints()).containsKey(ArtifactRole.IMPLEMENTATION);
    }

    @Test
    void from_inFlightRecord_redoesRecordedAttempt() {
        ResumePoint point = ResumePoint.from(ResumeDecision.RESTART_IN_FLIGHT, record(PortingStatus.VALIDATING, 3));

        assertThat(point.completedAttempts()).isEqualTo(2);
        assertThat(point.previousFingerprints()).isEmpty();
    }

    @Test
    void from_exhaustedRecord_throwsException() {
        assertThatThrownBy(() -> ResumePoint.from(ResumeDecision.EXHAUSTED, record(PortingStatus.FAILED, 10)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static CheckpointRecord record(PortingStatus status, int attempts) {
        return new CheckpointRecord("u", List.of("u"), status, attempts,
            Map.of(ArtifactRole.IMPLEMENTATION, "abc"), ERROR, Instant.EPOCH);
    }
}
