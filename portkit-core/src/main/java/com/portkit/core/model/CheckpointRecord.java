package com.portkit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable state of one processing unit.
 *
 * <p>Stored as one JSON document per unit; the field names below are the
 * on-disk format and may be edited by hand.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * {
 *   "unitId" : "ZopfliGetLengthSymbol",
 *   "symbols" : [ "ZopfliGetLengthSymbol" ],
 *   "status" : "FAILED",
 *   "attemptCount" : 3,
 *   "fingerprints" : { "BINDINGS" : "9f2c...", "IMPLEMENTATION" : "01ab..." },
 *   "lastError" : { "kind" : "COMPILE_FAILURE", "message" : "[compile] error[E0308]: ..." },
 *   "timestamp" : "2026-10-17T09:12:44.120Z"
 * }
 * }</pre>
 *
 * @param unitId processing unit id
 * @param symbols member symbol names
 * @param status last persisted status
 * @param attemptCount generation attempts started so far
 * @param fingerprints SHA-256 of each artifact of the latest artifact set
 * @param lastError last error, or null
 * @param timestamp time of the last update
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointRecord(
    @JsonProperty("unitId") String unitId,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("status") PortingStatus status,
    @JsonProperty("attemptCount") int attemptCount,
    @JsonProperty("fingerprints") Map<ArtifactRole, String> fingerprints,
    @JsonProperty("lastError") ErrorSummary lastError,
    @JsonProperty("timestamp") Instant timestamp
) {
    /**
     * Compact constructor with validation.
     */
    public CheckpointRecord {
        Objects.requireNonNull(unitId, "unitId must not be null");
        if (status == null) {
            status = PortingStatus.UNSTARTED;
        }
        if (attemptCount < 0) {
            attemptCount = 0;
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        fingerprints = fingerprints == null ? Map.of() : Map.copyOf(fingerprints);
    }
}
