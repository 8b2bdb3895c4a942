package com.gridcast.core.decisionlog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of one decision log record.
 *
 * @param sequence          ledger-wide, strictly increasing position
 * @param sessionId         owning session
 * @param timestamp         when the phase completed
 * @param phase             phase name, or {@code CORRECTION} for correction entries
 * @param rationale         phase rationale
 * @param invocations       digests of the capability calls made in the phase
 * @param correctsSequence  sequence of the entry this one corrects; {@code null} for regular entries
 */
public record LedgerEntry(
    long sequence,
    @JsonProperty("session_id") String sessionId,
    Instant timestamp,
    String phase,
    String rationale,
    List<Map<String, Object>> invocations,
    @JsonProperty("corrects_sequence") Long correctsSequence
) implements Serializable {

    public static final String CORRECTION_PHASE = "CORRECTION";

    public LedgerEntry {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
    }

    public boolean isCorrection() {
        return correctsSequence != null;
    }
}
