package com.gridcast.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Terminal summary of an agent session, appended to the cross-session ledger.
 *
 * @param sessionId  session identifier
 * @param goal       the operator's request
 * @param status     termination state
 * @param finalPhase DONE or FAILED
 * @param reason     human-readable answer or failure reason
 * @param errorKind  terminal failure kind; {@code null} on success
 * @param iterations iterations consumed
 * @param forecast   last meaningful forecast, possibly a stale partial result; may be {@code null}
 * @param startedAt  session start
 * @param finishedAt session end
 * @param phases     phase records of the session, empty when loaded from a store that keeps only outcomes
 */
public record SessionSummary(
    @JsonProperty("session_id") String sessionId,
    String goal,
    SessionStatus status,
    @JsonProperty("final_phase") AgentPhase finalPhase,
    String reason,
    @JsonProperty("error_kind") ErrorKind errorKind,
    int iterations,
    ForecastResult forecast,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    List<PhaseRecord> phases
) implements Serializable {

    public SessionSummary {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public boolean succeeded() {
        return status == SessionStatus.SUCCEEDED;
    }

    /** Same summary without the phase trail. */
    public SessionSummary withoutPhases() {
        return new SessionSummary(sessionId, goal, status, finalPhase, reason, errorKind, iterations,
                forecast, startedAt, finishedAt, List.of());
    }
}
