package com.gridcast.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.engine.AgentSession;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.SessionStatus;
import com.gridcast.core.model.SessionSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON response for session endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    String goal,
    String status,
    String phase,
    int iteration,
    String reason,
    @JsonProperty("error_kind") String errorKind,
    ForecastResult forecast,
    List<PhaseResponse> phases,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt
) {

    /**
     * One entry of the decision log.
     */
    public record PhaseResponse(
        String phase,
        int iteration,
        Instant timestamp,
        String rationale,
        @JsonProperty("next_phase") String nextPhase,
        @JsonProperty("error_kind") String errorKind,
        List<Map<String, Object>> invocations
    ) {
        static PhaseResponse from(PhaseRecord record) {
            return new PhaseResponse(
                    record.phase().name(),
                    record.iteration(),
                    record.timestamp(),
                    record.rationale(),
                    record.nextPhase() != null ? record.nextPhase().name() : null,
                    record.errorKind() != null ? record.errorKind().name() : null,
                    record.invocations().stream().map(DecisionLedger::digest).toList());
        }
    }

    static SessionResponse from(SessionSummary summary, boolean includePhases) {
        return new SessionResponse(
                summary.sessionId(),
                summary.goal(),
                summary.status().name(),
                summary.finalPhase().name(),
                summary.iterations(),
                summary.reason(),
                summary.errorKind() != null ? summary.errorKind().name() : null,
                summary.forecast(),
                includePhases ? summary.phases().stream().map(PhaseResponse::from).toList() : null,
                summary.startedAt(),
                summary.finishedAt());
    }

    static SessionResponse from(AgentSession session, boolean includePhases) {
        return new SessionResponse(
                session.id(),
                session.goal(),
                session.status().name(),
                session.phase().name(),
                session.iteration(),
                session.reason(),
                session.errorKind() != null ? session.errorKind().name() : null,
                session.lastForecast(),
                includePhases ? session.decisionLog().records().stream().map(PhaseResponse::from).toList() : null,
                session.startedAt(),
                null);
    }

    static SessionResponse pending(String sessionId, String goal) {
        return new SessionResponse(sessionId, goal, SessionStatus.RUNNING.name(), "PERCEIVE", 0,
                null, null, null, null, null, null);
    }
}
