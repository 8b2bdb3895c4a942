package com.gridcast.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable entry appended to the decision log for every executed phase.
 *
 * @param phase       the phase that ran
 * @param iteration   value of the session's iteration counter while the phase ran
 * @param timestamp   when the phase completed
 * @param rationale   explanation from the oracle, the freshness gate or the orchestrator
 * @param invocations capability calls performed during the phase
 * @param nextPhase   phase the session moved to
 * @param errorKind   failure classification, or {@code null} if the phase completed normally
 */
public record PhaseRecord(
    AgentPhase phase,
    int iteration,
    Instant timestamp,
    String rationale,
    List<CapabilityInvocation> invocations,
    AgentPhase nextPhase,
    ErrorKind errorKind
) implements Serializable {

    public PhaseRecord {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        rationale = rationale == null ? "" : rationale;
    }
}
