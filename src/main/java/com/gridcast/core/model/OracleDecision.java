package com.gridcast.core.model;

import java.util.List;

/**
 * Structured output of the reasoning oracle: either a termination response
 * ({@code done = true} with a summary) or a plan of capability invocations.
 */
public record OracleDecision(
    Boolean done,
    String summary,
    String rationale,
    List<PlannedInvocation> invocations
) {

    public static OracleDecision finish(String summary) {
        return new OracleDecision(true, summary, summary, List.of());
    }

    public static OracleDecision plan(String rationale, List<PlannedInvocation> invocations) {
        return new OracleDecision(false, null, rationale, invocations);
    }

    public boolean isDone() {
        return Boolean.TRUE.equals(done);
    }
}
