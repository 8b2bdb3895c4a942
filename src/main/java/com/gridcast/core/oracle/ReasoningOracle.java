package com.gridcast.core.oracle;

import com.gridcast.core.model.OracleDecision;
import com.gridcast.core.model.SituationContext;

/**
 * Chooses the next action for a session. Implementations are treated as untrusted:
 * every returned plan is validated before anything is executed.
 */
public interface ReasoningOracle {

    /**
     * @param context situation presented to the oracle
     * @param strict  {@code true} on a retry after a malformed or missing answer; implementations
     *                should restate the output contract more forcefully
     * @throws OracleException if no well-formed decision could be obtained
     */
    OracleDecision decide(SituationContext context, boolean strict);
}
