package com.gridcast.core.decisionlog;

import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.SessionSummary;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide, append-only ledger of phase records and terminal session summaries.
 * <p>
 * Implementations must support concurrent appends from many sessions. Entries are never
 * updated or removed; a correction is a new entry referencing the corrected sequence.
 */
public interface DecisionLedger {

    LedgerEntry appendPhase(String sessionId, PhaseRecord record);

    LedgerEntry appendCorrection(String sessionId, long correctedSequence, String rationale, Instant timestamp);

    void appendOutcome(SessionSummary summary);

    List<LedgerEntry> entries(String sessionId);

    /**
     * Most recent terminal summaries, newest first.
     */
    List<SessionSummary> recentOutcomes(int limit);

    /**
     * Flattens a capability invocation into the persisted layout. Result payloads are not kept.
     */
    static Map<String, Object> digest(CapabilityInvocation invocation) {
        var map = new LinkedHashMap<String, Object>();
        map.put("invocation_id", invocation.invocationId());
        map.put("capability", invocation.capabilityName());
        map.put("arguments", invocation.arguments());
        map.put("outcome", invocation.outcome().name());
        map.put("success", invocation.result().success());
        map.put("message", invocation.result().message());
        map.put("duration_ms", invocation.duration().toMillis());
        var kind = invocation.result().errorKind();
        if (kind != null) {
            map.put("error_kind", kind.name());
        }
        return map;
    }
}
