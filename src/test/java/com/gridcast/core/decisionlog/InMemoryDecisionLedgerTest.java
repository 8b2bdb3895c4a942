package com.gridcast.core.decisionlog;

import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.InvocationOutcome;
import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.ResultEnvelope;
import com.gridcast.core.model.SessionStatus;
import com.gridcast.core.model.SessionSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDecisionLedgerTest {

    private static final Instant T0 = Instant.parse("2025-02-01T00:00:00Z");

    private final InMemoryDecisionLedger ledger = new InMemoryDecisionLedger();

    static PhaseRecord record(AgentPhase phase, int iteration) {
        var invocation = new CapabilityInvocation("inv-1", "query_demand", Map.of("days_back", 7),
                ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA, "no rows"), Duration.ofMillis(12),
                InvocationOutcome.ERROR);
        return new PhaseRecord(phase, iteration, T0, "because", List.of(invocation), AgentPhase.REFLECT, null);
    }

    static SessionSummary summary(String id, SessionStatus status) {
        return new SessionSummary(id, "Forecast tomorrow", status,
                status == SessionStatus.SUCCEEDED ? AgentPhase.DONE : AgentPhase.FAILED,
                "reason", null, 1, null, T0, T0.plusSeconds(5), List.of());
    }

    @Test
    @DisplayName("phase entries carry invocation digests without payloads")
    void digests() {
        var entry = ledger.appendPhase("GRID-1", record(AgentPhase.ACT, 1));

        assertEquals(1, entry.sequence());
        assertEquals("ACT", entry.phase());
        var digest = entry.invocations().get(0);
        assertEquals("query_demand", digest.get("capability"));
        assertEquals("INSUFFICIENT_DATA", digest.get("error_kind"));
        assertEquals(12L, digest.get("duration_ms"));
        assertFalse(digest.containsKey("data"));
    }

    @Test
    @DisplayName("corrections append a new entry referencing an existing one")
    void corrections() {
        var original = ledger.appendPhase("GRID-1", record(AgentPhase.REFLECT, 1));
        var correction = ledger.appendCorrection("GRID-1", original.sequence(), "misread metric", T0.plusSeconds(60));

        assertTrue(correction.isCorrection());
        assertEquals(original.sequence(), correction.correctsSequence());
        assertEquals(LedgerEntry.CORRECTION_PHASE, correction.phase());
        assertEquals(2, ledger.entries("GRID-1").size());
        assertThrows(IllegalArgumentException.class,
                () -> ledger.appendCorrection("GRID-1", 999, "nothing there", T0));
    }

    @Test
    @DisplayName("recent outcomes are newest first and limited")
    void recentOutcomes() {
        ledger.appendOutcome(summary("GRID-1", SessionStatus.SUCCEEDED));
        ledger.appendOutcome(summary("GRID-2", SessionStatus.FAILED));
        ledger.appendOutcome(summary("GRID-3", SessionStatus.ABORTED));

        var recent = ledger.recentOutcomes(2);
        assertEquals(List.of("GRID-3", "GRID-2"), recent.stream().map(SessionSummary::sessionId).toList());
    }

    @Test
    @DisplayName("concurrent appends from many sessions get unique, ordered sequences")
    void concurrentAppends() throws Exception {
        int sessions = 8;
        int perSession = 50;
        ExecutorService pool = Executors.newFixedThreadPool(sessions);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();
        for (int s = 0; s < sessions; s++) {
            String id = "GRID-" + s;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perSession; i++) {
                    ledger.appendPhase(id, record(AgentPhase.ACT, i));
                }
                return null;
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        var sequences = new HashSet<Long>();
        for (int s = 0; s < sessions; s++) {
            var entries = ledger.entries("GRID-" + s);
            assertEquals(perSession, entries.size());
            for (int i = 1; i < entries.size(); i++) {
                assertTrue(entries.get(i).sequence() > entries.get(i - 1).sequence());
            }
            entries.forEach(e -> sequences.add(e.sequence()));
        }
        assertEquals(sessions * perSession, sequences.size());
    }
}
