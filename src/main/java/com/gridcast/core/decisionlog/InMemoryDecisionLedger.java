package com.gridcast.core.decisionlog;

import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.SessionSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed ledger. Appends are serialized by a single lock of its own, so
 * sequence order always matches list order; reads take snapshots.
 */
public class InMemoryDecisionLedger implements DecisionLedger {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<LedgerEntry> entries = new ArrayList<>();
    private final List<SessionSummary> outcomes = new ArrayList<>();
    private long nextSequence = 1;

    @Override
    public LedgerEntry appendPhase(String sessionId, PhaseRecord record) {
        var digests = record.invocations().stream().map(DecisionLedger::digest).toList();
        return append(sessionId, record.timestamp(), record.phase().name(), record.rationale(), digests, null);
    }

    @Override
    public LedgerEntry appendCorrection(String sessionId, long correctedSequence, String rationale, Instant timestamp) {
        lock.readLock().lock();
        try {
            boolean exists = entries.stream().anyMatch(e -> e.sequence() == correctedSequence);
            if (!exists) {
                throw new IllegalArgumentException("No ledger entry with sequence " + correctedSequence);
            }
        } finally {
            lock.readLock().unlock();
        }
        return append(sessionId, timestamp, LedgerEntry.CORRECTION_PHASE, rationale, List.of(), correctedSequence);
    }

    @Override
    public void appendOutcome(SessionSummary summary) {
        lock.writeLock().lock();
        try {
            outcomes.add(summary);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<LedgerEntry> entries(String sessionId) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(e -> e.sessionId().equals(sessionId)).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SessionSummary> recentOutcomes(int limit) {
        lock.readLock().lock();
        try {
            var recent = new ArrayList<SessionSummary>();
            for (int i = outcomes.size() - 1; i >= 0 && recent.size() < limit; i--) {
                recent.add(outcomes.get(i));
            }
            return List.copyOf(recent);
        } finally {
            lock.readLock().unlock();
        }
    }

    private LedgerEntry append(String sessionId, Instant timestamp, String phase, String rationale,
                               List<Map<String, Object>> invocations, Long corrects) {
        lock.writeLock().lock();
        try {
            var entry = new LedgerEntry(nextSequence++, sessionId, timestamp, phase, rationale, invocations, corrects);
            entries.add(entry);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
