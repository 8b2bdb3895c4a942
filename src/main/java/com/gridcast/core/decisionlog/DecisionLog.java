package com.gridcast.core.decisionlog;

import com.gridcast.core.model.PhaseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of the phases of one session.
 * <p>
 * Every appended record is also forwarded to the process-wide {@link DecisionLedger}.
 * A ledger failure is logged and does not affect the in-session log.
 */
public class DecisionLog {

    private static final Logger log = LoggerFactory.getLogger(DecisionLog.class);

    private final String sessionId;
    private final DecisionLedger ledger;
    private final CopyOnWriteArrayList<PhaseRecord> records = new CopyOnWriteArrayList<>();

    public DecisionLog(String sessionId, DecisionLedger ledger) {
        this.sessionId = sessionId;
        this.ledger = ledger;
    }

    public void append(PhaseRecord record) {
        records.add(record);
        if (ledger == null) {
            return;
        }
        try {
            ledger.appendPhase(sessionId, record);
        } catch (DecisionLedgerException e) {
            log.warn("Ledger append failed for session {} phase {}: {}", sessionId, record.phase(), e.getMessage());
        }
    }

    public List<PhaseRecord> records() {
        return List.copyOf(records);
    }

    public Optional<PhaseRecord> last() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    public int size() {
        return records.size();
    }

    public String sessionId() {
        return sessionId;
    }
}
