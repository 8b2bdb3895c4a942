package com.gridcast.core.decisionlog;

import com.gridcast.core.model.AgentPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionLogTest {

    @Test
    @DisplayName("records are kept in append order and forwarded to the ledger")
    void appendsAndForwards() {
        var ledger = new InMemoryDecisionLedger();
        var log = new DecisionLog("GRID-7", ledger);

        log.append(InMemoryDecisionLedgerTest.record(AgentPhase.PERCEIVE, 0));
        log.append(InMemoryDecisionLedgerTest.record(AgentPhase.REASON, 1));

        assertEquals(2, log.size());
        assertEquals(AgentPhase.REASON, log.last().orElseThrow().phase());
        assertEquals(AgentPhase.PERCEIVE, log.records().get(0).phase());
        assertEquals(2, ledger.entries("GRID-7").size());
    }

    @Test
    @DisplayName("the records view cannot be modified")
    void immutableView() {
        var log = new DecisionLog("GRID-7", null);
        log.append(InMemoryDecisionLedgerTest.record(AgentPhase.PERCEIVE, 0));
        assertThrows(UnsupportedOperationException.class, () -> log.records().clear());
        assertTrue(new DecisionLog("GRID-8", null).last().isEmpty());
    }

    @Test
    @DisplayName("a failing ledger does not lose the in-session record")
    void ledgerFailureTolerated() {
        DecisionLedger ledger = mock(DecisionLedger.class);
        when(ledger.appendPhase(eq("GRID-9"), any()))
                .thenThrow(new DecisionLedgerException("down", new SQLException("connection refused")));
        var log = new DecisionLog("GRID-9", ledger);

        assertDoesNotThrow(() -> log.append(InMemoryDecisionLedgerTest.record(AgentPhase.ACT, 1)));

        assertEquals(1, log.size());
        verify(ledger).appendPhase(eq("GRID-9"), any());
    }
}
