package com.gridcast.dispatch.cli;

import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.decisionlog.DecisionLedgerException;
import com.gridcast.core.model.SessionSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: gridcast history
 * <p>
 * Reads recent session outcomes from the cross-session ledger and displays them
 * as a table: Session ID | Status | Error | Iterations | Goal.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent session outcomes")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final DecisionLedger ledger;

    public HistoryCommand(DecisionLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SessionSummary> outcomes;
        try {
            outcomes = ledger.recentOutcomes(Math.max(1, limit));
        } catch (DecisionLedgerException e) {
            ConsoleOutput.error("Could not read the ledger: " + e.getMessage());
            return;
        }
        if (outcomes.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        ConsoleOutput.info("Sessions (" + outcomes.size() + "):");
        System.out.println();
        System.out.printf("  %-16s %-10s %-24s %-5s %s%n", "SESSION ID", "STATUS", "ERROR", "ITER", "GOAL");
        System.out.println("  " + "-".repeat(86));

        for (SessionSummary summary : outcomes) {
            System.out.printf("  %-16s %-10s %-24s %-5d %s%n",
                    summary.sessionId(),
                    summary.status().name(),
                    summary.errorKind() != null ? summary.errorKind().name() : "-",
                    summary.iterations(),
                    ConsoleOutput.truncate(summary.goal(), 40));
        }
    }
}
