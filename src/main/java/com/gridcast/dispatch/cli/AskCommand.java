package com.gridcast.dispatch.cli;

import com.gridcast.core.engine.ForecastAgentEngine;
import com.gridcast.core.events.AgentEvent;
import com.gridcast.core.events.EventBus;
import com.gridcast.core.model.SessionSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: gridcast ask "&lt;goal&gt;"
 * <p>
 * Runs one agent session to completion and prints the answer, the forecast
 * table when one was produced, and the failure reason otherwise.
 * Exit code is 0 on success and 1 on failure.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Ask the agent a forecasting question")
@Component
public class AskCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language goal, e.g. \"Forecast Ontario demand for the next 24 hours\"")
    private String goal;

    @Option(names = {"--watch", "-w"}, description = "Stream phase and capability events while the session runs")
    private boolean watch;

    private final ForecastAgentEngine engine;
    private final EventBus eventBus;

    public AskCommand(ForecastAgentEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (goal == null || goal.isBlank()) {
            ConsoleOutput.error("A goal is required");
            return 2;
        }

        String sessionId = engine.generateSessionId();
        ConsoleOutput.info("Session " + sessionId + ": " + goal);

        EventBus.Subscription subscription = watch
                ? eventBus.subscribe(sessionId, AskCommand::printEvent)
                : null;

        SessionSummary summary;
        try {
            summary = engine.run(sessionId, goal);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Session failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        if (summary.forecast() != null) {
            ConsoleOutput.forecast(summary.forecast());
            System.out.println();
        }
        if (summary.succeeded()) {
            ConsoleOutput.success(summary.reason());
            ConsoleOutput.info("Completed in " + summary.iterations() + " iteration"
                    + (summary.iterations() != 1 ? "s" : ""));
            return 0;
        }
        ConsoleOutput.error("Session " + summary.status() + " (" + summary.errorKind() + "): " + summary.reason());
        return 1;
    }

    private static void printEvent(AgentEvent event) {
        String detail = event.phase() != null ? event.phase() : "";
        if (event.payload() != null && !event.payload().isEmpty()) {
            detail = detail + " " + event.payload();
        }
        ConsoleOutput.watchEvent(event.eventType(), detail.trim());
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
