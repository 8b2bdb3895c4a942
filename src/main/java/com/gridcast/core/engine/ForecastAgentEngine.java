package com.gridcast.core.engine;

import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.decisionlog.DecisionLog;
import com.gridcast.core.events.AgentEvent;
import com.gridcast.core.events.EventBus;
import com.gridcast.core.logging.MdcContext;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running sessions from the CLI and the REST API.
 * <p>
 * Generates session ids, wires each session to its decision log, keeps track of running
 * sessions so they can be aborted, and remembers finished summaries for the lifetime of the process.
 */
@Service
public class ForecastAgentEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastAgentEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final AgentOrchestrator orchestrator;
    private final DecisionLedger ledger;
    private final EventBus eventBus;
    private final AgentMetrics metrics;
    private final Clock clock;

    private final Map<String, AgentSession> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, SessionSummary> completedSessions = new ConcurrentHashMap<>();
    /** Sessions aborted after submission but before {@link #run(String, String)} picked them up. */
    private final Set<String> pendingAborts = ConcurrentHashMap.newKeySet();

    public ForecastAgentEngine(AgentOrchestrator orchestrator, DecisionLedger ledger, EventBus eventBus,
                               AgentMetrics metrics, Clock clock) {
        this.orchestrator = orchestrator;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs a session for the goal under a newly generated id.
     */
    public SessionSummary run(String goal) {
        return run(generateSessionId(), goal);
    }

    /**
     * Runs a session to completion on the calling thread.
     *
     * @param sessionId id to use (e.g. pre-generated by the REST controller)
     * @param goal      the operator's question
     */
    public SessionSummary run(String sessionId, String goal) {
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {}: {}", sessionId, goal);
            eventBus.publish(new AgentEvent("session.created", sessionId, null, Map.of("goal", goal), clock.instant()));

            var session = new AgentSession(sessionId, goal, new DecisionLog(sessionId, ledger), clock.instant());
            activeSessions.put(sessionId, session);
            if (pendingAborts.remove(sessionId)) {
                log.info("Session {} was aborted before it started", sessionId);
                session.requestAbort();
            }
            SessionSummary summary;
            try {
                summary = orchestrator.run(session);
            } finally {
                activeSessions.remove(sessionId);
                pendingAborts.remove(sessionId);
            }

            completedSessions.put(sessionId, summary);
            metrics.recordSessionResult(summary.status().name());
            metrics.recordIterationDepth(summary.iterations());
            eventBus.publish(new AgentEvent(
                    summary.succeeded() ? "session.completed" : "session.failed",
                    sessionId, summary.finalPhase().name(),
                    Map.of("status", summary.status().name(),
                            "iterations", summary.iterations(),
                            "reason", summary.reason() == null ? "" : summary.reason()),
                    clock.instant()));
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests an abort of a running session.
     *
     * @return {@code false} if no session with that id is running
     */
    public boolean abort(String sessionId) {
        AgentSession session = activeSessions.get(sessionId);
        if (session == null) {
            return false;
        }
        log.info("Abort requested for session {}", sessionId);
        session.requestAbort();
        return true;
    }

    /**
     * Requests an abort of a session that was submitted but may not have started yet. The session
     * ends ABORTED as soon as it starts; if it is already running it is aborted right away.
     */
    public void abortPending(String sessionId) {
        pendingAborts.add(sessionId);
        AgentSession session = activeSessions.get(sessionId);
        if (session != null) {
            session.requestAbort();
        }
        log.info("Abort requested for pending session {}", sessionId);
    }

    public Optional<AgentSession> activeSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    public Optional<SessionSummary> completedSession(String sessionId) {
        return Optional.ofNullable(completedSessions.get(sessionId));
    }

    /**
     * Finished sessions of this process, newest first.
     */
    public List<SessionSummary> completedSessions() {
        var summaries = new ArrayList<>(completedSessions.values());
        summaries.sort(Comparator.comparing(SessionSummary::finishedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return summaries;
    }

    /**
     * Generates a unique session id in the format GRID-YYYY-NNNN.
     */
    public String generateSessionId() {
        int count = SESSION_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("GRID-%d-%04d", year, count);
    }
}
