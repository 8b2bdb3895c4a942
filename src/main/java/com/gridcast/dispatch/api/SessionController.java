package com.gridcast.dispatch.api;

import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.decisionlog.DecisionLedgerException;
import com.gridcast.core.engine.ForecastAgentEngine;
import com.gridcast.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * REST controller for session lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final ForecastAgentEngine engine;
    private final DecisionLedger ledger;

    /** Goals of sessions submitted through this controller, keyed by session id, in submission order. */
    private final ConcurrentHashMap<String, String> submitted = new ConcurrentHashMap<>();
    private final List<String> submissionOrder = new CopyOnWriteArrayList<>();

    public SessionController(ForecastAgentEngine engine, DecisionLedger ledger) {
        this.engine = engine;
        this.ledger = ledger;
    }

    /**
     * POST /api/v1/sessions. Start a session. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitSession(@RequestBody SessionRequest request) {
        if (request == null || request.goal() == null || request.goal().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Goal text is required"));
        }

        String sessionId = engine.generateSessionId();
        String goal = request.goal().trim();
        submitted.put(sessionId, goal);
        submissionOrder.add(sessionId);
        log.info("Accepted session {}, launching async execution", sessionId);

        CompletableFuture.runAsync(() -> {
            try {
                engine.run(sessionId, goal);
            } catch (RuntimeException e) {
                log.error("Session {} terminated unexpectedly", sessionId, e);
            }
        });

        return ResponseEntity.accepted().body(Map.of(
                "session_id", sessionId,
                "status", SessionStatus.RUNNING.name()
        ));
    }

    /**
     * GET /api/v1/sessions. List sessions submitted to this process (summary only).
     */
    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        var list = new ArrayList<SessionResponse>();
        for (String id : submissionOrder) {
            resolve(id, false).ifPresent(list::add);
        }
        return ResponseEntity.ok(list);
    }

    /**
     * GET /api/v1/sessions/{id}. Session summary with its decision log.
     */
    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String id) {
        return resolve(id, true)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/sessions/{id}. Abort a running session, or one submitted here that has not
     * started yet.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> abortSession(@PathVariable String id) {
        if (engine.abort(id)) {
            return ResponseEntity.accepted().body(Map.of("session_id", id, "status", "ABORTING"));
        }
        if (engine.completedSession(id).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("session_id", id, "error", "Session already finished"));
        }
        if (submitted.containsKey(id)) {
            engine.abortPending(id);
            return ResponseEntity.accepted().body(Map.of("session_id", id, "status", "ABORTING"));
        }
        return ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/sessions/history. Recent terminal outcomes from the cross-session ledger.
     */
    @GetMapping("/history")
    public ResponseEntity<List<SessionResponse>> history(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 100) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(ledger.recentOutcomes(limit).stream()
                    .map(summary -> SessionResponse.from(summary, false))
                    .toList());
        } catch (DecisionLedgerException e) {
            log.warn("Could not read session history: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    private Optional<SessionResponse> resolve(String id, boolean includePhases) {
        var completed = engine.completedSession(id);
        if (completed.isPresent()) {
            return Optional.of(SessionResponse.from(completed.get(), includePhases));
        }
        var active = engine.activeSession(id);
        if (active.isPresent()) {
            return Optional.of(SessionResponse.from(active.get(), includePhases));
        }
        String goal = submitted.get(id);
        return goal == null ? Optional.empty() : Optional.of(SessionResponse.pending(id, goal));
    }
}
