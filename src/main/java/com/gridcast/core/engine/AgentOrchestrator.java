package com.gridcast.core.engine;

import com.gridcast.core.capability.CapabilityDispatcher;
import com.gridcast.core.capability.CapabilityRegistry;
import com.gridcast.core.capability.builtin.DataCapabilities;
import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.decisionlog.DecisionLedgerException;
import com.gridcast.core.events.AgentEvent;
import com.gridcast.core.events.EventBus;
import com.gridcast.core.forecast.ForecastModelManager;
import com.gridcast.core.freshness.DataFreshnessGate;
import com.gridcast.core.freshness.FreshnessProperties;
import com.gridcast.core.graph.AgentGraph;
import com.gridcast.core.logging.MdcContext;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.FreshnessVerdict;
import com.gridcast.core.model.OracleDecision;
import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.PlannedInvocation;
import com.gridcast.core.model.SessionSummary;
import com.gridcast.core.model.SituationContext;
import com.gridcast.core.oracle.OracleException;
import com.gridcast.core.oracle.ReasoningOracle;
import com.gridcast.core.state.AgentGraphState;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one session through PERCEIVE, REASON, PLAN, ACT, REFLECT and ADAPT until it reaches
 * DONE or FAILED.
 * <p>
 * The cycle is an {@link AgentGraph} with one node per {@link AgentPhase}. Each node runs the
 * handler for its phase, which appends exactly one {@link PhaseRecord} and moves the session on;
 * the graph's conditional edges then follow the new phase. Iterations are bounded by
 * {@code gridcast.agent.max-iterations} in ADAPT and the number of steps by the graph's recursion
 * limit. Nothing thrown by the oracle or a capability escapes: every failure ends up in a phase
 * record or in the terminal summary.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private static final int MAX_NOTES = 20;
    private static final String PERCEIVE_INVOCATION_ID = "perceive-freshness";
    private static final String UNKNOWN = "unknown";
    private static final AtomicInteger ORACLE_THREADS = new AtomicInteger();

    private final ReasoningOracle oracle;
    private final CapabilityDispatcher dispatcher;
    private final CapabilityRegistry registry;
    private final PlanValidator planValidator;
    private final ReflectionEvaluator reflectionEvaluator;
    private final DataFreshnessGate freshnessGate;
    private final FreshnessProperties freshnessProperties;
    private final ForecastModelManager modelManager;
    private final DecisionLedger ledger;
    private final EventBus eventBus;
    private final AgentMetrics metrics;
    private final AgentProperties properties;
    private final Clock clock;
    private final AgentGraph agentGraph;
    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    private final ExecutorService oracleExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "gridcast-oracle-" + ORACLE_THREADS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public AgentOrchestrator(ReasoningOracle oracle,
                             CapabilityDispatcher dispatcher,
                             CapabilityRegistry registry,
                             PlanValidator planValidator,
                             ReflectionEvaluator reflectionEvaluator,
                             DataFreshnessGate freshnessGate,
                             FreshnessProperties freshnessProperties,
                             ForecastModelManager modelManager,
                             DecisionLedger ledger,
                             EventBus eventBus,
                             AgentMetrics metrics,
                             AgentProperties properties,
                             Clock clock) {
        this.oracle = oracle;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.planValidator = planValidator;
        this.reflectionEvaluator = reflectionEvaluator;
        this.freshnessGate = freshnessGate;
        this.freshnessProperties = freshnessProperties;
        this.modelManager = modelManager;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        try {
            this.agentGraph = new AgentGraph(this::runPhase, recursionLimit());
        } catch (GraphStateException e) {
            throw new IllegalStateException("Agent graph could not be compiled", e);
        }
    }

    /**
     * Drives the session through the agent graph to a terminal phase and returns its summary.
     * The summary is also appended to the cross-session ledger.
     */
    public SessionSummary run(AgentSession session) {
        sessions.put(session.id(), session);
        try {
            var config = RunnableConfig.builder()
                    .threadId(session.id())
                    .build();
            agentGraph.getCompiledGraph().invoke(Map.of(
                    "sessionId", session.id(),
                    "phase", session.phase().name()), config);
        } catch (RuntimeException e) {
            if (!session.phase().isTerminal()) {
                haltedGraph(session, e);
            } else {
                log.warn("Agent graph of session {} failed after reaching {}: {}", session.id(), session.phase(),
                        e.getMessage());
            }
        } finally {
            sessions.remove(session.id());
            // an abort interrupt must not leak into the caller's thread
            boolean interrupted = Thread.interrupted();
            if (interrupted && !session.isAbortRequested()) {
                Thread.currentThread().interrupt();
            }
            MDC.remove("phase");
            MDC.remove("iteration");
        }
        if (!session.phase().isTerminal()) {
            force(session, ErrorKind.REASONING_DIVERGENCE, "Agent graph ended in non-terminal phase " + session.phase());
        }

        SessionSummary summary = summarize(session);
        try {
            ledger.appendOutcome(summary.withoutPhases());
        } catch (DecisionLedgerException e) {
            log.warn("Could not record outcome of session {}: {}", session.id(), e.getMessage());
        }
        log.info("Session {} finished {} after {} iteration(s): {}", session.id(), summary.status(),
                summary.iterations(), summary.reason());
        return summary;
    }

    /**
     * Node action shared by every non-terminal node: runs the handler of {@code phase} for the
     * session named by the state and reports the phase the session moved to.
     */
    Map<String, Object> runPhase(AgentPhase phase, AgentGraphState state) {
        AgentSession session = sessions.get(state.sessionId());
        if (session == null) {
            throw new IllegalStateException("No running session " + state.sessionId());
        }
        if (session.phase() != phase) {
            throw new IllegalStateException("Graph reached " + phase + " but session " + session.id()
                    + " is in " + session.phase());
        }
        session.attach(Thread.currentThread());
        MdcContext.setPhase(session.id(), phase.name(), session.iteration());
        try {
            if (session.isAbortRequested()) {
                force(session, ErrorKind.ABORTED, "Session aborted by operator during " + phase);
            } else {
                switch (phase) {
                    case PERCEIVE -> perceive(session);
                    case REASON -> reason(session);
                    case PLAN -> plan(session);
                    case ACT -> act(session);
                    case REFLECT -> reflect(session);
                    case ADAPT -> adapt(session);
                    default -> throw new IllegalStateException("No node action for " + phase);
                }
            }
        } finally {
            session.detach();
            if (session.isAbortRequested()) {
                // the abort interrupt is consumed by the next node's check
                Thread.interrupted();
            }
        }
        return Map.of("phase", session.phase().name());
    }

    private void haltedGraph(AgentSession session, RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (session.isAbortRequested()) {
            force(session, ErrorKind.ABORTED, "Session aborted by operator during " + session.phase());
        } else {
            log.warn("Agent graph of session {} halted in {}: {}", session.id(), session.phase(), cause.getMessage());
            force(session, ErrorKind.REASONING_DIVERGENCE, "Did not converge: agent graph halted within its limit of "
                    + agentGraph.recursionLimit() + " steps (" + cause.getMessage() + ")");
        }
    }

    void perceive(AgentSession session) {
        var facts = new LinkedHashMap<String, Object>();
        var invocations = new ArrayList<CapabilityInvocation>();
        String freshnessNote;

        if (registry.contains(DataCapabilities.CHECK_DATA_FRESHNESS)) {
            CapabilityInvocation check = dispatcher.dispatch(session.id(), PERCEIVE_INVOCATION_ID,
                    DataCapabilities.CHECK_DATA_FRESHNESS, Map.of());
            invocations.add(check);
            FreshnessVerdict verdict = verdictFrom(check);
            if (verdict != null) {
                var freshness = new LinkedHashMap<String, Object>();
                freshness.put("verdict", verdict.verdict().name());
                freshness.put("latest_timestamp", verdict.latestKnownTimestamp().toString());
                freshness.put("hours_old", verdict.hoursOld());
                freshness.put("threshold_hours", verdict.threshold().toMinutes() / 60.0);
                facts.put("data_freshness", freshness);
                freshnessNote = "data " + verdict.verdict() + " (" + verdict.hoursOld() + "h old)";
            } else {
                facts.put("data_freshness", UNKNOWN);
                facts.put("data_freshness_error", check.result().message());
                freshnessNote = "data freshness unknown";
            }
        } else {
            facts.put("data_freshness", UNKNOWN);
            freshnessNote = "data freshness unknown";
        }

        Map<String, Map<String, Double>> modelMetrics = modelManager.latestMetrics(properties.getForecastTarget());
        facts.put("model_performance", modelMetrics.isEmpty() ? UNKNOWN : modelMetrics);

        Object priorOutcomes;
        try {
            priorOutcomes = ledger.recentOutcomes(properties.getHistoryWindow()).stream()
                    .map(AgentOrchestrator::outcomeFact)
                    .toList();
        } catch (DecisionLedgerException e) {
            log.warn("Prior outcomes unavailable: {}", e.getMessage());
            priorOutcomes = UNKNOWN;
        }
        facts.put("prior_sessions", priorOutcomes);
        facts.put("now", clock.instant().toString());
        session.facts(facts);

        transition(session, "Perceived: " + freshnessNote + ", model performance "
                + (modelMetrics.isEmpty() ? UNKNOWN : "known for " + modelMetrics.keySet()), invocations,
                AgentPhase.REASON, null);
        session.nextIteration();
    }

    void reason(AgentSession session) {
        SituationContext context = situation(session);
        int attempts = 1 + Math.max(0, properties.getOracleRetries());
        String lastFailure = null;
        ErrorKind lastKind = ErrorKind.ORACLE_FAILURE;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            boolean strict = attempt > 1;
            long start = System.currentTimeMillis();
            try {
                OracleDecision decision = callOracle(context, strict);
                metrics.recordOracleCall(System.currentTimeMillis() - start, "ok");
                if (decision.isDone()) {
                    session.succeed(decision.summary());
                    transition(session, decision.summary(), List.of(), AgentPhase.DONE, null);
                } else {
                    session.pendingDecision(decision);
                    int count = decision.invocations() == null ? 0 : decision.invocations().size();
                    String rationale = decision.rationale() != null && !decision.rationale().isBlank()
                            ? decision.rationale()
                            : "Oracle proposed " + count + " invocation(s)";
                    transition(session, rationale, List.of(), AgentPhase.PLAN, null);
                }
                return;
            } catch (TimeoutException e) {
                metrics.recordOracleCall(System.currentTimeMillis() - start, "timeout");
                lastKind = ErrorKind.TIMEOUT;
                lastFailure = "TimeoutError: oracle did not answer within " + properties.getOracleTimeoutSeconds() + "s";
            } catch (OracleException e) {
                metrics.recordOracleCall(System.currentTimeMillis() - start, "error");
                lastKind = ErrorKind.ORACLE_FAILURE;
                lastFailure = e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                session.requestAbort();
                force(session, ErrorKind.ABORTED, "Session aborted while waiting for the oracle");
                return;
            }
            log.warn("Oracle attempt {}/{} failed: {}", attempt, attempts, lastFailure);
        }

        String reason = "Reasoning oracle failed " + attempts + " time(s); last failure: " + lastFailure;
        session.fail(lastKind, reason);
        transition(session, reason, List.of(), AgentPhase.FAILED, lastKind);
    }

    void plan(AgentSession session) {
        OracleDecision decision = session.pendingDecision();
        PlanValidator.Validation validation = planValidator.validate(decision == null ? null : decision.invocations());
        session.pendingDecision(null);

        if (validation.isValid()) {
            session.acceptPlan();
            session.pendingPlan(validation.plan());
            String capabilities = validation.plan().stream().map(PlannedInvocation::capability).toList().toString();
            transition(session, "Plan accepted: " + capabilities, List.of(), AgentPhase.ACT, null);
            return;
        }

        metrics.incrementPlanRejections();
        int rejections = session.rejectPlan();
        String errors = String.join("; ", validation.errors());
        if (rejections > properties.getMaxPlanRetries()) {
            String reason = "Oracle produced " + rejections + " consecutive invalid plans; last errors: " + errors;
            session.fail(ErrorKind.VALIDATION_FAILED, reason);
            transition(session, reason, List.of(), AgentPhase.FAILED, ErrorKind.VALIDATION_FAILED);
            return;
        }
        session.note("Plan rejected (ValidationFailed): " + errors);
        transition(session, "ValidationFailed: " + errors, List.of(), AgentPhase.REASON, ErrorKind.VALIDATION_FAILED);
    }

    void act(AgentSession session) {
        List<PlannedInvocation> plan = session.pendingPlan();
        session.pendingPlan(List.of());
        List<CapabilityInvocation> invocations = dispatcher.dispatchAll(session.id(), plan);

        for (CapabilityInvocation invocation : invocations) {
            if (invocation.result().data() instanceof ForecastResult forecast) {
                session.lastForecast(forecast);
            }
            var payload = new LinkedHashMap<String, Object>();
            payload.put("invocationId", invocation.invocationId());
            payload.put("capability", invocation.capabilityName());
            payload.put("outcome", invocation.outcome().name());
            payload.put("message", invocation.result().message());
            payload.put("durationMs", invocation.duration().toMillis());
            publish("capability.completed", session, payload);
        }
        session.lastInvocations(invocations);

        long ok = invocations.stream().filter(CapabilityInvocation::succeeded).count();
        transition(session, "Executed " + invocations.size() + " invocation(s), " + ok + " succeeded",
                invocations, AgentPhase.REFLECT, null);
    }

    void reflect(AgentSession session) {
        ReflectionEvaluator.Reflection reflection =
                reflectionEvaluator.evaluate(session, session.lastInvocations());
        switch (reflection.next()) {
            case DONE -> {
                String answer = session.lastInvocations().stream()
                        .filter(i -> i.result().data() instanceof ForecastResult)
                        .map(i -> i.result().message())
                        .reduce((first, second) -> second)
                        .orElse(reflection.rationale());
                session.succeed(answer);
            }
            case FAILED -> session.fail(reflection.errorKind(), reflection.rationale());
            default -> { }
        }
        transition(session, reflection.rationale(), List.of(), reflection.next(), reflection.errorKind());
    }

    void adapt(AgentSession session) {
        for (CapabilityInvocation invocation : session.lastInvocations()) {
            if (!invocation.succeeded()) {
                session.note("Iteration " + session.iteration() + ": " + invocation.capabilityName()
                        + " failed (" + invocation.result().errorKind() + "): " + invocation.result().message());
            }
        }
        if (session.iteration() >= properties.getMaxIterations()) {
            String reason = "ReasoningDivergence: did not converge within " + properties.getMaxIterations()
                    + " iterations";
            session.fail(ErrorKind.REASONING_DIVERGENCE, reason);
            transition(session, reason, List.of(), AgentPhase.FAILED, ErrorKind.REASONING_DIVERGENCE);
            return;
        }
        long failed = session.lastInvocations().stream().filter(i -> !i.succeeded()).count();
        String rationale = failed == 0
                ? "Results handed back to the oracle for iteration " + (session.iteration() + 1)
                : "Adapting after " + failed + " failed invocation(s); starting iteration " + (session.iteration() + 1);
        transition(session, rationale, List.of(), AgentPhase.REASON, null);
        session.nextIteration();
    }

    private OracleDecision callOracle(SituationContext context, boolean strict)
            throws TimeoutException, InterruptedException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<OracleDecision> future = oracleExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return oracle.decide(context, strict);
            } finally {
                MDC.clear();
            }
        });
        try {
            OracleDecision decision = future.get(properties.getOracleTimeoutSeconds(), TimeUnit.SECONDS);
            if (decision == null) {
                throw new OracleException("Oracle returned no decision");
            }
            return decision;
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof OracleException oracleException) {
                throw oracleException;
            }
            throw new OracleException("Oracle call failed: " + cause.getMessage(), cause);
        }
    }

    private SituationContext situation(AgentSession session) {
        var lastResults = new ArrayList<Map<String, Object>>();
        for (CapabilityInvocation invocation : session.lastInvocations()) {
            var result = new LinkedHashMap<String, Object>();
            result.put("invocation_id", invocation.invocationId());
            result.put("capability", invocation.capabilityName());
            result.put("arguments", invocation.arguments());
            result.put("success", invocation.succeeded());
            result.put("message", invocation.result().message());
            if (!invocation.succeeded()) {
                result.put("error_kind", String.valueOf(invocation.result().errorKind()));
            }
            result.put("data", invocation.result().data());
            result.put("metadata", invocation.result().metadata());
            lastResults.add(result);
        }
        List<String> notes = session.notes();
        List<String> recentNotes = notes.subList(Math.max(0, notes.size() - MAX_NOTES), notes.size());
        return new SituationContext(session.goal(), session.facts(), recentNotes, lastResults,
                registry.contracts(), session.iteration(), properties.getMaxIterations());
    }

    private FreshnessVerdict verdictFrom(CapabilityInvocation check) {
        if (!check.succeeded()) {
            return null;
        }
        Object latest = check.result().metadata().get(DataCapabilities.LATEST_TIMESTAMP_KEY);
        if (latest == null) {
            return null;
        }
        try {
            return freshnessGate.checkFreshness(Instant.parse(latest.toString()), clock.instant(),
                    freshnessProperties.toPolicy());
        } catch (DateTimeParseException e) {
            log.warn("Unparseable latest timestamp '{}': {}", latest, e.getMessage());
            return null;
        }
    }

    private void transition(AgentSession session, String rationale, List<CapabilityInvocation> invocations,
                            AgentPhase next, ErrorKind errorKind) {
        append(session, rationale, invocations, next, errorKind);
    }

    /**
     * Moves the session to FAILED from any non-terminal phase.
     */
    private void force(AgentSession session, ErrorKind kind, String reason) {
        session.fail(kind, reason);
        append(session, reason, List.of(), AgentPhase.FAILED, kind);
    }

    private void append(AgentSession session, String rationale, List<CapabilityInvocation> invocations,
                        AgentPhase next, ErrorKind errorKind) {
        AgentPhase current = session.phase();
        var record = new PhaseRecord(current, session.iteration(), clock.instant(), rationale, invocations,
                next, errorKind);
        session.decisionLog().append(record);
        session.moveTo(next);
        log.info("{} -> {} (iteration {}): {}", current, next, session.iteration(), rationale);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("next", next.name());
        payload.put("iteration", session.iteration());
        payload.put("rationale", rationale == null ? "" : rationale);
        if (errorKind != null) {
            payload.put("errorKind", errorKind.name());
        }
        eventBus.publish(new AgentEvent("phase.completed", session.id(), current.name(), payload, clock.instant()));
    }

    private void publish(String type, AgentSession session, Map<String, Object> payload) {
        eventBus.publish(new AgentEvent(type, session.id(), session.phase().name(), payload, clock.instant()));
    }

    private SessionSummary summarize(AgentSession session) {
        return new SessionSummary(session.id(), session.goal(), session.status(), session.phase(),
                session.reason(), session.errorKind(), session.iteration(), session.lastForecast(),
                session.startedAt(), clock.instant(), session.decisionLog().records());
    }

    /**
     * Perceive, then per iteration every allowed plan retry (REASON and PLAN) plus ACT, REFLECT and
     * ADAPT, then the terminal node and END.
     */
    private int recursionLimit() {
        int perIteration = 2 * (properties.getMaxPlanRetries() + 1) + 3;
        return 3 + properties.getMaxIterations() * perIteration;
    }

    private static Map<String, Object> outcomeFact(SessionSummary summary) {
        var fact = new LinkedHashMap<String, Object>();
        fact.put("session_id", summary.sessionId());
        fact.put("status", summary.status().name());
        fact.put("iterations", summary.iterations());
        fact.put("reason", summary.reason() == null ? "" : summary.reason());
        return fact;
    }

    @PreDestroy
    public void shutdown() {
        oracleExecutor.shutdownNow();
    }
}
