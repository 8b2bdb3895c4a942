package com.gridcast.core.engine;

import com.gridcast.core.decisionlog.DecisionLog;
import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.OracleDecision;
import com.gridcast.core.model.PlannedInvocation;
import com.gridcast.core.model.SessionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one running session. Owned by a single orchestrator thread for the session's
 * lifetime; only the abort flag is touched from other threads.
 */
public class AgentSession {

    private final String id;
    private final String goal;
    private final DecisionLog decisionLog;
    private final Instant startedAt;

    private AgentPhase phase = AgentPhase.PERCEIVE;
    private int iteration;
    private SessionStatus status = SessionStatus.RUNNING;
    private String reason;
    private ErrorKind errorKind;

    private Map<String, Object> facts = new LinkedHashMap<>();
    private final List<String> notes = new ArrayList<>();
    private OracleDecision pendingDecision;
    private List<PlannedInvocation> pendingPlan = List.of();
    private List<CapabilityInvocation> lastInvocations = List.of();
    private int consecutivePlanRejections;
    private final Map<String, Integer> internalErrors = new HashMap<>();
    private ForecastResult lastForecast;

    private volatile boolean abortRequested;
    private volatile Thread runner;

    public AgentSession(String id, String goal, DecisionLog decisionLog, Instant startedAt) {
        this.id = id;
        this.goal = goal;
        this.decisionLog = decisionLog;
        this.startedAt = startedAt;
    }

    public String id() {
        return id;
    }

    public String goal() {
        return goal;
    }

    public DecisionLog decisionLog() {
        return decisionLog;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public AgentPhase phase() {
        return phase;
    }

    void moveTo(AgentPhase next) {
        this.phase = next;
    }

    public int iteration() {
        return iteration;
    }

    void nextIteration() {
        iteration++;
    }

    public SessionStatus status() {
        return status;
    }

    public String reason() {
        return reason;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    void succeed(String finalReason) {
        this.status = SessionStatus.SUCCEEDED;
        this.reason = finalReason;
    }

    void fail(ErrorKind kind, String failureReason) {
        this.status = kind == ErrorKind.ABORTED ? SessionStatus.ABORTED : SessionStatus.FAILED;
        this.errorKind = kind;
        this.reason = failureReason;
    }

    public Map<String, Object> facts() {
        return facts;
    }

    void facts(Map<String, Object> newFacts) {
        this.facts = newFacts;
    }

    public List<String> notes() {
        return notes;
    }

    void note(String note) {
        notes.add(note);
    }

    OracleDecision pendingDecision() {
        return pendingDecision;
    }

    void pendingDecision(OracleDecision decision) {
        this.pendingDecision = decision;
    }

    List<PlannedInvocation> pendingPlan() {
        return pendingPlan;
    }

    void pendingPlan(List<PlannedInvocation> plan) {
        this.pendingPlan = plan;
    }

    public List<CapabilityInvocation> lastInvocations() {
        return lastInvocations;
    }

    void lastInvocations(List<CapabilityInvocation> invocations) {
        this.lastInvocations = invocations;
    }

    int rejectPlan() {
        return ++consecutivePlanRejections;
    }

    void acceptPlan() {
        consecutivePlanRejections = 0;
    }

    /**
     * Counts an internal error for a capability and returns how many it has had this session.
     */
    int recordInternalError(String capability) {
        return internalErrors.merge(capability, 1, Integer::sum);
    }

    public ForecastResult lastForecast() {
        return lastForecast;
    }

    void lastForecast(ForecastResult forecast) {
        this.lastForecast = forecast;
    }

    public boolean isAbortRequested() {
        return abortRequested;
    }

    /**
     * Asks the session to stop at the next suspension point.
     */
    public void requestAbort() {
        abortRequested = true;
        Thread t = runner;
        if (t != null) {
            t.interrupt();
        }
    }

    void attach(Thread thread) {
        this.runner = thread;
    }

    void detach() {
        this.runner = null;
    }
}
