package com.gridcast.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent sessions, capabilities and model training.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOracleCall(long ms, String outcome) {
        Timer.builder("gridcast.oracle.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCapabilityExecution(String capability, String outcome, long ms) {
        Timer.builder("gridcast.capability.duration")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSessionResult(String status) {
        Counter.builder("gridcast.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("gridcast.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void incrementPlanRejections() {
        Counter.builder("gridcast.plan.rejections")
                .description("Oracle plans rejected by contract validation")
                .register(registry)
                .increment();
    }

    /**
     * @param kind    model kind that was trained
     * @param success whether the fit succeeded
     */
    public void recordModelTraining(String kind, boolean success) {
        Counter.builder("gridcast.model.training")
                .tag("kind", kind)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records how many model kinds were attempted before a forecast was produced.
     */
    public void recordFallbackDepth(int attempts) {
        DistributionSummary.builder("gridcast.forecast.fallback_depth")
                .description("Model kinds attempted per forecast request")
                .register(registry)
                .record(attempts);
    }
}
