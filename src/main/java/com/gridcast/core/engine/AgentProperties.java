package com.gridcast.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Orchestrator policy bound from {@code gridcast.agent.*}.
 */
@Component
@ConfigurationProperties(prefix = "gridcast.agent")
public class AgentProperties {

    /** Maximum REASON..ADAPT cycles before a session fails with REASONING_DIVERGENCE. */
    private int maxIterations = 6;

    /** Consecutive invalid plans tolerated before the session fails. */
    private int maxPlanRetries = 3;

    private long oracleTimeoutSeconds = 60;

    /** Additional oracle attempts (with a stricter prompt) after a malformed or timed-out answer. */
    private int oracleRetries = 1;

    /** Prior session outcomes shown to the oracle during PERCEIVE. */
    private int historyWindow = 5;

    /** Target whose model metrics are reported during PERCEIVE. */
    private String forecastTarget = "ontario_demand";

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getMaxPlanRetries() {
        return maxPlanRetries;
    }

    public void setMaxPlanRetries(int maxPlanRetries) {
        this.maxPlanRetries = maxPlanRetries;
    }

    public long getOracleTimeoutSeconds() {
        return oracleTimeoutSeconds;
    }

    public void setOracleTimeoutSeconds(long oracleTimeoutSeconds) {
        this.oracleTimeoutSeconds = oracleTimeoutSeconds;
    }

    public int getOracleRetries() {
        return oracleRetries;
    }

    public void setOracleRetries(int oracleRetries) {
        this.oracleRetries = oracleRetries;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public String getForecastTarget() {
        return forecastTarget;
    }

    public void setForecastTarget(String forecastTarget) {
        this.forecastTarget = forecastTarget;
    }
}
