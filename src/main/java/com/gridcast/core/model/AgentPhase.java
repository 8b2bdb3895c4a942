package com.gridcast.core.model;

/**
 * Phases of the agent decision cycle. {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum AgentPhase {
    PERCEIVE,
    REASON,
    PLAN,
    ACT,
    REFLECT,
    ADAPT,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
