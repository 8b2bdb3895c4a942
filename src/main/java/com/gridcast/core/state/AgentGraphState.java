package com.gridcast.core.state;

import com.gridcast.core.model.AgentPhase;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Map;

/**
 * Graph state for one agent session.
 * <p>
 * Only routing data lives here: the session id and the phase the last node moved the session to.
 * Everything the phases work on (facts, notes, pending plan, decision log) stays on the session.
 */
public class AgentGraphState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("sessionId", Channels.base(() -> "")),
        Map.entry("phase",     Channels.base(() -> AgentPhase.PERCEIVE.name()))
    );

    public AgentGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public String sessionId() {
        return this.<String>value("sessionId").orElse("");
    }

    public AgentPhase phase() {
        return AgentPhase.valueOf(this.<String>value("phase").orElse(AgentPhase.PERCEIVE.name()));
    }
}
