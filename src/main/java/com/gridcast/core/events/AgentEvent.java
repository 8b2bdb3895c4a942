package com.gridcast.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a session runs, used by the CLI watch mode.
 *
 * @param eventType event type (e.g. "session.created", "phase.completed", "capability.completed")
 * @param sessionId the session this event belongs to
 * @param phase     phase the event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String sessionId,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
