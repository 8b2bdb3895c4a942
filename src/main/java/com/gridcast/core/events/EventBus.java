package com.gridcast.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for session execution events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * A subscriber that throws never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AgentEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        List<Consumer<AgentEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            for (Consumer<AgentEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<AgentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific session.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<AgentEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<AgentEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AgentEvent> subscriber, AgentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
