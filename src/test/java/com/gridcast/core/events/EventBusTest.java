package com.gridcast.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static AgentEvent event(String type, String sessionId) {
        return new AgentEvent(type, sessionId, "ACT", Map.of("capability", "produce_forecast"), Instant.now());
    }

    @Nested
    @DisplayName("session subscriptions")
    class SessionSubscriptions {

        @Test
        @DisplayName("delivers only the subscribed session's events, in order")
        void deliversInOrder() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe("GRID-1", received::add);

            eventBus.publish(event("session.created", "GRID-1"));
            eventBus.publish(event("phase.completed", "GRID-2"));
            eventBus.publish(event("phase.completed", "GRID-1"));

            assertEquals(List.of("session.created", "phase.completed"),
                    received.stream().map(AgentEvent::eventType).toList());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<AgentEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("GRID-1", received::add);

            eventBus.publish(event("session.created", "GRID-1"));
            subscription.unsubscribe();
            eventBus.publish(event("session.completed", "GRID-1"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("global subscriptions")
    class GlobalSubscriptions {

        @Test
        @DisplayName("receive events of every session")
        void receivesAll() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("session.created", "GRID-1"));
            eventBus.publish(event("session.created", "GRID-2"));

            assertEquals(List.of("GRID-1", "GRID-2"), received.stream().map(AgentEvent::sessionId).toList());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void throwingSubscriber() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe("GRID-1", e -> {
                throw new IllegalStateException("subscriber bug");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("phase.completed", "GRID-1")));
            assertEquals(1, received.size());
        }
    }
}
