package com.mythos.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static MythosEvent event(String type, String subject) {
        return new MythosEvent(type, subject, Map.of(), Instant.parse("2026-03-01T20:00:00Z"));
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to subscribers of its type only")
        void deliversByType() {
            List<MythosEvent> completed = new ArrayList<>();
            List<MythosEvent> failed = new ArrayList<>();
            eventBus.subscribe("objective_completed", completed::add);
            eventBus.subscribe("objective_failed", failed::add);

            eventBus.publish(event("objective_completed", "library"));

            assertEquals(1, completed.size());
            assertEquals("library", completed.get(0).subjectId());
            assertTrue(failed.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversInOrder() {
            List<MythosEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("objective_created", "a"));
            eventBus.publish(event("objective_activated", "a"));
            eventBus.publish(event("objective_completed", "a"));

            assertEquals(List.of("objective_created", "objective_activated", "objective_completed"),
                    received.stream().map(MythosEvent::eventType).toList());
        }

        @Test
        @DisplayName("type subscribers are notified before global subscribers")
        void typeBeforeGlobal() {
            List<String> order = new ArrayList<>();
            eventBus.subscribeAll(e -> order.add("global"));
            eventBus.subscribe("achievement_unlocked", e -> order.add("typed"));

            eventBus.publish(event("achievement_unlocked", "first_steps"));

            assertEquals(List.of("typed", "global"), order);
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<MythosEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("objective_failed", received::add);

            eventBus.publish(event("objective_failed", "a"));
            subscription.unsubscribe();
            eventBus.publish(event("objective_failed", "b"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobal() {
            List<MythosEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(event("objective_created", "a"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("publishing with no subscribers does not throw")
        void publishWithNoSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event("objective_created", "a")));
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionIsIsolated() {
            List<MythosEvent> received = new ArrayList<>();
            eventBus.subscribe("objective_completed", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("objective_completed", received::add);
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("objective_completed", "a"));

            assertEquals(2, received.size());
        }
    }
}
