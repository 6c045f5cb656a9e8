package com.qmb.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

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

    @Test
    @DisplayName("of() stamps the event with the current time")
    void ofStampsTimestamp() {
        ModelBuilderEvent event = ModelBuilderEvent.of("session.started", "QMB-2025-0001", null, Map.of());

        assertNotNull(event.timestamp());
        assertNull(event.stage());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers the events of every session to each subscriber")
        void deliversToEverySubscriber() {
            List<ModelBuilderEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(ModelBuilderEvent.of("stage.built", "S-1", "A", Map.of()));
            eventBus.publish(ModelBuilderEvent.of("stage.built", "S-2", "A", Map.of()));

            assertEquals(2, all.size());
            assertEquals(List.of("S-1", "S-2"), all.stream().map(ModelBuilderEvent::sessionId).toList());
        }

        @Test
        @DisplayName("subscribers registered later do not see earlier events")
        void lateSubscriberMissesEarlierEvents() {
            eventBus.publish(ModelBuilderEvent.of("session.started", "S-1", null, Map.of()));
            List<ModelBuilderEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(ModelBuilderEvent.of("stage.built", "S-1", "A", Map.of()));

            assertEquals(1, received.size());
            assertEquals("stage.built", received.get(0).eventType());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribeStopsDelivery() {
            List<ModelBuilderEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(ModelBuilderEvent.of("stage.built", "S-1", "A", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not affect the others")
        void failingSubscriberIsIsolated() {
            List<ModelBuilderEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(ModelBuilderEvent.of("stage.built", "S-1", "A", Map.of())));
            assertEquals(1, received.size());
        }
    }
}
