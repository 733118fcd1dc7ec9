package com.abathur.core.events;

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

    private static SwarmEvent event(String type, String taskId) {
        return new SwarmEvent(type, taskId, Map.of(), Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribe("task-1", received::add);

            eventBus.publish(event(SwarmEvent.TASK_COMPLETED, "task-1"));

            assertEquals(1, received.size());
            assertEquals("task.completed", received.get(0).eventType());
        }

        @Test
        @DisplayName("does not deliver other tasks' events to a task subscriber")
        void ignoresOtherTasks() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribe("task-1", received::add);

            eventBus.publish(event(SwarmEvent.TASK_COMPLETED, "task-2"));
            eventBus.publish(event(SwarmEvent.SWARM_STARTED, null));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives every event")
        void globalSubscriberReceivesAll() {
            List<SwarmEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(SwarmEvent.TASK_ENQUEUED, "task-1"));
            eventBus.publish(event(SwarmEvent.SWARM_STOPPED, null));

            assertEquals(2, received.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("task subscription stops receiving after unsubscribe")
        void taskUnsubscribe() {
            List<SwarmEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("task-1", received::add);
            subscription.unsubscribe();

            eventBus.publish(event(SwarmEvent.TASK_FAILED, "task-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscription stops receiving after unsubscribe")
        void globalUnsubscribe() {
            List<SwarmEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(event(SwarmEvent.TASK_READY, "task-1"));

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("a throwing subscriber does not stop delivery to the others")
    void subscriberExceptionIsolated() {
        List<SwarmEvent> received = new ArrayList<>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(SwarmEvent.TASK_CANCELLED, "task-1")));
        assertEquals(1, received.size());
    }
}
