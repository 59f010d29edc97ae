package com.hivemind.core.events;

import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final NodeRef PHASE = NodeRef.of(NodeLevel.PHASE, "p1");

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static HivemindEvent event(String type) {
        return new HivemindEvent(type, "launch", PHASE, Map.of(), Instant.now());
    }

    // -- Subscribe and publish ------------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to subscribers of its type")
        void deliversToTypeSubscriber() {
            List<HivemindEvent> received = new ArrayList<>();
            eventBus.subscribe(HivemindEvent.NODE_COMPLETED, received::add);

            var event = event(HivemindEvent.NODE_COMPLETED);
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of other types")
        void skipsOtherTypes() {
            List<HivemindEvent> received = new ArrayList<>();
            eventBus.subscribe(HivemindEvent.VISION_DRIFT, received::add);

            eventBus.publish(event(HivemindEvent.NODE_COMPLETED));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversInOrder() {
            List<HivemindEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(HivemindEvent.NODE_PROGRESS));
            eventBus.publish(event(HivemindEvent.MILESTONE_REACHED));
            eventBus.publish(event(HivemindEvent.NODE_COMPLETED));

            assertEquals(List.of(HivemindEvent.NODE_PROGRESS, HivemindEvent.MILESTONE_REACHED,
                    HivemindEvent.NODE_COMPLETED), received.stream().map(HivemindEvent::eventType).toList());
        }

        @Test
        @DisplayName("global and typed subscribers both receive the event")
        void globalAndTyped() {
            List<HivemindEvent> global = new ArrayList<>();
            List<HivemindEvent> typed = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe(HivemindEvent.TASK_RETRY, typed::add);

            eventBus.publish(event(HivemindEvent.TASK_RETRY));

            assertEquals(1, global.size());
            assertEquals(1, typed.size());
        }
    }

    // -- Unsubscribe ----------------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<HivemindEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(HivemindEvent.TASK_RETRY, received::add);

            eventBus.publish(event(HivemindEvent.TASK_RETRY));
            subscription.unsubscribe();
            eventBus.publish(event(HivemindEvent.TASK_RETRY));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void unsubscribeDoesNotAffectOthers() {
            List<HivemindEvent> first = new ArrayList<>();
            List<HivemindEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(first::add);
            eventBus.subscribeAll(second::add);

            subscription.unsubscribe();
            eventBus.publish(event(HivemindEvent.TASK_ABORTED));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    // -- Concurrency and failures ---------------------------------------------

    @Test
    @DisplayName("handles concurrent publishes safely")
    void concurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<HivemindEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(HivemindEvent.NODE_PROGRESS, received::add);

        int threadCount = 8;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event(HivemindEvent.NODE_PROGRESS));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }

    @Test
    @DisplayName("a throwing subscriber does not prevent delivery to others")
    void subscriberExceptionIsContained() {
        List<HivemindEvent> received = new ArrayList<>();
        eventBus.subscribe(HivemindEvent.VISION_DRIFT, e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe(HivemindEvent.VISION_DRIFT, received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(HivemindEvent.VISION_DRIFT)));
        assertEquals(1, received.size());
    }
}
