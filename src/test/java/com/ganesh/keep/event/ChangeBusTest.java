package com.ganesh.keep.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeBusTest {

    @Test
    void testDeliversToMatchingAndCatchAllListeners() {
        ChangeBus bus = new ChangeBus();
        List<String> forA = new ArrayList<>();
        List<String> all = new ArrayList<>();
        bus.subscribe("a", forA::add);
        bus.subscribeAll(all::add);

        bus.publish("a");
        bus.publish("b");

        assertEquals(List.of("a"), forA);
        assertEquals(List.of("a", "b"), all);
    }

    @Test
    void testClosedSubscriptionStopsDelivery() {
        ChangeBus bus = new ChangeBus();
        List<String> seen = new ArrayList<>();
        Subscription subscription = bus.subscribe("a", seen::add);

        bus.publish("a");
        subscription.close();
        bus.publish("a");

        assertEquals(1, seen.size());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        ChangeBus bus = new ChangeBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("a", id -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("a", seen::add);

        assertDoesNotThrow(() -> bus.publish("a"));
        assertEquals(List.of("a"), seen);
    }
}
