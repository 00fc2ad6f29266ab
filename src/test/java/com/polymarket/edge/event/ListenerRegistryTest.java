package com.polymarket.edge.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListenerRegistryTest {

    @Test
    void testFanOutSurvivesThrowingListener() {
        ListenerRegistry<String> registry = new ListenerRegistry<>("test");
        List<String> first = new ArrayList<>();
        List<String> last = new ArrayList<>();
        registry.subscribe(first::add);
        registry.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        registry.subscribe(last::add);

        registry.publish("tick");

        assertEquals(List.of("tick"), first);
        assertEquals(List.of("tick"), last);
        assertEquals(3, registry.size());
    }

    @Test
    void testUnsubscribeIsIdempotent() {
        ListenerRegistry<String> registry = new ListenerRegistry<>("test");
        List<String> received = new ArrayList<>();
        Subscription subscription = registry.subscribe(received::add);

        subscription.unsubscribe();
        subscription.unsubscribe();
        registry.publish("ignored");

        assertTrue(received.isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void testNullListenerRejected() {
        ListenerRegistry<String> registry = new ListenerRegistry<>("test");

        assertThrows(NullPointerException.class, () -> registry.subscribe(null));
    }
}
