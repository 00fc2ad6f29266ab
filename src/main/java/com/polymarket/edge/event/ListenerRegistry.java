package com.polymarket.edge.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed fan-out channel. Any number of listeners may subscribe; a listener that
 * throws is logged and skipped so the remaining listeners still receive the event.
 */
@Slf4j
public class ListenerRegistry<E> {

    private final String channel;
    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

    public ListenerRegistry(String channel) {
        this.channel = channel;
    }

    public Subscription subscribe(Consumer<? super E> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(E event) {
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("[{}] Listener {} failed on {}", channel, listener, event, e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
