package dev.wizards.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous event delivery to an ordered list of listeners.
 *
 * <p>A listener that throws is logged and skipped so the remaining listeners still see the event.
 */
public final class EventEmitter<E> {

    private static final Logger logger = LoggerFactory.getLogger(EventEmitter.class);

    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

    /** Handle returned by {@link #subscribe}; cancelling it removes the listener. */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    public Subscription subscribe(Consumer<? super E> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void emit(E event) {
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.error("Listener failed while handling {}", event, e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
