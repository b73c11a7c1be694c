package fr.lapetina.llm.dispatch.domain.event;

import java.util.List;

/**
 * Sink for per-provider call events.
 *
 * Implementations are invoked from HTTP client threads and must be thread-safe.
 * They must not block.
 */
@FunctionalInterface
public interface ProviderCallListener {

    void onProviderCall(ProviderCallEvent event);

    static ProviderCallListener noop() {
        return event -> { };
    }

    /**
     * Fans an event out to several listeners, in order.
     */
    static ProviderCallListener of(List<? extends ProviderCallListener> listeners) {
        List<ProviderCallListener> copy = List.copyOf(listeners);
        return event -> copy.forEach(listener -> listener.onProviderCall(event));
    }
}
