package fr.lapetina.llm.dispatch.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal passed explicitly to every provider call.
 *
 * Cancellation happens once; callbacks registered before or after it run exactly once,
 * on the cancelling thread or on the registering thread respectively.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Cancels the token.
     *
     * @return true if this call cancelled it, false if it was already cancelled
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "cancelled")) {
            return false;
        }
        for (Registration registration : registrations) {
            registration.fire();
        }
        registrations.clear();
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Registers a callback to run on cancellation; runs it immediately if already cancelled.
     *
     * @return handle removing the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Registration registration = new Registration(callback);
        registrations.add(registration);
        if (isCancelled()) {
            registrations.remove(registration);
            registration.fire();
        }
        return registration;
    }

    /**
     * Creates a token cancelled together with this one. Cancelling the child leaves the parent alone.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration link = onCancel(() -> child.cancel(reason.get()));
        child.onCancel(link::close);
        return child;
    }

    public final class Registration implements AutoCloseable {

        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Registration(Runnable callback) {
            this.callback = callback;
        }

        private void fire() {
            if (done.compareAndSet(false, true)) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("Cancellation callback failed", e);
                }
            }
        }

        @Override
        public void close() {
            done.set(true);
            registrations.remove(this);
        }
    }
}
