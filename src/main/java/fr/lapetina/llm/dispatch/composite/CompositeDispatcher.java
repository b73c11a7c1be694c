package fr.lapetina.llm.dispatch.composite;

import fr.lapetina.llm.dispatch.composite.exception.DispatchException;
import fr.lapetina.llm.dispatch.composite.exception.NoProviderConfiguredException;
import fr.lapetina.llm.dispatch.domain.event.CompositeCallListener;
import fr.lapetina.llm.dispatch.domain.merge.ChoiceConcatenatingMerger;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;
import fr.lapetina.llm.dispatch.domain.merge.ResponseMerger;
import fr.lapetina.llm.dispatch.domain.model.CompositeResult;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;
import fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans one request out to several providers and merges their answers.
 *
 * <p>Providers are kept in registration order. Whatever order the calls complete in, the
 * {@link CompositeResult#results()} list follows that order.
 *
 * <h2>Target selection</h2>
 * <ol>
 *   <li>the collection passed to {@code dispatch}</li>
 *   <li>the ids in {@link RequestEnvelope#targets()}</li>
 *   <li>the configured default targets</li>
 *   <li>every registered provider</li>
 * </ol>
 *
 * <h2>Merge policies</h2>
 * <ul>
 *   <li>{@link MergePolicy#FIRST_SUCCESS} - first success wins, the others are cancelled</li>
 *   <li>{@link MergePolicy#ALL_REQUIRED} - every provider must succeed</li>
 *   <li>{@link MergePolicy#BEST_EFFORT} - successes are merged, failures are recorded</li>
 * </ul>
 */
public final class CompositeDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompositeDispatcher.class);

    private final Map<String, ProviderClient> providers = new LinkedHashMap<>();
    private final MergePolicy defaultPolicy;
    private final ResponseMerger merger;
    private final Duration defaultDeadline;
    private final List<String> defaultTargets;
    private final CompositeCallListener listener;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CompositeDispatcher(Builder builder) {
        this.defaultPolicy = builder.defaultPolicy;
        this.merger = builder.merger;
        this.defaultDeadline = builder.defaultDeadline;
        this.defaultTargets = List.copyOf(builder.defaultTargets);
        this.listener = builder.listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "composite-deadline");
            t.setDaemon(true);
            return t;
        });
        builder.providers.forEach(this::register);

        log.info("Composite dispatcher created: policy={}, merger={}, deadlineMs={}, providers={}",
                defaultPolicy.getConfigName(), merger.getName(),
                defaultDeadline != null ? defaultDeadline.toMillis() : null, providers.keySet());
    }

    /**
     * Registers a provider. Registration order is the order of composite results.
     *
     * @throws IllegalArgumentException if a provider with the same id is already registered
     */
    public synchronized CompositeDispatcher register(ProviderClient client) {
        Objects.requireNonNull(client, "Provider client is required");
        if (closed.get()) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        if (providers.containsKey(client.getId())) {
            throw new IllegalArgumentException("Duplicate provider id: " + client.getId());
        }
        providers.put(client.getId(), client);
        log.info("Provider registered: id={}, baseUrl={}, proxy={}",
                client.getId(), client.getConfig().getBaseUrl(), client.getProxy().redacted());
        return this;
    }

    public synchronized Optional<ProviderClient> getProvider(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    /**
     * Returns the registered providers in registration order.
     */
    public synchronized List<ProviderClient> getProviders() {
        return List.copyOf(providers.values());
    }

    public CompositeResult dispatch(RequestEnvelope envelope) {
        return dispatch(envelope, resolveTargets(envelope), defaultPolicy, defaultDeadline);
    }

    public CompositeResult dispatch(RequestEnvelope envelope, Collection<ProviderClient> targets) {
        return dispatch(envelope, targets, defaultPolicy, defaultDeadline);
    }

    /**
     * Dispatches and waits for the merged result.
     *
     * @param deadline overall deadline, or null for none
     * @throws NoProviderConfiguredException if there is no target
     * @throws DispatchException             if the policy cannot produce a result
     */
    public CompositeResult dispatch(
            RequestEnvelope envelope,
            Collection<ProviderClient> targets,
            MergePolicy policy,
            Duration deadline
    ) {
        CompositeCall call = launch(envelope, targets, policy, deadline);
        try {
            return call.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel("caller interrupted");
            throw new DispatchException("Interrupted while waiting for request " + envelope.requestId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DispatchException) {
                throw (DispatchException) cause;
            }
            throw new DispatchException("Composite call failed: " + envelope.requestId(), cause);
        }
    }

    public CompletableFuture<CompositeResult> dispatchAsync(RequestEnvelope envelope) {
        return dispatchAsync(envelope, resolveTargets(envelope), defaultPolicy, defaultDeadline);
    }

    /**
     * Dispatches without blocking. Policy failures complete the future exceptionally.
     *
     * @throws NoProviderConfiguredException if there is no target, before anything is sent
     */
    public CompletableFuture<CompositeResult> dispatchAsync(
            RequestEnvelope envelope,
            Collection<ProviderClient> targets,
            MergePolicy policy,
            Duration deadline
    ) {
        return launch(envelope, targets, policy, deadline).future();
    }

    private CompositeCall launch(
            RequestEnvelope envelope,
            Collection<ProviderClient> targets,
            MergePolicy policy,
            Duration deadline
    ) {
        Objects.requireNonNull(envelope, "Envelope is required");
        if (closed.get()) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        List<ProviderClient> ordered = orderByRegistration(envelope, targets);
        CompositeCall call = new CompositeCall(
                envelope, ordered, policy != null ? policy : defaultPolicy, merger, listener);
        call.start(deadline, scheduler);
        return call;
    }

    private List<ProviderClient> resolveTargets(RequestEnvelope envelope) {
        List<String> ids = envelope.hasTargets() ? envelope.targets() : defaultTargets;
        if (ids.isEmpty()) {
            return getProviders();
        }
        List<ProviderClient> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            resolved.add(getProvider(id).orElseThrow(() ->
                    new IllegalArgumentException("Unknown provider id: " + id)));
        }
        return resolved;
    }

    private List<ProviderClient> orderByRegistration(RequestEnvelope envelope, Collection<ProviderClient> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new NoProviderConfiguredException(envelope.requestId());
        }
        List<ProviderClient> registered = getProviders();
        Map<ProviderClient, Integer> positions = new IdentityHashMap<>();
        for (ProviderClient target : targets) {
            int position = indexOf(registered, target);
            if (position < 0) {
                throw new IllegalArgumentException("Provider not registered: " + target.getId());
            }
            positions.put(target, position);
        }
        List<ProviderClient> ordered = new ArrayList<>(positions.keySet());
        ordered.sort(Comparator.comparingInt(positions::get));
        return ordered;
    }

    private static int indexOf(List<ProviderClient> registered, ProviderClient target) {
        for (int i = 0; i < registered.size(); i++) {
            if (registered.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    public MergePolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public ResponseMerger getMerger() {
        return merger;
    }

    public Optional<Duration> getDefaultDeadline() {
        return Optional.ofNullable(defaultDeadline);
    }

    public List<String> getDefaultTargets() {
        return defaultTargets;
    }

    /**
     * Closes every registered provider client, then the deadline scheduler.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing composite dispatcher: providers={}", providers.size());
        for (ProviderClient client : getProviders()) {
            try {
                client.close();
            } catch (Exception e) {
                log.warn("Error closing provider client: id={}", client.getId(), e);
            }
        }
        scheduler.shutdownNow();
        log.info("Composite dispatcher closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MergePolicy defaultPolicy = MergePolicy.BEST_EFFORT;
        private ResponseMerger merger = new ChoiceConcatenatingMerger();
        private Duration defaultDeadline;
        private List<String> defaultTargets = List.of();
        private CompositeCallListener listener = CompositeCallListener.noop();
        private final List<ProviderClient> providers = new ArrayList<>();

        public Builder defaultPolicy(MergePolicy policy) {
            this.defaultPolicy = Objects.requireNonNull(policy, "Merge policy is required");
            return this;
        }

        public Builder merger(ResponseMerger merger) {
            this.merger = Objects.requireNonNull(merger, "Merger is required");
            return this;
        }

        public Builder defaultDeadline(Duration deadline) {
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("Deadline must be positive: " + deadline);
            }
            this.defaultDeadline = deadline;
            return this;
        }

        public Builder defaultTargets(List<String> targets) {
            this.defaultTargets = targets != null ? targets : List.of();
            return this;
        }

        public Builder listener(CompositeCallListener listener) {
            this.listener = listener != null ? listener : CompositeCallListener.noop();
            return this;
        }

        public Builder provider(ProviderClient client) {
            this.providers.add(client);
            return this;
        }

        public CompositeDispatcher build() {
            return new CompositeDispatcher(this);
        }
    }
}
