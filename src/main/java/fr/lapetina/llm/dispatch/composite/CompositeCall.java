package fr.lapetina.llm.dispatch.composite;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.dispatch.composite.exception.AllProvidersFailedException;
import fr.lapetina.llm.dispatch.composite.exception.DispatchException;
import fr.lapetina.llm.dispatch.composite.exception.PartialFailureException;
import fr.lapetina.llm.dispatch.domain.event.CompositeCallListener;
import fr.lapetina.llm.dispatch.domain.event.CompositeState;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;
import fr.lapetina.llm.dispatch.domain.merge.ResponseMerger;
import fr.lapetina.llm.dispatch.domain.model.CompositeResult;
import fr.lapetina.llm.dispatch.domain.model.CompositeResult.Outcome;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;
import fr.lapetina.llm.dispatch.infrastructure.http.CancellationToken;
import fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * One fan-out in flight.
 *
 * Slot {@code i} of the result array belongs to target {@code i}; targets are already in
 * registration order, so the final list never depends on completion order. The state only
 * moves forward and exactly one thread performs the merge.
 */
final class CompositeCall {

    private static final Logger log = LoggerFactory.getLogger(CompositeCall.class);

    private final RequestEnvelope envelope;
    private final List<ProviderClient> targets;
    private final MergePolicy policy;
    private final ResponseMerger merger;
    private final CompositeCallListener listener;

    private final Instant startTime = Instant.now();
    private final CancellationToken token = CancellationToken.create();
    private final AtomicReference<CompositeState> state = new AtomicReference<>(CompositeState.PENDING);
    private final AtomicReferenceArray<ProviderResult> results;
    private final AtomicInteger remaining;
    private final AtomicReference<ProviderResult> winner = new AtomicReference<>();
    private final CompletableFuture<CompositeResult> future = new CompletableFuture<>();

    private volatile boolean deadlineExceeded;
    private volatile ScheduledFuture<?> deadlineTask;

    CompositeCall(
            RequestEnvelope envelope,
            List<ProviderClient> targets,
            MergePolicy policy,
            ResponseMerger merger,
            CompositeCallListener listener
    ) {
        this.envelope = envelope;
        this.targets = List.copyOf(targets);
        this.policy = policy;
        this.merger = merger;
        this.listener = listener;
        this.results = new AtomicReferenceArray<>(this.targets.size());
        this.remaining = new AtomicInteger(this.targets.size());
    }

    /**
     * Sends the envelope to every target and arms the deadline, if any.
     */
    CompletableFuture<CompositeResult> start(Duration deadline, ScheduledExecutorService scheduler) {
        if (!transition(CompositeState.PENDING, CompositeState.IN_FLIGHT)) {
            throw new IllegalStateException("Composite call already started: " + envelope.requestId());
        }

        log.info("Composite call started: requestId={}, policy={}, targets={}, deadlineMs={}",
                envelope.requestId(), policy.getConfigName(), targetIds(),
                deadline != null ? deadline.toMillis() : null);

        if (deadline != null) {
            try {
                deadlineTask = scheduler.schedule(this::onDeadline, deadline.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                throw new DispatchException("Dispatcher is closed", e);
            }
        }

        for (int i = 0; i < targets.size(); i++) {
            int index = i;
            ProviderClient client = targets.get(i);
            CompletableFuture<ProviderResult> call;
            try {
                call = client.send(envelope, token);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            call.whenComplete((result, error) -> onProviderResult(index,
                    result != null ? result : ProviderResult.failure(
                            client.getId(), ErrorKind.UNKNOWN, describe(error), elapsed())));
        }
        return future;
    }

    /**
     * Abandons the call: outstanding providers are cancelled and the result is computed from
     * what has arrived.
     */
    void cancel(String reason) {
        if (state.get() != CompositeState.IN_FLIGHT) {
            return;
        }
        token.cancel(reason);
        finish();
    }

    CompletableFuture<CompositeResult> future() {
        return future;
    }

    CompositeState state() {
        return state.get();
    }

    private void onProviderResult(int index, ProviderResult result) {
        if (!results.compareAndSet(index, null, result)) {
            return;
        }
        int left = remaining.decrementAndGet();

        log.debug("Provider answered: requestId={}, providerId={}, status={}, kind={}, remaining={}",
                envelope.requestId(), result.providerId(), result.status(), result.errorKind(), left);

        if (policy == MergePolicy.FIRST_SUCCESS
                && result.isOk()
                && state.get() == CompositeState.IN_FLIGHT
                && winner.compareAndSet(null, result)) {
            log.info("First success: requestId={}, providerId={}, outstanding={}",
                    envelope.requestId(), result.providerId(), left);
            token.cancel("superseded by provider " + result.providerId());
            finish();
            return;
        }

        if (left == 0) {
            finish();
        }
    }

    private void onDeadline() {
        if (state.get() != CompositeState.IN_FLIGHT) {
            return;
        }
        deadlineExceeded = true;
        log.warn("Composite deadline exceeded: requestId={}, policy={}, outstanding={}",
                envelope.requestId(), policy.getConfigName(), remaining.get());
        token.cancel("composite deadline exceeded");
        finish();
    }

    private void finish() {
        if (!transition(CompositeState.IN_FLIGHT, CompositeState.MERGING)) {
            return;
        }
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }

        Outcome outcome = deadlineExceeded ? Outcome.DEADLINE_EXCEEDED : Outcome.COMPLETED;
        String reason = token.reason().orElse("not completed");
        List<ProviderResult> ordered = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            ProviderResult placeholder = ProviderResult.cancelled(targets.get(i).getId(), reason, elapsed());
            results.compareAndSet(i, null, placeholder);
            ordered.add(results.get(i));
        }

        try {
            CompositeResult result = merge(ordered, outcome);
            transition(CompositeState.MERGING, CompositeState.DONE);
            log.info("Composite call completed: requestId={}, policy={}, outcome={}, successes={}, failed={}, latencyMs={}",
                    envelope.requestId(), policy.getConfigName(), outcome,
                    result.successes().size(), result.failedProviderIds(), result.latency().toMillis());
            notifyListener(outcome.name());
            future.complete(result);
        } catch (DispatchException e) {
            transition(CompositeState.MERGING, CompositeState.DONE);
            log.warn("Composite call failed: requestId={}, policy={}, error={}",
                    envelope.requestId(), policy.getConfigName(), e.getMessage());
            notifyListener(e.getClass().getSimpleName());
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            transition(CompositeState.MERGING, CompositeState.DONE);
            log.error("Merge failed: requestId={}, merger={}", envelope.requestId(), merger.getName(), e);
            notifyListener(DispatchException.class.getSimpleName());
            future.completeExceptionally(new DispatchException("Merge failed: " + e.getMessage(), e));
        }
    }

    private CompositeResult merge(List<ProviderResult> ordered, Outcome outcome) {
        List<ProviderResult> successes = ordered.stream().filter(ProviderResult::isOk).toList();
        JsonNode merged = null;

        switch (policy) {
            case FIRST_SUCCESS -> {
                ProviderResult first = winner.get();
                if (first != null) {
                    merged = merger.merge(List.of(first));
                } else if (outcome == Outcome.COMPLETED) {
                    throw new AllProvidersFailedException(ordered);
                }
            }
            case ALL_REQUIRED -> {
                if (outcome == Outcome.COMPLETED) {
                    List<String> failed = ordered.stream()
                            .filter(ProviderResult::isError)
                            .map(ProviderResult::providerId)
                            .toList();
                    if (!failed.isEmpty()) {
                        throw new PartialFailureException(failed, ordered);
                    }
                    merged = merger.merge(successes);
                }
            }
            case BEST_EFFORT -> {
                if (!successes.isEmpty()) {
                    merged = merger.merge(successes);
                }
            }
        }

        return new CompositeResult(envelope.requestId(), policy, outcome, ordered, merged, elapsed());
    }

    private void notifyListener(String outcome) {
        try {
            listener.onCompositeCall(policy, outcome, elapsed());
        } catch (RuntimeException e) {
            log.warn("Composite listener failed: requestId={}, error={}", envelope.requestId(), e.getMessage());
        }
    }

    private boolean transition(CompositeState from, CompositeState to) {
        if (state.compareAndSet(from, to)) {
            log.debug("Composite state: requestId={}, {} -> {}", envelope.requestId(), from, to);
            return true;
        }
        return false;
    }

    private List<String> targetIds() {
        return targets.stream().map(ProviderClient::getId).toList();
    }

    private Duration elapsed() {
        return Duration.between(startTime, Instant.now());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "no result";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
