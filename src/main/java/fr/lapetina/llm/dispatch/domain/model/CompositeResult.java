package fr.lapetina.llm.dispatch.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of one composite call.
 *
 * {@code results} holds one entry per target provider, in provider registration order.
 * {@code mergedBody} is null when no successful body could be merged.
 */
public record CompositeResult(
        String requestId,
        MergePolicy policy,
        Outcome outcome,
        List<ProviderResult> results,
        JsonNode mergedBody,
        Duration latency
) {
    public enum Outcome {
        /** Every provider needed by the policy answered */
        COMPLETED,

        /** The composite deadline expired and outstanding calls were cancelled */
        DEADLINE_EXCEEDED
    }

    public CompositeResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(policy, "Merge policy is required");
        Objects.requireNonNull(outcome, "Outcome is required");
        results = results != null ? List.copyOf(results) : List.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isDeadlineExceeded() {
        return outcome == Outcome.DEADLINE_EXCEEDED;
    }

    public boolean hasMergedBody() {
        return mergedBody != null;
    }

    public List<ProviderResult> successes() {
        return results.stream().filter(ProviderResult::isOk).toList();
    }

    public List<String> failedProviderIds() {
        return results.stream()
                .filter(ProviderResult::isError)
                .map(ProviderResult::providerId)
                .toList();
    }
}
