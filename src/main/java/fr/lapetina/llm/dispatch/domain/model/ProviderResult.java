package fr.lapetina.llm.dispatch.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one call to one provider.
 *
 * Exactly one of {@code body} and {@code error} is set, depending on {@code status}.
 */
public record ProviderResult(
        String providerId,
        Status status,
        JsonNode body,
        ErrorDetail error,
        Duration latency
) {
    public enum Status {
        OK,
        ERROR
    }

    public ProviderResult {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(status, "Status is required");
        if (status == Status.OK) {
            Objects.requireNonNull(body, "Body is required for a successful result");
            error = null;
        } else {
            Objects.requireNonNull(error, "Error detail is required for a failed result");
            body = null;
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * Error kind of a failed result, or null for a successful one.
     */
    public ErrorKind errorKind() {
        return error != null ? error.kind() : null;
    }

    public static ProviderResult success(String providerId, JsonNode body, Duration latency) {
        return new ProviderResult(providerId, Status.OK, body, null, latency);
    }

    public static ProviderResult failure(String providerId, ErrorDetail error, Duration latency) {
        return new ProviderResult(providerId, Status.ERROR, null, error, latency);
    }

    public static ProviderResult failure(String providerId, ErrorKind kind, String message, Duration latency) {
        return failure(providerId, ErrorDetail.of(kind, message), latency);
    }

    public static ProviderResult cancelled(String providerId, String reason, Duration latency) {
        return failure(providerId, ErrorKind.CANCELLED, reason, latency);
    }
}
