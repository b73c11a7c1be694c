package fr.lapetina.llm.dispatch.domain.event;

import java.time.Instant;

/**
 * Structured diagnostic event emitted once per provider call.
 *
 * @param proxyUsed  redacted proxy URL, or "none"
 * @param statusKind "OK" or the name of the error kind
 * @param httpStatus upstream status, 0 when no response was received
 */
public record ProviderCallEvent(
        String providerId,
        String requestId,
        String proxyUsed,
        String proxySource,
        long latencyMs,
        String statusKind,
        int httpStatus,
        Instant timestamp
) {
    public static final String STATUS_OK = "OK";

    public ProviderCallEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isOk() {
        return STATUS_OK.equals(statusKind);
    }
}
