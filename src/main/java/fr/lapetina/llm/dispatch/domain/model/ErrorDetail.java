package fr.lapetina.llm.dispatch.domain.model;

import java.util.Objects;

/**
 * Normalized description of a failed provider call.
 *
 * @param kind       error category
 * @param message    provider message, surfaced verbatim when the provider sent one
 * @param httpStatus upstream HTTP status, or 0 when no response was received
 */
public record ErrorDetail(ErrorKind kind, String message, int httpStatus) {

    public ErrorDetail {
        Objects.requireNonNull(kind, "Error kind is required");
        if (message == null) {
            message = kind.name();
        }
    }

    public static ErrorDetail of(ErrorKind kind, String message) {
        return new ErrorDetail(kind, message, 0);
    }

    public boolean hasHttpStatus() {
        return httpStatus > 0;
    }
}
