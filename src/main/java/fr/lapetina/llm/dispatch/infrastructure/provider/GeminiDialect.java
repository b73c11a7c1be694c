package fr.lapetina.llm.dispatch.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.dispatch.domain.model.ErrorDetail;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;

import java.util.Locale;
import java.util.Map;

/**
 * Google Gemini through its OpenAI-compatible endpoint.
 *
 * Requests are OpenAI-shaped, but errors keep the Google RPC shape, sometimes wrapped in a
 * one-element array: {@code [{"error": {"code": 429, "message": "...", "status": "RESOURCE_EXHAUSTED"}}]}.
 */
public final class GeminiDialect implements ProviderDialect {

    public static final String NAME = "gemini";

    private static final Map<String, ErrorKind> RPC_STATUSES = Map.ofEntries(
            Map.entry("UNAUTHENTICATED", ErrorKind.AUTHENTICATION),
            Map.entry("PERMISSION_DENIED", ErrorKind.AUTHENTICATION),
            Map.entry("RESOURCE_EXHAUSTED", ErrorKind.RATE_LIMIT),
            Map.entry("INVALID_ARGUMENT", ErrorKind.MALFORMED_REQUEST),
            Map.entry("FAILED_PRECONDITION", ErrorKind.MALFORMED_REQUEST),
            Map.entry("NOT_FOUND", ErrorKind.MALFORMED_REQUEST),
            Map.entry("OUT_OF_RANGE", ErrorKind.MALFORMED_REQUEST),
            Map.entry("INTERNAL", ErrorKind.SERVER_ERROR),
            Map.entry("UNAVAILABLE", ErrorKind.SERVER_ERROR),
            Map.entry("DEADLINE_EXCEEDED", ErrorKind.SERVER_ERROR)
    );

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ErrorDetail classifyError(int httpStatus, String body, ObjectMapper mapper) {
        JsonNode root = OpenAiDialect.parse(body, mapper);
        if (root.isArray() && !root.isEmpty()) {
            root = root.get(0);
        }
        JsonNode error = root.path("error");

        String message = "HTTP " + httpStatus;
        ErrorKind kind = null;
        if (error.isObject()) {
            if (error.hasNonNull("message")) {
                message = error.get("message").asText();
            }
            String status = error.path("status").asText("");
            kind = RPC_STATUSES.get(status.toUpperCase(Locale.ROOT));
        } else if (error.isTextual()) {
            message = error.asText();
        } else if (body != null && !body.isBlank()) {
            message = "HTTP " + httpStatus + ": " + OpenAiDialect.truncate(body);
        }

        if (kind == null) {
            kind = ErrorKind.fromHttpStatus(httpStatus);
        }
        return new ErrorDetail(kind, message, httpStatus);
    }
}
