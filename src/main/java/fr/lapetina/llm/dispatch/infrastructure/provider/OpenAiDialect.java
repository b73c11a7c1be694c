package fr.lapetina.llm.dispatch.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.dispatch.domain.model.ErrorDetail;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;

import java.util.Locale;
import java.util.Map;

/**
 * OpenAI and OpenAI-compatible servers (vLLM, DeepSeek, OpenRouter...).
 *
 * Error bodies look like {@code {"error": {"message": "...", "type": "...", "code": "..."}}}
 * or, on some compatible servers, {@code {"error": "..."}}.
 */
public final class OpenAiDialect implements ProviderDialect {

    public static final String NAME = "openai";

    private static final Map<String, ErrorKind> KNOWN_TYPES = Map.ofEntries(
            Map.entry("authentication_error", ErrorKind.AUTHENTICATION),
            Map.entry("invalid_api_key", ErrorKind.AUTHENTICATION),
            Map.entry("permission_error", ErrorKind.AUTHENTICATION),
            Map.entry("rate_limit_error", ErrorKind.RATE_LIMIT),
            Map.entry("rate_limit_exceeded", ErrorKind.RATE_LIMIT),
            Map.entry("insufficient_quota", ErrorKind.RATE_LIMIT),
            Map.entry("invalid_request_error", ErrorKind.MALFORMED_REQUEST),
            Map.entry("model_not_found", ErrorKind.MALFORMED_REQUEST),
            Map.entry("context_length_exceeded", ErrorKind.MALFORMED_REQUEST),
            Map.entry("server_error", ErrorKind.SERVER_ERROR),
            Map.entry("api_error", ErrorKind.SERVER_ERROR),
            Map.entry("overloaded_error", ErrorKind.SERVER_ERROR)
    );

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ErrorDetail classifyError(int httpStatus, String body, ObjectMapper mapper) {
        String message = "HTTP " + httpStatus;
        ErrorKind kind = null;

        JsonNode error = parse(body, mapper).path("error");
        if (error.isTextual()) {
            message = error.asText();
        } else if (error.isObject()) {
            if (error.hasNonNull("message")) {
                message = error.get("message").asText();
            }
            // code before type
            kind = lookup(error.path("code").asText(null));
            if (kind == null) {
                kind = lookup(error.path("type").asText(null));
            }
        } else if (body != null && !body.isBlank()) {
            message = "HTTP " + httpStatus + ": " + truncate(body);
        }

        if (kind == null) {
            kind = ErrorKind.fromHttpStatus(httpStatus);
        }
        return new ErrorDetail(kind, message, httpStatus);
    }

    private static ErrorKind lookup(String value) {
        if (value == null) {
            return null;
        }
        return KNOWN_TYPES.get(value.toLowerCase(Locale.ROOT));
    }

    static JsonNode parse(String body, ObjectMapper mapper) {
        if (body == null || body.isBlank()) {
            return mapper.missingNode();
        }
        try {
            return mapper.readTree(body);
        } catch (Exception e) {
            return mapper.missingNode();
        }
    }

    static String truncate(String body) {
        String trimmed = body.strip();
        return trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed;
    }
}
