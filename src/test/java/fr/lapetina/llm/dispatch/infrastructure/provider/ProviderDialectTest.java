package fr.lapetina.llm.dispatch.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.dispatch.domain.model.ErrorDetail;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderDialectTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("OpenAiDialect")
    class OpenAiTests {

        private final OpenAiDialect dialect = new OpenAiDialect();

        @Test
        @DisplayName("should prefer error code over type")
        void shouldPreferCode() {
            ErrorDetail detail = dialect.classifyError(429,
                    "{\"error\":{\"message\":\"You exceeded your current quota\",\"type\":\"invalid_request_error\",\"code\":\"insufficient_quota\"}}",
                    mapper);

            assertThat(detail.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
            assertThat(detail.message()).isEqualTo("You exceeded your current quota");
            assertThat(detail.httpStatus()).isEqualTo(429);
        }

        @Test
        @DisplayName("should use type when code is unknown")
        void shouldFallBackToType() {
            ErrorDetail detail = dialect.classifyError(500,
                    "{\"error\":{\"message\":\"bad\",\"type\":\"invalid_request_error\",\"code\":null}}", mapper);

            assertThat(detail.kind()).isEqualTo(ErrorKind.MALFORMED_REQUEST);
        }

        @Test
        @DisplayName("should fall back to status for unknown shapes")
        void shouldFallBackToStatus() {
            assertThat(dialect.classifyError(401, "", mapper).kind()).isEqualTo(ErrorKind.AUTHENTICATION);
            assertThat(dialect.classifyError(403, "forbidden", mapper).kind()).isEqualTo(ErrorKind.AUTHENTICATION);
            assertThat(dialect.classifyError(422, "{}", mapper).kind()).isEqualTo(ErrorKind.MALFORMED_REQUEST);
            assertThat(dialect.classifyError(502, "<html/>", mapper).kind()).isEqualTo(ErrorKind.SERVER_ERROR);
            assertThat(dialect.classifyError(418, null, mapper).kind()).isEqualTo(ErrorKind.UNKNOWN);
        }

        @Test
        @DisplayName("should surface textual errors and truncate raw bodies")
        void shouldSurfaceMessages() {
            assertThat(dialect.classifyError(400, "{\"error\":\"model is required\"}", mapper).message())
                    .isEqualTo("model is required");

            String longBody = "x".repeat(2_000);
            assertThat(dialect.classifyError(500, longBody, mapper).message())
                    .startsWith("HTTP 500: ")
                    .hasSizeLessThan(600);
        }

        @Test
        @DisplayName("should build body without overriding core fields")
        void shouldBuildBody() {
            RequestEnvelope envelope = RequestEnvelope.builder()
                    .messages(List.of(RequestEnvelope.Message.user("hi")))
                    .parameters(Map.of("max_tokens", 16, "stream", true))
                    .build();

            ObjectNode body = dialect.buildRequestBody(envelope, "gpt-4o", mapper);

            assertThat(body.get("model").asText()).isEqualTo("gpt-4o");
            assertThat(body.get("stream").asBoolean()).isFalse();
            assertThat(body.get("max_tokens").asInt()).isEqualTo(16);
            assertThat(body.at("/messages/0/content").asText()).isEqualTo("hi");
        }
    }

    @Nested
    @DisplayName("GeminiDialect")
    class GeminiTests {

        private final GeminiDialect dialect = new GeminiDialect();

        @Test
        @DisplayName("should read array-wrapped RPC status")
        void shouldReadArrayWrappedStatus() {
            ErrorDetail detail = dialect.classifyError(429,
                    "[{\"error\":{\"code\":429,\"message\":\"Quota exceeded\",\"status\":\"RESOURCE_EXHAUSTED\"}}]",
                    mapper);

            assertThat(detail.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
            assertThat(detail.message()).isEqualTo("Quota exceeded");
        }

        @Test
        @DisplayName("should map RPC statuses regardless of HTTP status")
        void shouldMapStatuses() {
            assertThat(dialect.classifyError(400,
                    "{\"error\":{\"code\":400,\"message\":\"API key not valid\",\"status\":\"UNAUTHENTICATED\"}}", mapper).kind())
                    .isEqualTo(ErrorKind.AUTHENTICATION);
            assertThat(dialect.classifyError(400,
                    "{\"error\":{\"code\":400,\"message\":\"bad\",\"status\":\"INVALID_ARGUMENT\"}}", mapper).kind())
                    .isEqualTo(ErrorKind.MALFORMED_REQUEST);
            assertThat(dialect.classifyError(503,
                    "{\"error\":{\"code\":503,\"message\":\"busy\",\"status\":\"UNAVAILABLE\"}}", mapper).kind())
                    .isEqualTo(ErrorKind.SERVER_ERROR);
        }

        @Test
        @DisplayName("should fall back to HTTP status")
        void shouldFallBackToStatus() {
            assertThat(dialect.classifyError(429, "Too Many Requests", mapper).kind()).isEqualTo(ErrorKind.RATE_LIMIT);
        }
    }

    @Nested
    @DisplayName("ProviderDialects")
    class RegistryTests {

        @Test
        @DisplayName("should resolve built-in names case-insensitively")
        void shouldResolveBuiltIns() {
            assertThat(ProviderDialects.require("openai")).isInstanceOf(OpenAiDialect.class);
            assertThat(ProviderDialects.require("OpenAI-Compatible")).isInstanceOf(OpenAiDialect.class);
            assertThat(ProviderDialects.require("gemini")).isInstanceOf(GeminiDialect.class);
        }

        @Test
        @DisplayName("should reject unknown dialects")
        void shouldRejectUnknown() {
            assertThat(ProviderDialects.create("anthropic-native")).isEmpty();
            assertThatThrownBy(() -> ProviderDialects.require("anthropic-native"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("anthropic-native");
        }
    }
}
