package fr.lapetina.llm.dispatch.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One logical chat/completion call handed to the dispatcher.
 * Immutable and thread-safe.
 *
 * @param model      model name, or null to use each provider's configured default
 * @param parameters extra body fields passed through to the provider (temperature, max_tokens...)
 * @param targets    provider ids to dispatch to, empty to let the dispatcher decide
 */
public record RequestEnvelope(
        String requestId,
        String model,
        List<Message> messages,
        Map<String, Object> parameters,
        boolean stream,
        List<String> targets,
        Instant createdAt
) {
    public RequestEnvelope {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message must be provided");
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        messages = List.copyOf(messages);
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    /**
     * Chat message in OpenAI format.
     */
    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }

        public static Message assistant(String content) {
            return new Message("assistant", content);
        }
    }

    /**
     * Creates a non-streaming chat request.
     */
    public static RequestEnvelope ofChat(String model, List<Message> messages) {
        return new RequestEnvelope(null, model, messages, null, false, null, null);
    }

    public boolean hasTargets() {
        return !targets.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private List<Message> messages;
        private Map<String, Object> parameters;
        private boolean stream;
        private List<String> targets;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder targets(List<String> targets) {
            this.targets = targets;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RequestEnvelope build() {
            return new RequestEnvelope(requestId, model, messages, parameters, stream, targets, createdAt);
        }
    }
}
