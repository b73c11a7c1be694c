package fr.lapetina.llm.dispatch.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Folds a server-sent event stream of {@code chat.completion.chunk} objects into one
 * {@code chat.completion} document.
 *
 * Lines not starting with {@code data:} are ignored, {@code [DONE]} ends the stream, and
 * chunks that are not valid JSON are skipped.
 */
public final class SseCompletionAssembler {

    private static final Logger log = LoggerFactory.getLogger(SseCompletionAssembler.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    public SseCompletionAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Assembles the stream.
     *
     * @return the completion document, or null if the stream held no completion chunk
     */
    public ObjectNode assemble(String streamBody) {
        if (streamBody == null || streamBody.isEmpty()) {
            return null;
        }

        ObjectNode header = null;
        Map<Integer, ChoiceState> choices = new TreeMap<>();
        JsonNode usage = null;
        int chunks = 0;

        for (String rawLine : streamBody.split("\n")) {
            String line = rawLine.strip();
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }
            String data = line.substring(DATA_PREFIX.length()).strip();
            if (data.isEmpty()) {
                continue;
            }
            if (DONE_MARKER.equals(data)) {
                break;
            }

            JsonNode chunk;
            try {
                chunk = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed stream chunk: error={}, data={}", e.getOriginalMessage(), data);
                continue;
            }
            if (!chunk.isObject()) {
                continue;
            }
            chunks++;

            if (header == null) {
                header = objectMapper.createObjectNode();
                copyIfPresent(chunk, header, "id");
                copyIfPresent(chunk, header, "created");
                copyIfPresent(chunk, header, "model");
                copyIfPresent(chunk, header, "system_fingerprint");
            }
            if (chunk.hasNonNull("usage")) {
                usage = chunk.get("usage");
            }

            for (JsonNode choice : chunk.path("choices")) {
                int index = choice.path("index").asInt(0);
                ChoiceState state = choices.computeIfAbsent(index, i -> new ChoiceState());
                JsonNode delta = choice.path("delta");
                if (delta.hasNonNull("role")) {
                    state.role = delta.get("role").asText();
                }
                if (delta.hasNonNull("content")) {
                    state.content.append(delta.get("content").asText());
                }
                if (choice.hasNonNull("finish_reason")) {
                    state.finishReason = choice.get("finish_reason").asText();
                }
            }
        }

        if (header == null || choices.isEmpty()) {
            log.debug("Stream contained no completion choices: chunks={}", chunks);
            return null;
        }

        ObjectNode completion = header;
        completion.put("object", "chat.completion");
        ArrayNode choiceArray = completion.putArray("choices");
        for (Map.Entry<Integer, ChoiceState> entry : choices.entrySet()) {
            ChoiceState state = entry.getValue();
            ObjectNode choice = choiceArray.addObject();
            choice.put("index", entry.getKey());
            choice.putObject("message")
                    .put("role", state.role)
                    .put("content", state.content.toString());
            if (state.finishReason != null) {
                choice.put("finish_reason", state.finishReason);
            } else {
                choice.putNull("finish_reason");
            }
        }
        if (usage != null) {
            completion.set("usage", usage.deepCopy());
        }
        return completion;
    }

    private static void copyIfPresent(JsonNode from, ObjectNode to, String field) {
        if (from.hasNonNull(field)) {
            to.set(field, from.get(field).deepCopy());
        }
    }

    private static final class ChoiceState {
        private String role = "assistant";
        private final StringBuilder content = new StringBuilder();
        private String finishReason;
    }
}
