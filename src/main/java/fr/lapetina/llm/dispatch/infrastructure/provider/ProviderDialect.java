package fr.lapetina.llm.dispatch.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.dispatch.domain.model.ErrorDetail;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;

import java.util.Map;

/**
 * Capability describing one upstream API shape: how requests are encoded and how its
 * error bodies map onto the common error taxonomy.
 *
 * Implementations must be stateless and thread-safe.
 */
public interface ProviderDialect {

    /**
     * Returns the name of this dialect for configuration.
     */
    String getName();

    /**
     * Builds the JSON body of a chat completion request.
     *
     * @param envelope the logical request
     * @param model    model to put in the body, already resolved against the client default
     */
    default ObjectNode buildRequestBody(RequestEnvelope envelope, String model, ObjectMapper mapper) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        for (RequestEnvelope.Message message : envelope.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        body.put("stream", envelope.stream());

        for (Map.Entry<String, Object> parameter : envelope.parameters().entrySet()) {
            if (!body.has(parameter.getKey())) {
                body.set(parameter.getKey(), mapper.valueToTree(parameter.getValue()));
            }
        }
        return body;
    }

    /**
     * Classifies a non-2xx response.
     *
     * @param httpStatus response status
     * @param body       raw response body, possibly empty or not JSON
     */
    ErrorDetail classifyError(int httpStatus, String body, ObjectMapper mapper);
}
