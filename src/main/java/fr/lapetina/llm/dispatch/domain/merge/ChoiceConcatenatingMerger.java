package fr.lapetina.llm.dispatch.domain.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Merges chat completion documents by concatenating their choices.
 *
 * A single body is returned unchanged. For several bodies the first one is the base document;
 * its {@code choices} array is replaced by the choices of every body, re-indexed and tagged
 * with a {@code provider} field, {@code usage} counters are summed and a {@code providers}
 * array lists the contributing provider ids.
 */
public final class ChoiceConcatenatingMerger implements ResponseMerger {

    public static final String NAME = "concat-choices";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public JsonNode merge(List<ProviderResult> successes) {
        if (successes.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        if (successes.size() == 1) {
            return successes.get(0).body().deepCopy();
        }

        JsonNodeFactory factory = JsonNodeFactory.instance;
        JsonNode first = successes.get(0).body();
        ObjectNode merged = first.isObject() ? ((ObjectNode) first).deepCopy() : factory.objectNode();

        ArrayNode choices = factory.arrayNode();
        ObjectNode usage = factory.objectNode();
        ArrayNode providers = factory.arrayNode();

        for (ProviderResult result : successes) {
            providers.add(result.providerId());
            JsonNode body = result.body();

            for (JsonNode choice : body.path("choices")) {
                ObjectNode copy = choice.isObject() ? ((ObjectNode) choice).deepCopy() : factory.objectNode();
                copy.put("index", choices.size());
                copy.put("provider", result.providerId());
                choices.add(copy);
            }

            Iterator<Map.Entry<String, JsonNode>> counters = body.path("usage").fields();
            while (counters.hasNext()) {
                Map.Entry<String, JsonNode> counter = counters.next();
                if (counter.getValue().isIntegralNumber()) {
                    usage.put(counter.getKey(), usage.path(counter.getKey()).asLong(0) + counter.getValue().asLong());
                }
            }
        }

        merged.set("choices", choices);
        if (!usage.isEmpty()) {
            merged.set("usage", usage);
        }
        merged.set("providers", providers);
        return merged;
    }
}
