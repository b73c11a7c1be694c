package fr.lapetina.llm.dispatch.domain.merge;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;

import java.util.List;

/**
 * Keeps the body of the first successful provider in registration order.
 */
public final class FirstBodyMerger implements ResponseMerger {

    public static final String NAME = "first";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public JsonNode merge(List<ProviderResult> successes) {
        if (successes.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        return successes.get(0).body().deepCopy();
    }
}
