package fr.lapetina.llm.dispatch.domain.merge;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;

import java.util.List;

/**
 * Strategy interface combining successful provider bodies into one document.
 *
 * Implementations must be thread-safe and must not modify the bodies they are given.
 */
public interface ResponseMerger {

    /**
     * Returns the name of this merger for configuration.
     */
    String getName();

    /**
     * Merges successful results.
     *
     * @param successes successful results in provider registration order, never empty
     * @return merged document
     */
    JsonNode merge(List<ProviderResult> successes);
}
