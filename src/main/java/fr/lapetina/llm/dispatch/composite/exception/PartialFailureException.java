package fr.lapetina.llm.dispatch.composite.exception;

import fr.lapetina.llm.dispatch.domain.model.ProviderResult;

import java.util.List;

/**
 * Exception thrown under the all-required policy when at least one provider failed.
 */
public final class PartialFailureException extends DispatchException {

    private final List<String> failedProviderIds;
    private final List<ProviderResult> results;

    public PartialFailureException(List<String> failedProviderIds, List<ProviderResult> results) {
        super("Providers failed: " + failedProviderIds);
        this.failedProviderIds = List.copyOf(failedProviderIds);
        this.results = List.copyOf(results);
    }

    public List<String> getFailedProviderIds() {
        return failedProviderIds;
    }

    /**
     * Every result of the call, in registration order.
     */
    public List<ProviderResult> getResults() {
        return results;
    }
}
