package fr.lapetina.llm.dispatch.composite.exception;

import fr.lapetina.llm.dispatch.domain.model.ProviderResult;

import java.util.List;

/**
 * Exception thrown under the first-success policy when no provider succeeded.
 */
public final class AllProvidersFailedException extends DispatchException {

    private final List<ProviderResult> results;

    public AllProvidersFailedException(List<ProviderResult> results) {
        super("No provider succeeded: " + results.stream()
                .map(r -> r.providerId() + "=" + r.errorKind())
                .toList());
        this.results = List.copyOf(results);
    }

    public List<ProviderResult> getResults() {
        return results;
    }
}
