package fr.lapetina.llm.dispatch.composite.exception;

/**
 * Exception thrown when a composite call has no target provider.
 *
 * This is a caller or configuration error; an empty target set never yields an empty success.
 */
public final class NoProviderConfiguredException extends DispatchException {

    public NoProviderConfiguredException(String requestId) {
        super("No provider configured for request: " + requestId);
    }
}
