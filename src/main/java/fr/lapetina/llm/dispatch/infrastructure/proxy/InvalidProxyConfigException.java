package fr.lapetina.llm.dispatch.infrastructure.proxy;

/**
 * Exception thrown when an explicitly configured proxy URL cannot be used.
 *
 * Raised at client construction and never retried.
 */
public final class InvalidProxyConfigException extends RuntimeException {

    private final String proxyValue;

    public InvalidProxyConfigException(String proxyValue, String reason) {
        super("Invalid proxy configuration: " + reason);
        this.proxyValue = proxyValue;
    }

    public InvalidProxyConfigException(String proxyValue, String reason, Throwable cause) {
        super("Invalid proxy configuration: " + reason, cause);
        this.proxyValue = proxyValue;
    }

    /**
     * The rejected value as configured. May contain credentials, do not log it.
     */
    public String getProxyValue() {
        return proxyValue;
    }
}
