package fr.lapetina.llm.dispatch.infrastructure.proxy;

/**
 * Where a resolved proxy came from.
 */
public enum ProxySource {
    /** Configured on the client; environment lookup disabled */
    EXPLICIT,

    /** Taken from HTTP_PROXY / HTTPS_PROXY */
    ENVIRONMENT,

    /** Direct connection */
    NONE
}
