package fr.lapetina.llm.dispatch.domain.model;

/**
 * Error taxonomy for provider calls.
 * Provides a common categorization across heterogeneous upstream error shapes.
 */
public enum ErrorKind {
    /** Credentials rejected or missing permissions (401, 403) */
    AUTHENTICATION,

    /** Provider throttled the call or the quota is exhausted (429) */
    RATE_LIMIT,

    /** Provider rejected the request body, model or parameters (400, 404, 422...) */
    MALFORMED_REQUEST,

    /** Provider failed while handling a valid request (5xx) */
    SERVER_ERROR,

    /** Per-provider deadline expired before a response was received */
    TIMEOUT,

    /** Connection could not be established or broke before a response */
    CONNECTION,

    /** Call was cancelled by the dispatcher before it completed */
    CANCELLED,

    /** Anything that does not fit the categories above */
    UNKNOWN;

    /**
     * Maps an HTTP status to a kind when the error body carries no better hint.
     */
    public static ErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 400 || status == 404 || status == 409 || status == 413 || status == 422) {
            return MALFORMED_REQUEST;
        }
        if (status >= 500 && status < 600) {
            return SERVER_ERROR;
        }
        return UNKNOWN;
    }
}
