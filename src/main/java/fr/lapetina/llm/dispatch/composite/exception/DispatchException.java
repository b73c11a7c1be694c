package fr.lapetina.llm.dispatch.composite.exception;

/**
 * Base exception for composite calls that cannot produce a result.
 *
 * Per-provider failures never surface as exceptions; they are carried by the results.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
