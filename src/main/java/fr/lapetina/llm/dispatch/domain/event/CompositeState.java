package fr.lapetina.llm.dispatch.domain.event;

/**
 * Lifecycle of a composite call.
 *
 * PENDING -> IN_FLIGHT -> MERGING -> DONE
 */
public enum CompositeState {
    /** Targets resolved, nothing sent yet */
    PENDING,

    /** Provider calls issued, waiting according to the merge policy */
    IN_FLIGHT,

    /** Waiting is over, results being ordered and merged */
    MERGING,

    /** Result or failure handed to the caller */
    DONE
}
