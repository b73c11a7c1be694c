package fr.lapetina.llm.dispatch.domain.event;

import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;

import java.time.Duration;

/**
 * Sink for composite call outcomes.
 */
@FunctionalInterface
public interface CompositeCallListener {

    /**
     * Called once per composite call.
     *
     * @param policy  merge policy applied
     * @param outcome COMPLETED, DEADLINE_EXCEEDED, or the simple name of the failure raised
     * @param latency time from dispatch to merge
     */
    void onCompositeCall(MergePolicy policy, String outcome, Duration latency);

    static CompositeCallListener noop() {
        return (policy, outcome, latency) -> { };
    }
}
