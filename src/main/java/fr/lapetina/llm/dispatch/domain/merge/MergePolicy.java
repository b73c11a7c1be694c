package fr.lapetina.llm.dispatch.domain.merge;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Rule deciding how the provider results of a composite call become one result.
 */
public enum MergePolicy {

    /** Return the first successful body, cancel the calls still in flight */
    FIRST_SUCCESS("first-success"),

    /** Wait for every provider; any failure fails the composite call */
    ALL_REQUIRED("all-required"),

    /** Wait for every provider; merge the successes, record the failures */
    BEST_EFFORT("best-effort");

    private final String configName;

    MergePolicy(String configName) {
        this.configName = configName;
    }

    /**
     * Name used in configuration files.
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Looks a policy up by configuration name ("best-effort") or constant name ("BEST_EFFORT").
     */
    public static Optional<MergePolicy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(policy -> policy.configName.equals(normalized))
                .findFirst();
    }
}
