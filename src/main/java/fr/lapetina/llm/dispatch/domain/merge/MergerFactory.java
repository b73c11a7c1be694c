package fr.lapetina.llm.dispatch.domain.merge;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for response mergers, looked up by configuration name.
 */
public final class MergerFactory {

    private static final Map<String, Supplier<ResponseMerger>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(ChoiceConcatenatingMerger.NAME, ChoiceConcatenatingMerger::new);
        register(FirstBodyMerger.NAME, FirstBodyMerger::new);
    }

    private MergerFactory() {
        // Utility class
    }

    /**
     * Registers a custom merger.
     *
     * @param name     merger name (used in configuration)
     * @param supplier factory for merger instances
     */
    public static void register(String name, Supplier<ResponseMerger> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    public static Optional<ResponseMerger> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<ResponseMerger> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    /**
     * Creates the named merger, or the choice-concatenating default.
     */
    public static ResponseMerger createOrDefault(String name) {
        return create(name).orElseGet(ChoiceConcatenatingMerger::new);
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
