package fr.lapetina.llm.dispatch.infrastructure.provider;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of provider dialects by configuration name.
 */
public final class ProviderDialects {

    private static final Map<String, Supplier<ProviderDialect>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(OpenAiDialect.NAME, OpenAiDialect::new);
        register("openai-compatible", OpenAiDialect::new);
        register(GeminiDialect.NAME, GeminiDialect::new);
    }

    private ProviderDialects() {
        // Utility class
    }

    public static void register(String name, Supplier<ProviderDialect> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    public static Optional<ProviderDialect> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<ProviderDialect> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    /**
     * Creates the named dialect.
     *
     * @throws IllegalArgumentException if no dialect is registered under that name
     */
    public static ProviderDialect require(String name) {
        return create(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown provider dialect: " + name + ", known: " + REGISTRY.keySet()));
    }
}
