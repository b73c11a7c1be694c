package fr.lapetina.llm.dispatch.domain.model;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of one provider client.
 * Immutable; owned by exactly one ProviderClient.
 */
public final class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final String DEFAULT_COMPLETIONS_PATH = "chat/completions";

    private final String id;
    private final String apiKey;
    private final URI baseUrl;
    private final String model;
    private final Duration timeout;
    private final Duration connectTimeout;
    private final String proxyUrl;
    private final String dialect;
    private final int maxConnections;
    private final String completionsPath;

    private ClientConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.apiKey = builder.apiKey != null ? builder.apiKey : "";
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        String scheme = baseUrl.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Base URL must be http or https: " + baseUrl);
        }
        this.model = builder.model;
        this.timeout = requirePositive(builder.timeout, "timeout");
        this.connectTimeout = requirePositive(builder.connectTimeout, "connectTimeout");
        this.proxyUrl = builder.proxyUrl;
        this.dialect = builder.dialect != null ? builder.dialect : "openai";
        if (builder.maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + builder.maxConnections);
        }
        this.maxConnections = builder.maxConnections;
        this.completionsPath = builder.completionsPath != null ? builder.completionsPath : DEFAULT_COMPLETIONS_PATH;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public String getId() {
        return id;
    }

    public String getApiKey() {
        return apiKey;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Default model used when the request envelope names none. May be null.
     */
    public String getModel() {
        return model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Explicit proxy URL, or null to fall back to the environment.
     */
    public String getProxyUrl() {
        return proxyUrl;
    }

    public String getDialect() {
        return dialect;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public String getCompletionsPath() {
        return completionsPath;
    }

    /**
     * Full completion endpoint. The path is joined to the base URL path, keeping any query
     * string, and is not appended when the base path already ends with it.
     */
    public URI completionsUri() {
        String path = completionsPath.startsWith("/") ? completionsPath.substring(1) : completionsPath;
        String basePath = baseUrl.getRawPath() != null ? baseUrl.getRawPath() : "";
        if (path.isEmpty() || basePath.endsWith("/" + path) || basePath.endsWith("/" + path + "/")) {
            return baseUrl;
        }
        String joined = (basePath.endsWith("/") ? basePath : basePath + "/") + path;
        String query = baseUrl.getRawQuery() != null ? "?" + baseUrl.getRawQuery() : "";
        return URI.create(baseUrl.getScheme() + "://" + baseUrl.getRawAuthority() + joined + query);
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "id='" + id + '\'' +
                ", baseUrl=" + baseUrl +
                ", model='" + model + '\'' +
                ", dialect='" + dialect + '\'' +
                ", timeout=" + timeout +
                ", proxyConfigured=" + (proxyUrl != null && !proxyUrl.isBlank()) +
                ", maxConnections=" + maxConnections +
                ", apiKey=" + (apiKey.isEmpty() ? "<none>" : "****") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String apiKey;
        private URI baseUrl;
        private String model;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private String proxyUrl;
        private String dialect = "openai";
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private String completionsPath = DEFAULT_COMPLETIONS_PATH;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder proxyUrl(String proxyUrl) {
            this.proxyUrl = proxyUrl;
            return this;
        }

        public Builder dialect(String dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder completionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
