package fr.lapetina.llm.dispatch.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the dispatcher.
 * Designed to be populated from YAML.
 */
public class DispatchConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private CompositeConfig composite = new CompositeConfig();
    private PoolConfig pool = new PoolConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public CompositeConfig getComposite() { return composite; }
    public void setComposite(CompositeConfig composite) { this.composite = composite; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public ProxyConfig getProxy() { return proxy; }
    public void setProxy(ProxyConfig proxy) { this.proxy = proxy; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One upstream provider. Unset numeric values fall back to the {@code pool} section.
     */
    public static class ProviderConfig {
        private String id;
        private String baseUrl;
        private String apiKey = "";
        private String model;
        private String dialect = "openai";
        private long timeoutMs = 60000;
        private Long connectTimeoutMs;
        private String proxy;
        private Integer maxConnections;
        private String completionsPath;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getDialect() { return dialect; }
        public void setDialect(String dialect) { this.dialect = dialect; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public Long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(Long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public String getProxy() { return proxy; }
        public void setProxy(String proxy) { this.proxy = proxy; }

        public Integer getMaxConnections() { return maxConnections; }
        public void setMaxConnections(Integer maxConnections) { this.maxConnections = maxConnections; }

        public String getCompletionsPath() { return completionsPath; }
        public void setCompletionsPath(String completionsPath) { this.completionsPath = completionsPath; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Fan-out and merge settings.
     */
    public static class CompositeConfig {
        private String mergePolicy = "best-effort";
        private String merger = "concat-choices";
        private long deadlineMs = 0;
        private List<String> defaultTargets = new ArrayList<>();

        public String getMergePolicy() { return mergePolicy; }
        public void setMergePolicy(String mergePolicy) { this.mergePolicy = mergePolicy; }

        public String getMerger() { return merger; }
        public void setMerger(String merger) { this.merger = merger; }

        /** 0 disables the composite deadline */
        public long getDeadlineMs() { return deadlineMs; }
        public void setDeadlineMs(long deadlineMs) { this.deadlineMs = deadlineMs; }

        public List<String> getDefaultTargets() { return defaultTargets; }
        public void setDefaultTargets(List<String> defaultTargets) { this.defaultTargets = defaultTargets; }
    }

    /**
     * Connection pool defaults.
     */
    public static class PoolConfig {
        private int maxConnections = 100;
        private long connectTimeoutMs = 10000;
        private long closeTimeoutMs = 30000;

        public int getMaxConnections() { return maxConnections; }
        public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getCloseTimeoutMs() { return closeTimeoutMs; }
        public void setCloseTimeoutMs(long closeTimeoutMs) { this.closeTimeoutMs = closeTimeoutMs; }
    }

    /**
     * Ambient proxy settings.
     */
    public static class ProxyConfig {
        private boolean trustEnvironment = true;

        public boolean isTrustEnvironment() { return trustEnvironment; }
        public void setTrustEnvironment(boolean trustEnvironment) { this.trustEnvironment = trustEnvironment; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_dispatch";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
