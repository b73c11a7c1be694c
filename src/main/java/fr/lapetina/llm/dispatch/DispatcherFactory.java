package fr.lapetina.llm.dispatch;

import fr.lapetina.llm.dispatch.composite.CompositeDispatcher;
import fr.lapetina.llm.dispatch.domain.event.CompositeCallListener;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallListener;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;
import fr.lapetina.llm.dispatch.domain.merge.MergerFactory;
import fr.lapetina.llm.dispatch.domain.merge.ResponseMerger;
import fr.lapetina.llm.dispatch.domain.model.ClientConfig;
import fr.lapetina.llm.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient;
import fr.lapetina.llm.dispatch.infrastructure.http.TransportPool;
import fr.lapetina.llm.dispatch.infrastructure.log.LoggingCallListener;
import fr.lapetina.llm.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialect;
import fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialects;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ProxyResolver;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Factory for creating a fully-wired dispatcher from configuration.
 * This is the primary entry point for obtaining a configured CompositeDispatcher.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("dispatch.yaml")) {
 *     CompositeDispatcher dispatcher = factory.getDispatcher();
 *     // use dispatcher...
 * }
 * }</pre>
 */
public class DispatcherFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatcherFactory.class);

    private final DispatchConfig config;
    private final ProxyResolver proxyResolver;
    private final MetricsRegistry metricsRegistry;
    private final CompositeDispatcher dispatcher;

    protected DispatcherFactory(DispatchConfig config, Map<String, String> environment) {
        log.info("Initializing DispatcherFactory: providers={}", config.getProviders().size());
        this.config = config;

        MergePolicy policy = MergePolicy.fromName(config.getComposite().getMergePolicy())
                .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                        "Unknown merge policy: " + config.getComposite().getMergePolicy()));
        ResponseMerger merger = MergerFactory.createOrDefault(config.getComposite().getMerger());
        log.info("Using merge policy: {}, merger: {}", policy.getConfigName(), merger.getName());

        // Proxy environment is read once, here
        this.proxyResolver = config.getProxy().isTrustEnvironment()
                ? new ProxyResolver(environment)
                : ProxyResolver.withoutEnvironment();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        ProviderCallListener callListener = metricsRegistry != null
                ? ProviderCallListener.of(List.of(new LoggingCallListener(), metricsRegistry))
                : new LoggingCallListener();
        CompositeCallListener compositeListener = metricsRegistry != null
                ? metricsRegistry
                : CompositeCallListener.noop();

        List<ProviderClient> clients = createClients(callListener);

        long deadlineMs = config.getComposite().getDeadlineMs();
        CompositeDispatcher.Builder builder = CompositeDispatcher.builder()
                .defaultPolicy(policy)
                .merger(merger)
                .defaultDeadline(deadlineMs > 0 ? Duration.ofMillis(deadlineMs) : null)
                .defaultTargets(config.getComposite().getDefaultTargets())
                .listener(compositeListener);
        clients.forEach(builder::provider);
        this.dispatcher = builder.build();

        log.info("DispatcherFactory initialized with {} providers", clients.size());
    }

    /**
     * Creates a factory from the specified configuration file, using the process environment.
     */
    public static DispatcherFactory create(String configPath) {
        return create(configPath, System.getenv());
    }

    /**
     * Creates a factory from the specified configuration file. The environment map feeds both
     * configuration placeholders and proxy resolution.
     */
    public static DispatcherFactory create(String configPath, Map<String, String> environment) {
        DispatchConfig config = new ConfigLoader(configPath, environment).load();
        return new DispatcherFactory(config, environment);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static DispatcherFactory create(DispatchConfig config, Map<String, String> environment) {
        return new DispatcherFactory(config, environment);
    }

    public CompositeDispatcher getDispatcher() {
        return dispatcher;
    }

    public Optional<MetricsRegistry> getMetricsRegistry() {
        return Optional.ofNullable(metricsRegistry);
    }

    public ProxyResolver getProxyResolver() {
        return proxyResolver;
    }

    public DispatchConfig getConfig() {
        return config;
    }

    private List<ProviderClient> createClients(ProviderCallListener callListener) {
        List<ProviderClient> clients = new ArrayList<>();
        try {
            for (DispatchConfig.ProviderConfig providerConfig : config.getProviders()) {
                if (!providerConfig.isEnabled()) {
                    log.info("Skipping disabled provider: id={}", providerConfig.getId());
                    continue;
                }
                ProviderClient client = createClient(toClientConfig(providerConfig), callListener);
                clients.add(client);
                log.debug("Created provider client: {}", client);
            }
        } catch (RuntimeException e) {
            for (ProviderClient client : clients) {
                try {
                    client.close();
                } catch (Exception closeError) {
                    log.warn("Error closing provider client: id={}", client.getId(), closeError);
                }
            }
            if (metricsRegistry != null) {
                metricsRegistry.close();
            }
            throw e;
        }
        return clients;
    }

    private ProviderClient createClient(ClientConfig clientConfig, ProviderCallListener callListener) {
        ResolvedProxy proxy = proxyResolver.resolve(clientConfig.getProxyUrl(), clientConfig.getBaseUrl());
        ProviderDialect dialect = ProviderDialects.require(clientConfig.getDialect());
        TransportPool pool = new TransportPool(
                clientConfig.getId(),
                clientConfig.getMaxConnections(),
                proxy,
                clientConfig.getConnectTimeout(),
                Duration.ofMillis(config.getPool().getCloseTimeoutMs())
        );
        if (metricsRegistry != null) {
            metricsRegistry.registerPoolSlots(clientConfig.getId(), pool);
        }
        return new ProviderClient(clientConfig, pool, dialect, callListener);
    }

    private ClientConfig toClientConfig(DispatchConfig.ProviderConfig providerConfig) {
        DispatchConfig.PoolConfig pool = config.getPool();
        return ClientConfig.builder()
                .id(providerConfig.getId())
                .baseUrl(providerConfig.getBaseUrl())
                .apiKey(providerConfig.getApiKey())
                .model(providerConfig.getModel())
                .dialect(providerConfig.getDialect())
                .timeout(Duration.ofMillis(providerConfig.getTimeoutMs()))
                .connectTimeout(Duration.ofMillis(providerConfig.getConnectTimeoutMs() != null
                        ? providerConfig.getConnectTimeoutMs()
                        : pool.getConnectTimeoutMs()))
                .maxConnections(providerConfig.getMaxConnections() != null
                        ? providerConfig.getMaxConnections()
                        : pool.getMaxConnections())
                .proxyUrl(providerConfig.getProxy())
                .completionsPath(providerConfig.getCompletionsPath())
                .build();
    }

    @Override
    public void close() {
        log.info("Shutting down DispatcherFactory...");

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("DispatcherFactory shut down");
    }
}
