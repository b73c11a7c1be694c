package fr.lapetina.llm.dispatch.infrastructure.metrics;

import fr.lapetina.llm.dispatch.domain.event.CompositeCallListener;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallEvent;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallListener;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;
import fr.lapetina.llm.dispatch.infrastructure.http.TransportPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Provider call counters by status and latency timers per provider
 * - Composite call counters by policy and outcome
 * - Pool slot gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements ProviderCallListener, CompositeCallListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> compositeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> compositeTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_dispatch");
    }

    @Override
    public void onProviderCall(ProviderCallEvent event) {
        incrementCallCount(event.providerId(), event.statusKind());
        recordLatency(event.providerId(), Duration.ofMillis(event.latencyMs()));
    }

    @Override
    public void onCompositeCall(MergePolicy policy, String outcome, Duration latency) {
        String key = policy.name() + ":" + outcome;
        compositeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_composite_calls_total")
                        .description("Total number of composite calls")
                        .tag("policy", policy.getConfigName())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        compositeTimers.computeIfAbsent(policy.name(), k ->
                Timer.builder(prefix + "_composite_latency")
                        .description("Composite call latency")
                        .tag("policy", policy.getConfigName())
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the call counter for a provider/status combination.
     */
    public void incrementCallCount(String providerId, String status) {
        String key = providerId + ":" + status;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_calls_total")
                        .description("Total number of provider calls")
                        .tag("provider", providerId)
                        .tag("status", status)
                        .register(registry)
        ).increment();
    }

    /**
     * Records provider call latency.
     */
    public void recordLatency(String providerId, Duration latency) {
        latencyTimers.computeIfAbsent(providerId, k ->
                Timer.builder(prefix + "_provider_latency")
                        .description("Provider call latency")
                        .tag("provider", providerId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers gauges for a provider's pool slots.
     */
    public void registerPoolSlots(String providerId, TransportPool pool) {
        Gauge.builder(prefix + "_pool_leased_slots", pool, TransportPool::leasedSlots)
                .description("Connection slots currently leased")
                .tag("provider", providerId)
                .register(registry);
        Gauge.builder(prefix + "_pool_available_slots", pool, TransportPool::availableSlots)
                .description("Connection slots currently available")
                .tag("provider", providerId)
                .register(registry);
        Gauge.builder(prefix + "_pool_waiting_acquisitions", pool, TransportPool::waitingAcquisitions)
                .description("Callers waiting for a connection slot")
                .tag("provider", providerId)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
