package fr.lapetina.llm.dispatch.infrastructure.metrics;

import fr.lapetina.llm.dispatch.domain.event.ProviderCallEvent;
import fr.lapetina.llm.dispatch.domain.merge.MergePolicy;
import fr.lapetina.llm.dispatch.infrastructure.http.TransportPool;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry metrics = new MetricsRegistry("test");

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private static ProviderCallEvent event(String providerId, String statusKind, long latencyMs) {
        return new ProviderCallEvent(providerId, "req-1", "none", "NONE", latencyMs, statusKind, 200, null);
    }

    @Test
    @DisplayName("should count provider calls by provider and status")
    void shouldCountProviderCalls() {
        metrics.onProviderCall(event("a", "OK", 12));
        metrics.onProviderCall(event("a", "OK", 30));
        metrics.onProviderCall(event("a", "RATE_LIMIT", 5));

        assertThat(metrics.getRegistry().get("test_provider_calls_total")
                .tag("provider", "a").tag("status", "OK").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("test_provider_calls_total")
                .tag("status", "RATE_LIMIT").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_provider_latency")
                .tag("provider", "a").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("should count composite calls by policy and outcome")
    void shouldCountCompositeCalls() {
        metrics.onCompositeCall(MergePolicy.FIRST_SUCCESS, "COMPLETED", Duration.ofMillis(40));
        metrics.onCompositeCall(MergePolicy.FIRST_SUCCESS, "AllProvidersFailedException", Duration.ofMillis(90));

        assertThat(metrics.getRegistry().get("test_composite_calls_total")
                .tag("policy", "first-success").tag("outcome", "COMPLETED").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_composite_latency")
                .tag("policy", "first-success").timer().count()).isEqualTo(2);
        assertThat(metrics.scrape())
                .contains("test_composite_calls_total")
                .contains("outcome=\"AllProvidersFailedException\"");
    }

    @Test
    @DisplayName("should expose pool slot gauges")
    void shouldExposePoolGauges() {
        try (TransportPool pool = new TransportPool("p", 3, ResolvedProxy.none())) {
            metrics.registerPoolSlots("p", pool);
            TransportPool.Lease lease = pool.tryAcquire().orElseThrow();

            assertThat(metrics.getRegistry().get("test_pool_leased_slots").tag("provider", "p").gauge().value())
                    .isEqualTo(1.0);
            assertThat(metrics.getRegistry().get("test_pool_available_slots").tag("provider", "p").gauge().value())
                    .isEqualTo(2.0);

            lease.close();
            assertThat(metrics.getRegistry().get("test_pool_leased_slots").tag("provider", "p").gauge().value())
                    .isZero();
        }
    }

    @Test
    @DisplayName("should include JVM metrics in the scrape")
    void shouldIncludeJvmMetrics() {
        assertThat(metrics.scrape()).contains("jvm_memory_used_bytes");
    }
}
