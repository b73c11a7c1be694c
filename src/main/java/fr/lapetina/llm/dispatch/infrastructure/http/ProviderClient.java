package fr.lapetina.llm.dispatch.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallEvent;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallListener;
import fr.lapetina.llm.dispatch.domain.model.ClientConfig;
import fr.lapetina.llm.dispatch.domain.model.ErrorDetail;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;
import fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialect;
import fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialects;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ProxyResolver;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client for one OpenAI-compatible provider.
 *
 * Uses the transport pool's java.net.http.HttpClient for non-blocking I/O. Every call holds
 * a pool slot for its whole duration, runs under a hard deadline and ends as a
 * {@link ProviderResult}: the returned futures never complete exceptionally.
 */
public class ProviderClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderClient.class);

    private final ClientConfig config;
    private final TransportPool pool;
    private final ProviderDialect dialect;
    private final ProviderCallListener listener;
    private final ObjectMapper objectMapper;
    private final SseCompletionAssembler sseAssembler;

    public ProviderClient(
            ClientConfig config,
            TransportPool pool,
            ProviderDialect dialect,
            ProviderCallListener listener
    ) {
        this.config = config;
        this.pool = pool;
        this.dialect = dialect;
        this.listener = listener != null ? listener : ProviderCallListener.noop();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.sseAssembler = new SseCompletionAssembler(objectMapper);

        log.info("ProviderClient created: {}, proxy={}, proxySource={}",
                config, pool.getProxy().redacted(), pool.getProxy().source());
    }

    /**
     * Creates a client with its own transport pool, resolving the proxy once against the base URL.
     *
     * @throws fr.lapetina.llm.dispatch.infrastructure.proxy.InvalidProxyConfigException if the explicit proxy is unusable
     * @throws IllegalArgumentException if the dialect is unknown
     */
    public static ProviderClient create(ClientConfig config, ProxyResolver resolver, ProviderCallListener listener) {
        ResolvedProxy proxy = resolver.resolve(config.getProxyUrl(), config.getBaseUrl());
        ProviderDialect dialect = ProviderDialects.require(config.getDialect());
        TransportPool pool = new TransportPool(
                config.getId(),
                config.getMaxConnections(),
                proxy,
                config.getConnectTimeout(),
                TransportPool.DEFAULT_CLOSE_TIMEOUT
        );
        return new ProviderClient(config, pool, dialect, listener);
    }

    public CompletableFuture<ProviderResult> send(RequestEnvelope envelope) {
        return send(envelope, CancellationToken.create());
    }

    /**
     * Sends a chat completion request.
     *
     * @param envelope request to send
     * @param token    cancellation signal; cancelling it aborts the exchange and releases the slot
     * @return future completed with the normalized result, never exceptionally
     */
    public CompletableFuture<ProviderResult> send(RequestEnvelope envelope, CancellationToken token) {
        Exchange exchange = new Exchange(envelope);
        exchange.result.whenComplete((result, ex) -> publish(exchange, result));

        if (token.isCancelled()) {
            exchange.complete(ProviderResult.cancelled(getId(), token.reason().orElse("cancelled"), exchange.elapsed()));
            return exchange.result;
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to build request: providerId={}, requestId={}, error={}",
                    getId(), envelope.requestId(), e.getMessage());
            exchange.complete(ProviderResult.failure(getId(), ErrorKind.MALFORMED_REQUEST,
                    "Failed to build request: " + e.getMessage(), exchange.elapsed()));
            return exchange.result;
        }

        ScheduledFuture<?> deadline;
        try {
            deadline = pool.timer().schedule(
                    () -> exchange.abort(ProviderResult.failure(getId(), ErrorKind.TIMEOUT,
                            "Request timed out after " + config.getTimeout().toMillis() + "ms", exchange.elapsed())),
                    config.getTimeout().toMillis(),
                    TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            exchange.complete(ProviderResult.failure(getId(), ErrorKind.CONNECTION,
                    "Transport pool closed: " + pool.getName(), exchange.elapsed()));
            return exchange.result;
        }
        CancellationToken.Registration registration = token.onCancel(() -> exchange.abort(
                ProviderResult.cancelled(getId(), token.reason().orElse("cancelled"), exchange.elapsed())));
        exchange.result.whenComplete((result, ex) -> {
            deadline.cancel(false);
            registration.close();
        });

        log.debug("Sending request: providerId={}, requestId={}, endpoint={}, proxy={}, stream={}",
                getId(), envelope.requestId(), httpRequest.uri(), pool.getProxy().redacted(), envelope.stream());

        CompletableFuture<TransportPool.Lease> leaseFuture = pool.acquire();
        exchange.stage.set(leaseFuture);
        leaseFuture.whenComplete((lease, failure) -> {
            if (exchange.result.isDone()) {
                if (lease != null) {
                    lease.close();
                }
                return;
            }
            if (failure != null) {
                exchange.complete(handleException(exchange, failure));
                return;
            }
            dispatch(exchange, httpRequest, lease);
        });
        return exchange.result;
    }

    private void dispatch(Exchange exchange, HttpRequest httpRequest, TransportPool.Lease lease) {
        CompletableFuture<HttpResponse<String>> httpFuture;
        try {
            httpFuture = pool.httpClient().sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            lease.close();
            exchange.complete(handleException(exchange, e));
            return;
        }
        exchange.stage.set(httpFuture);

        httpFuture.whenComplete((response, failure) -> {
            lease.close();
            if (exchange.result.isDone()) {
                return;
            }
            if (failure != null) {
                exchange.complete(handleException(exchange, failure));
            } else {
                exchange.complete(handleResponse(exchange, response));
            }
        });

        // Deadline or cancellation may have fired before the stage was published.
        if (exchange.result.isDone()) {
            httpFuture.cancel(true);
        }
    }

    private HttpRequest buildHttpRequest(RequestEnvelope envelope) throws JsonProcessingException {
        String model = envelope.model() != null ? envelope.model() : config.getModel();
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("No model in request and no default model for provider " + getId());
        }
        ObjectNode body = dialect.buildRequestBody(envelope, model, objectMapper);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(config.completionsUri())
                .timeout(config.getTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", envelope.stream() ? "text/event-stream" : "application/json")
                .header("X-Request-ID", envelope.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        if (!config.getApiKey().isEmpty()) {
            builder.header("Authorization", "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private ProviderResult handleResponse(Exchange exchange, HttpResponse<String> response) {
        int statusCode = response.statusCode();
        exchange.httpStatus = statusCode;
        String requestId = exchange.envelope.requestId();

        if (statusCode >= 200 && statusCode < 300) {
            JsonNode body = parseSuccessBody(exchange, response.body());
            if (body == null) {
                return ProviderResult.failure(getId(),
                        new ErrorDetail(ErrorKind.UNKNOWN, "Provider returned an unreadable body", statusCode),
                        exchange.elapsed());
            }
            log.info("Provider call succeeded: providerId={}, requestId={}, status={}, latencyMs={}",
                    getId(), requestId, statusCode, exchange.elapsed().toMillis());
            return ProviderResult.success(getId(), body, exchange.elapsed());
        }

        ErrorDetail error = dialect.classifyError(statusCode, response.body(), objectMapper);
        log.warn("Provider call failed: providerId={}, requestId={}, status={}, kind={}, error={}, latencyMs={}",
                getId(), requestId, statusCode, error.kind(), error.message(), exchange.elapsed().toMillis());
        return ProviderResult.failure(getId(), error, exchange.elapsed());
    }

    private JsonNode parseSuccessBody(Exchange exchange, String body) {
        if (exchange.envelope.stream()) {
            return sseAssembler.assemble(body);
        }
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse response: providerId={}, requestId={}, error={}",
                    getId(), exchange.envelope.requestId(), e.getOriginalMessage());
            return null;
        }
    }

    private ProviderResult handleException(Exchange exchange, Throwable ex) {
        Throwable cause = unwrap(ex);
        ErrorKind kind = classifyException(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String requestId = exchange.envelope.requestId();

        if (kind == ErrorKind.UNKNOWN) {
            log.error("Provider call failed unexpectedly: providerId={}, requestId={}, error={}",
                    getId(), requestId, message, cause);
        } else {
            log.warn("Provider call failed: providerId={}, requestId={}, kind={}, errorClass={}, error={}",
                    getId(), requestId, kind, cause.getClass().getSimpleName(), message);
        }
        return ProviderResult.failure(getId(), kind, message, exchange.elapsed());
    }

    static ErrorKind classifyException(Throwable cause) {
        if (cause instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        if (cause instanceof HttpConnectTimeoutException) {
            return ErrorKind.CONNECTION;
        }
        if (cause instanceof HttpTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof IOException || cause instanceof IllegalStateException) {
            return ErrorKind.CONNECTION;
        }
        return ErrorKind.UNKNOWN;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void publish(Exchange exchange, ProviderResult result) {
        if (result == null) {
            return;
        }
        int httpStatus = exchange.httpStatus;
        if (httpStatus == 0 && result.isError()) {
            httpStatus = result.error().httpStatus();
        }
        ProviderCallEvent event = new ProviderCallEvent(
                getId(),
                exchange.envelope.requestId(),
                pool.getProxy().redacted(),
                pool.getProxy().source().name(),
                result.latency().toMillis(),
                result.isOk() ? ProviderCallEvent.STATUS_OK : result.errorKind().name(),
                httpStatus,
                Instant.now()
        );
        try {
            listener.onProviderCall(event);
        } catch (RuntimeException e) {
            log.warn("Provider call listener failed: providerId={}, requestId={}",
                    getId(), exchange.envelope.requestId(), e);
        }
    }

    public String getId() {
        return config.getId();
    }

    public ClientConfig getConfig() {
        return config;
    }

    public TransportPool getPool() {
        return pool;
    }

    public ResolvedProxy getProxy() {
        return pool.getProxy();
    }

    public ProviderDialect getDialect() {
        return dialect;
    }

    @Override
    public void close() {
        pool.close();
    }

    @Override
    public String toString() {
        return "ProviderClient{" +
                "id='" + getId() + '\'' +
                ", baseUrl=" + config.getBaseUrl() +
                ", pool=" + pool +
                '}';
    }

    /**
     * State of one call: the caller's future and the stage currently in flight
     * (slot acquisition, then the HTTP exchange), which is cancelled on abort.
     */
    private static final class Exchange {

        private final RequestEnvelope envelope;
        private final Instant startTime = Instant.now();
        private final CompletableFuture<ProviderResult> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> stage = new AtomicReference<>();
        private volatile int httpStatus;

        private Exchange(RequestEnvelope envelope) {
            this.envelope = envelope;
        }

        private Duration elapsed() {
            return Duration.between(startTime, Instant.now());
        }

        private boolean complete(ProviderResult providerResult) {
            return result.complete(providerResult);
        }

        private void abort(ProviderResult providerResult) {
            if (result.complete(providerResult)) {
                CompletableFuture<?> current = stage.get();
                if (current != null) {
                    current.cancel(true);
                }
            }
        }
    }
}
