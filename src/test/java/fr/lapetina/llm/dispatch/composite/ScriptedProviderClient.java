package fr.lapetina.llm.dispatch.composite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallListener;
import fr.lapetina.llm.dispatch.domain.model.ClientConfig;
import fr.lapetina.llm.dispatch.domain.model.ErrorKind;
import fr.lapetina.llm.dispatch.domain.model.ProviderResult;
import fr.lapetina.llm.dispatch.domain.model.RequestEnvelope;
import fr.lapetina.llm.dispatch.infrastructure.http.CancellationToken;
import fr.lapetina.llm.dispatch.infrastructure.http.ProviderClient;
import fr.lapetina.llm.dispatch.infrastructure.http.TransportPool;
import fr.lapetina.llm.dispatch.infrastructure.provider.ProviderDialects;
import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Provider client answering from a script after a fixed delay, without network I/O.
 * Cancelling the token completes the call as CANCELLED right away.
 */
final class ScriptedProviderClient extends ProviderClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ScheduledExecutorService SCHEDULER = Executors.newScheduledThreadPool(4, r -> {
        Thread t = new Thread(r, "scripted-provider");
        t.setDaemon(true);
        return t;
    });

    private final long delayMs;
    private final ErrorKind failure;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<String> cancelReason = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private ScriptedProviderClient(String id, long delayMs, ErrorKind failure) {
        super(ClientConfig.builder()
                        .id(id)
                        .baseUrl("http://" + id + ".invalid/v1")
                        .model("scripted")
                        .build(),
                new TransportPool(id, 1, ResolvedProxy.none()),
                ProviderDialects.require("openai"),
                ProviderCallListener.noop());
        this.delayMs = delayMs;
        this.failure = failure;
    }

    static ScriptedProviderClient succeeding(String id, long delayMs) {
        return new ScriptedProviderClient(id, delayMs, null);
    }

    static ScriptedProviderClient failing(String id, long delayMs, ErrorKind kind) {
        return new ScriptedProviderClient(id, delayMs, kind);
    }

    static JsonNode body(String id) {
        return MAPPER.createObjectNode()
                .put("id", id + "-completion")
                .put("object", "chat.completion")
                .set("choices", MAPPER.createArrayNode().add(MAPPER.createObjectNode()
                        .put("index", 0)
                        .put("finish_reason", "stop")
                        .set("message", MAPPER.createObjectNode()
                                .put("role", "assistant")
                                .put("content", "answer from " + id))));
    }

    @Override
    public CompletableFuture<ProviderResult> send(RequestEnvelope envelope, CancellationToken token) {
        calls.incrementAndGet();
        CompletableFuture<ProviderResult> result = new CompletableFuture<>();
        long start = System.nanoTime();

        token.onCancel(() -> {
            String reason = token.reason().orElse("cancelled");
            // Reason is recorded before completion wakes the dispatching thread.
            if (!result.isDone() && cancelReason.compareAndSet(null, reason)) {
                result.complete(ProviderResult.cancelled(getId(), reason, elapsed(start)));
            }
        });
        SCHEDULER.schedule(() -> {
            if (failure == null) {
                result.complete(ProviderResult.success(getId(), body(getId()), elapsed(start)));
            } else {
                result.complete(ProviderResult.failure(getId(), failure, getId() + " failed", elapsed(start)));
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        return result;
    }

    @Override
    public void close() {
        closed.set(true);
        super.close();
    }

    int calls() {
        return calls.get();
    }

    String cancelReason() {
        return cancelReason.get();
    }

    boolean isClosed() {
        return closed.get();
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
