package fr.lapetina.llm.dispatch.infrastructure.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Scriptable OpenAI-compatible upstream on the JDK HTTP server.
 *
 * Also works as a plain HTTP forward proxy target: a request sent through a proxy carries
 * an absolute URI, which is recorded as received.
 */
public final class StubUpstream implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor;
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private StubUpstream(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    public static StubUpstream start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        ExecutorService executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        return new StubUpstream(server, executor);
    }

    /**
     * Serves {@code POST {path}} with the given handler.
     */
    public StubUpstream route(String path, Handler handler) {
        server.createContext(path, exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            RecordedRequest request = new RecordedRequest(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI(),
                    exchange.getRequestHeaders().getFirst("Authorization"),
                    exchange.getRequestHeaders().getFirst("Accept"),
                    exchange.getRequestHeaders().getFirst("X-Request-ID"),
                    body);
            requests.add(request);
            Reply reply;
            try {
                reply = handler.handle(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }
            respond(exchange, reply);
        });
        return this;
    }

    /**
     * Base URL of the stub, ending in {@code /v1}.
     */
    public String baseUrl() {
        return "http://127.0.0.1:" + port() + "/v1";
    }

    /**
     * Address of the stub as a proxy URL.
     */
    public String proxyUrl() {
        return "http://127.0.0.1:" + port();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, Reply reply) throws IOException {
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", reply.contentType());
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }

    @FunctionalInterface
    public interface Handler {
        Reply handle(RecordedRequest request) throws InterruptedException;
    }

    public record RecordedRequest(
            String method,
            URI uri,
            String authorization,
            String accept,
            String requestId,
            String body
    ) {
    }

    public record Reply(int status, String body, String contentType) {

        public static Reply json(int status, String body) {
            return new Reply(status, body, "application/json");
        }

        public static Reply sse(String body) {
            return new Reply(200, body, "text/event-stream");
        }

        public static Reply completion(String content) {
            return json(200, completionBody("chatcmpl-1", content));
        }

        /**
         * Replies after {@code delayMs}, as seen by the client.
         */
        public static Reply delayed(long delayMs, Reply reply) throws InterruptedException {
            Thread.sleep(delayMs);
            return reply;
        }
    }

    public static String completionBody(String id, String content) {
        return "{\"id\":\"" + id + "\",\"object\":\"chat.completion\",\"created\":1700000000,"
                + "\"model\":\"gpt-4o-mini\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\","
                + "\"content\":\"" + content + "\"},\"finish_reason\":\"stop\"}],"
                + "\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":3,\"total_tokens\":8}}";
    }
}
