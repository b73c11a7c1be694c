package fr.lapetina.llm.dispatch.infrastructure.http;

import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection pool owned by one provider client.
 *
 * Wraps a java.net.http.HttpClient bound to the client's resolved proxy and bounds the
 * number of concurrent exchanges with slots. A slot is held through a {@link Lease} for
 * the whole exchange and must be closed on every exit path.
 *
 * Thread-safe: slot accounting is guarded by an internal lock, callers need no locking.
 */
public final class TransportPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransportPool.class);

    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final int maxConnections;
    private final ResolvedProxy proxy;
    private final Duration closeTimeout;
    private final ExecutorService executor;
    private final ScheduledExecutorService timer;
    private final HttpClient httpClient;

    private final Object lock = new Object();
    private final Deque<CompletableFuture<Lease>> waiters = new ArrayDeque<>();
    private final CompletableFuture<Void> drained = new CompletableFuture<>();
    private int available;
    private int leased;
    private boolean closed;

    public TransportPool(
            String name,
            int maxConnections,
            ResolvedProxy proxy,
            Duration connectTimeout,
            Duration closeTimeout
    ) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.name = name;
        this.maxConnections = maxConnections;
        this.available = maxConnections;
        this.proxy = proxy;
        this.closeTimeout = closeTimeout;

        this.executor = Executors.newCachedThreadPool(daemonThreads("transport-" + name));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("transport-" + name + "-timer"));

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor);

        // Never fall back to the JVM-wide ProxySelector: the resolver has already decided.
        builder.proxy(proxy.address().map(ProxySelector::of).orElse(HttpClient.Builder.NO_PROXY));
        proxy.credentials().ifPresent(credentials -> builder.authenticator(new ProxyAuthenticator(credentials)));

        this.httpClient = builder.build();

        log.info("TransportPool initialized: name={}, maxConnections={}, proxy={}, proxySource={}",
                name, maxConnections, proxy.redacted(), proxy.source());
    }

    public TransportPool(String name, int maxConnections, ResolvedProxy proxy) {
        this(name, maxConnections, proxy, Duration.ofSeconds(10), DEFAULT_CLOSE_TIMEOUT);
    }

    /**
     * Acquires a slot, waiting in FIFO order when the pool is exhausted.
     *
     * Cancelling the returned future withdraws the request. The future fails with
     * {@link IllegalStateException} once the pool is closed.
     */
    public CompletableFuture<Lease> acquire() {
        CompletableFuture<Lease> waiter;
        int queued;
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Transport pool closed: " + name));
            }
            if (available > 0) {
                available--;
                leased++;
                return CompletableFuture.completedFuture(new Lease());
            }
            waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            queued = waiters.size();
        }
        waiter.whenComplete((lease, ex) -> {
            if (ex != null) {
                synchronized (lock) {
                    waiters.remove(waiter);
                }
            }
        });
        log.debug("Waiting for transport slot: pool={}, waiters={}", name, queued);
        return waiter;
    }

    /**
     * Acquires a slot only if one is free right now.
     */
    public Optional<Lease> tryAcquire() {
        synchronized (lock) {
            if (closed || available == 0) {
                return Optional.empty();
            }
            available--;
            leased++;
            return Optional.of(new Lease());
        }
    }

    private void release() {
        while (true) {
            CompletableFuture<Lease> next;
            synchronized (lock) {
                next = waiters.pollFirst();
                if (next == null) {
                    available++;
                    leased--;
                    if (closed && leased == 0) {
                        drained.complete(null);
                    }
                    return;
                }
            }
            // Hand the slot over outside the lock; a waiter cancelled meanwhile passes it on.
            if (next.complete(new Lease())) {
                return;
            }
        }
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    ScheduledExecutorService timer() {
        return timer;
    }

    public String getName() {
        return name;
    }

    public ResolvedProxy getProxy() {
        return proxy;
    }

    public int maxConnections() {
        return maxConnections;
    }

    public int availableSlots() {
        synchronized (lock) {
            return available;
        }
    }

    public int leasedSlots() {
        synchronized (lock) {
            return leased;
        }
    }

    public int waitingAcquisitions() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Closes the pool once: rejects new acquisitions, fails pending ones, waits for
     * outstanding leases up to the close timeout, then stops the pool threads.
     */
    @Override
    public void close() {
        List<CompletableFuture<Lease>> pending;
        int outstanding;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            pending = new ArrayList<>(waiters);
            waiters.clear();
            outstanding = leased;
            if (leased == 0) {
                drained.complete(null);
            }
        }

        log.info("Closing TransportPool: name={}, outstandingLeases={}, pendingAcquisitions={}",
                name, outstanding, pending.size());

        IllegalStateException closedException = new IllegalStateException("Transport pool closed: " + name);
        pending.forEach(waiter -> waiter.completeExceptionally(closedException));

        try {
            drained.get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("TransportPool closed with leases outstanding: name={}, leased={}", name, leasedSlots());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Unexpected failure while draining pool: name={}", name, e);
        }

        timer.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("TransportPool closed: name={}", name);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String toString() {
        return "TransportPool{" +
                "name='" + name + '\'' +
                ", proxy=" + proxy.redacted() +
                ", leased=" + leasedSlots() +
                "/" + maxConnections +
                '}';
    }

    /**
     * One held slot. Closing it more than once has no effect.
     */
    public final class Lease implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease() {
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }

    private static final class ProxyAuthenticator extends Authenticator {

        private final PasswordAuthentication credentials;

        ProxyAuthenticator(PasswordAuthentication credentials) {
            this.credentials = credentials;
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() == RequestorType.PROXY) {
                return credentials;
            }
            return null;
        }
    }
}
