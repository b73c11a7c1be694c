package fr.lapetina.llm.dispatch.infrastructure.http;

import fr.lapetina.llm.dispatch.infrastructure.proxy.ResolvedProxy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportPoolTest {

    private TransportPool pool;

    @BeforeEach
    void setUp() {
        pool = new TransportPool("test", 2, ResolvedProxy.none(), Duration.ofSeconds(1), Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Nested
    @DisplayName("Slot accounting")
    class SlotTests {

        @Test
        @DisplayName("should start with every slot available")
        void shouldStartFull() {
            assertThat(pool.maxConnections()).isEqualTo(2);
            assertThat(pool.availableSlots()).isEqualTo(2);
            assertThat(pool.leasedSlots()).isZero();
        }

        @Test
        @DisplayName("should release slot exactly once")
        void shouldReleaseOnce() throws Exception {
            TransportPool.Lease lease = pool.acquire().get();
            assertThat(pool.availableSlots()).isEqualTo(1);

            lease.close();
            lease.close();

            assertThat(lease.isReleased()).isTrue();
            assertThat(pool.availableSlots()).isEqualTo(2);
            assertThat(pool.leasedSlots()).isZero();
        }

        @Test
        @DisplayName("should refuse tryAcquire when exhausted")
        void shouldRefuseWhenExhausted() {
            Optional<TransportPool.Lease> first = pool.tryAcquire();
            Optional<TransportPool.Lease> second = pool.tryAcquire();
            Optional<TransportPool.Lease> third = pool.tryAcquire();

            assertThat(first).isPresent();
            assertThat(second).isPresent();
            assertThat(third).isEmpty();

            first.get().close();
            second.get().close();
        }

        @Test
        @DisplayName("should hand released slots to waiters in FIFO order")
        void shouldServeWaitersInOrder() throws Exception {
            TransportPool.Lease a = pool.acquire().get();
            TransportPool.Lease b = pool.acquire().get();

            CompletableFuture<TransportPool.Lease> firstWaiter = pool.acquire();
            CompletableFuture<TransportPool.Lease> secondWaiter = pool.acquire();
            assertThat(pool.waitingAcquisitions()).isEqualTo(2);

            a.close();
            assertThat(firstWaiter).isCompleted();
            assertThat(secondWaiter).isNotDone();

            b.close();
            assertThat(secondWaiter).isCompleted();
            assertThat(pool.leasedSlots()).isEqualTo(2);

            firstWaiter.get().close();
            secondWaiter.get().close();
            assertThat(pool.availableSlots()).isEqualTo(2);
        }

        @Test
        @DisplayName("should skip cancelled waiters")
        void shouldSkipCancelledWaiters() throws Exception {
            TransportPool.Lease a = pool.acquire().get();
            TransportPool.Lease b = pool.acquire().get();

            CompletableFuture<TransportPool.Lease> cancelled = pool.acquire();
            CompletableFuture<TransportPool.Lease> live = pool.acquire();
            cancelled.cancel(true);

            a.close();

            assertThat(live).isCompleted();
            live.get().close();
            b.close();
            assertThat(pool.availableSlots()).isEqualTo(2);
            assertThat(pool.waitingAcquisitions()).isZero();
        }

        @Test
        @DisplayName("should return to baseline after concurrent acquire and release")
        void shouldReturnToBaselineUnderContention() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            int tasks = 200;
            CountDownLatch done = new CountDownLatch(tasks);
            List<Throwable> errors = new ArrayList<>();

            for (int i = 0; i < tasks; i++) {
                executor.submit(() -> {
                    try (TransportPool.Lease lease = pool.acquire().get(5, TimeUnit.SECONDS)) {
                        assertThat(pool.leasedSlots()).isBetween(1, 2);
                        Thread.sleep(1);
                    } catch (Throwable t) {
                        synchronized (errors) {
                            errors.add(t);
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(errors).isEmpty();
            assertThat(pool.availableSlots()).isEqualTo(2);
            assertThat(pool.leasedSlots()).isZero();
            assertThat(pool.waitingAcquisitions()).isZero();
        }
    }

    @Nested
    @DisplayName("Close")
    class CloseTests {

        @Test
        @DisplayName("should be idempotent")
        void shouldCloseOnce() {
            pool.close();
            pool.close();

            assertThat(pool.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should reject acquisitions after close")
        void shouldRejectAfterClose() {
            pool.close();

            assertThat(pool.tryAcquire()).isEmpty();
            assertThatThrownBy(() -> pool.acquire().get())
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should fail pending waiters on close")
        void shouldFailWaiters() throws Exception {
            TransportPool.Lease a = pool.acquire().get();
            TransportPool.Lease b = pool.acquire().get();
            CompletableFuture<TransportPool.Lease> waiter = pool.acquire();

            CompletableFuture<Void> closing = CompletableFuture.runAsync(pool::close);
            while (!pool.isClosed()) {
                Thread.sleep(5);
            }
            a.close();
            b.close();
            closing.get(5, TimeUnit.SECONDS);

            assertThat(waiter).isCompletedExceptionally();
            assertThat(pool.leasedSlots()).isZero();
        }

        @Test
        @DisplayName("should give up waiting for leases after the close timeout")
        void shouldBoundCloseByTimeout() throws Exception {
            TransportPool.Lease leaked = pool.acquire().get();

            long start = System.nanoTime();
            pool.close();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(pool.isClosed()).isTrue();
            assertThat(elapsedMs).isLessThan(5_000);
            leaked.close();
            assertThat(pool.leasedSlots()).isZero();
        }
    }

    @Nested
    @DisplayName("Proxy binding")
    class ProxyTests {

        @Test
        @DisplayName("should bind HttpClient to the resolved proxy")
        void shouldBindProxy() {
            ResolvedProxy proxy = ResolvedProxy.explicit(URI.create("http://127.0.0.1:3128"));
            try (TransportPool proxied = new TransportPool("proxied", 1, proxy)) {
                assertThat(proxied.getProxy()).isEqualTo(proxy);
                assertThat(proxied.httpClient().proxy()).isPresent();
                assertThat(proxied.httpClient().proxy().get()
                        .select(URI.create("https://api.openai.com/v1")))
                        .hasSize(1)
                        .allSatisfy(p -> assertThat(p.address().toString()).contains("3128"));
            }
        }

        @Test
        @DisplayName("should never use JVM-wide proxy settings without resolved proxy")
        void shouldDisableProxyWhenNone() {
            assertThat(pool.httpClient().proxy()).isPresent();
            assertThat(pool.httpClient().proxy().get()
                    .select(URI.create("https://api.openai.com/v1")))
                    .allSatisfy(p -> assertThat(p.type()).isEqualTo(java.net.Proxy.Type.DIRECT));
        }
    }
}
