package fr.lapetina.llm.dispatch.infrastructure.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    @DisplayName("should cancel only once and keep the first reason")
    void shouldCancelOnce() {
        CancellationToken token = CancellationToken.create();

        assertThat(token.cancel("first")).isTrue();
        assertThat(token.cancel("second")).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).contains("first");
    }

    @Test
    @DisplayName("should run registered callbacks exactly once")
    void shouldRunCallbacksOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel("stop");
        token.cancel("stop again");

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should run callback immediately when already cancelled")
    void shouldRunLateCallbackImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel("done");
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should not run closed registrations")
    void shouldSkipClosedRegistration() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        registration.close();
        token.cancel("stop");

        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should keep cancelling other callbacks when one throws")
    void shouldIsolateFailingCallback() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel("stop");

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should propagate cancellation to children only")
    void shouldPropagateToChild() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        CancellationToken otherChild = parent.child();

        otherChild.cancel("child only");
        assertThat(parent.isCancelled()).isFalse();

        parent.cancel("parent");
        assertThat(child.isCancelled()).isTrue();
        assertThat(child.reason()).contains("parent");
        assertThat(otherChild.reason()).contains("child only");
    }
}
