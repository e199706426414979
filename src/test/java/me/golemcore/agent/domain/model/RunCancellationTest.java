package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunCancellationTest {

    @Test
    void shouldPropagateCancellationToChildren() {
        RunCancellation parent = RunCancellation.create();
        RunCancellation child = parent.child();

        child.cancel();
        assertFalse(parent.isCancelled());

        RunCancellation sibling = parent.child();
        parent.cancel();
        assertTrue(sibling.isCancelled());
    }

    @Test
    void shouldReleaseAwaitCallbacksWhenWaitEnds() throws Exception {
        RunCancellation cancellation = RunCancellation.create();

        for (int i = 0; i < 100; i++) {
            assertEquals(i, cancellation.await(CompletableFuture.completedFuture(i), Duration.ofSeconds(1)));
        }
        assertThrows(TimeoutException.class,
                () -> cancellation.await(new CompletableFuture<>(), Duration.ofMillis(10)));

        assertEquals(0, cancellation.pendingCallbacks());
    }

    @Test
    void shouldNotRunClosedCallback() {
        RunCancellation cancellation = RunCancellation.create();
        AtomicInteger kept = new AtomicInteger();
        AtomicInteger dropped = new AtomicInteger();

        cancellation.onCancel(kept::incrementAndGet);
        RunCancellation.Registration registration = cancellation.onCancel(dropped::incrementAndGet);
        registration.close();
        cancellation.cancel();
        cancellation.cancel();

        assertEquals(1, kept.get());
        assertEquals(0, dropped.get());
        assertEquals(0, cancellation.pendingCallbacks());
    }

    @Test
    void shouldRunCallbackImmediatelyWhenAlreadyCancelled() {
        RunCancellation cancellation = RunCancellation.create();
        cancellation.cancel();
        AtomicInteger runs = new AtomicInteger();

        cancellation.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertTrue(cancellation.child().isCancelled());
    }

    @Test
    void shouldWakeSleeperOnCancel() {
        RunCancellation cancellation = RunCancellation.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(cancellation::cancel, 50, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            assertThrows(CancellationException.class, () -> cancellation.sleep(Duration.ofSeconds(30)));
            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void shouldSleepFullDurationWhenNotCancelled() {
        RunCancellation cancellation = RunCancellation.create();

        cancellation.sleep(Duration.ofMillis(10));
        cancellation.sleep(Duration.ZERO);

        assertFalse(cancellation.isCancelled());
    }

    @Test
    void shouldCancelAwaitedFuture() {
        RunCancellation cancellation = RunCancellation.create();
        CompletableFuture<String> pending = new CompletableFuture<>();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(cancellation::cancel, 50, TimeUnit.MILLISECONDS);

            assertThrows(CancellationException.class, () -> cancellation.await(pending, Duration.ofSeconds(30)));
            assertTrue(pending.isCancelled());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void shouldTimeOutAwait() {
        RunCancellation cancellation = RunCancellation.create();

        assertThrows(TimeoutException.class,
                () -> cancellation.await(new CompletableFuture<String>(), Duration.ofMillis(20)));
    }

    @Test
    void shouldReturnCompletedValue() throws Exception {
        assertEquals("done", RunCancellation.none().await(CompletableFuture.completedFuture("done"), null));
    }
}
