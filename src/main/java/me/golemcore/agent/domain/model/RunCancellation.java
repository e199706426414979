package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal of one agent run. Propagates top-down: child
 * signals created with {@link #child()} are cancelled together with their
 * parent, never the other way round.
 *
 * <p>
 * Every suspension point of a run (model call, coordination wait, tool deadline,
 * retry backoff) goes through {@link #await} or {@link #sleep}, so cancelling
 * unblocks the run immediately.
 */
@Slf4j
public final class RunCancellation {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();
    private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();

    private RunCancellation() {
    }

    /**
     * Creates a fresh signal that nobody has cancelled yet.
     */
    public static RunCancellation none() {
        return new RunCancellation();
    }

    public static RunCancellation create() {
        return new RunCancellation();
    }

    /**
     * Creates a signal that is cancelled when this one is.
     */
    public RunCancellation child() {
        RunCancellation child = new RunCancellation();
        onCancel(child::cancel);
        return child;
    }

    public void cancel() {
        if (!signal.complete(null)) {
            return;
        }
        for (Runnable callback : callbacks) {
            fire(callback);
        }
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * Registers an action to run once when the run is cancelled, immediately if
     * it already is. Closing the returned registration drops the action.
     */
    public Registration onCancel(Runnable action) {
        Runnable callback = action::run;
        callbacks.add(callback);
        if (isCancelled()) {
            fire(callback);
        }
        return () -> callbacks.remove(callback);
    }

    int pendingCallbacks() {
        return callbacks.size();
    }

    private void fire(Runnable callback) {
        // whoever removes the entry runs it, so a racing cancel and register fire it once
        if (!callbacks.remove(callback)) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Run cancelled");
        }
    }

    /**
     * Sleeps for the given duration, returning early with
     * {@link CancellationException} when the run is cancelled.
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            signal.get(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while sleeping");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation signal failed", e.getCause());
        }
        throw new CancellationException("Run cancelled");
    }

    /**
     * Waits for a future. The future is cancelled when the run is cancelled, in
     * which case {@link CancellationException} is thrown.
     *
     * @param timeout
     *            maximum wait, or {@code null} to wait without a deadline
     */
    public <T> T await(CompletableFuture<T> future, Duration timeout)
            throws ExecutionException, TimeoutException {
        throwIfCancelled();
        try (Registration ignored = onCancel(() -> future.cancel(false))) {
            if (timeout == null) {
                return future.get();
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new CancellationException("Interrupted while waiting");
        }
    }

    /**
     * Handle of a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
