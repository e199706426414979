package me.golemcore.agent.domain.event;

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
import me.golemcore.agent.domain.model.RunCancellation;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;

/**
 * Default coordinator. The root of a coordinator tree owns an unbounded queue
 * and one daemon thread that drains it; children enqueue on the root and the
 * drain thread dispatches each event to the origin's listeners and then to
 * every ancestor's.
 *
 * <p>
 * Pending waiters are kept in the root as well, keyed by request id, so
 * {@link #resolve} works from any coordinator in the tree.
 */
@Slf4j
public class DefaultEventCoordinator implements EventCoordinator, AutoCloseable {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final List<AgentEventListener> listeners = new CopyOnWriteArrayList<>();
    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();
    private final Map<String, CompletableFuture<CoordinationResponse>> pending = new ConcurrentHashMap<>();
    private final Object drainLock = new Object();

    private volatile DefaultEventCoordinator parent;
    private volatile Thread drainThread;
    private volatile boolean closed;

    public DefaultEventCoordinator() {
    }

    private DefaultEventCoordinator(DefaultEventCoordinator parent) {
        this.parent = parent;
    }

    @Override
    public void emit(AgentEvent event) {
        if (event == null) {
            return;
        }
        DefaultEventCoordinator root = root();
        if (root.closed) {
            log.debug("[Coordinator] Dropping {} emitted after close", event.type());
            return;
        }
        root.ensureDrainThread();
        root.queue.add(new Envelope(this, event));
    }

    @Override
    public CoordinationOutcome emitAndAwait(CoordinationRequest request, Duration timeout,
            RunCancellation cancellation) {
        RunCancellation signal = cancellation != null ? cancellation : RunCancellation.none();
        Duration wait = timeout != null ? timeout : DEFAULT_TIMEOUT;
        Map<String, CompletableFuture<CoordinationResponse>> waiters = root().pending;

        CompletableFuture<CoordinationResponse> waiter = new CompletableFuture<>();
        if (waiters.putIfAbsent(request.id(), waiter) != null) {
            throw new IllegalStateException("Coordination request already pending: " + request.id());
        }

        try {
            emit(request);
            CoordinationResponse response = signal.await(waiter, wait);
            log.debug("[Coordinator] Request {} resolved (approved={})", request.id(), response.approved());
            return CoordinationOutcome.resolved(response);
        } catch (TimeoutException e) {
            waiters.remove(request.id(), waiter);
            if (!waiter.completeExceptionally(e) && !waiter.isCompletedExceptionally()) {
                CoordinationResponse response = waiter.join();
                log.debug("[Coordinator] Request {} resolved at its deadline", request.id());
                return CoordinationOutcome.resolved(response);
            }
            log.info("[Coordinator] {} request {} from '{}' timed out after {}ms", request.kind(), request.id(),
                    request.source(), wait.toMillis());
            emit(new CoordinationClosedEvent(request.id(), CoordinationOutcome.Status.TIMED_OUT));
            return CoordinationOutcome.timedOut();
        } catch (CancellationException e) {
            log.debug("[Coordinator] Request {} cancelled", request.id());
            emit(new CoordinationClosedEvent(request.id(), CoordinationOutcome.Status.CANCELLED));
            return CoordinationOutcome.cancelled();
        } catch (ExecutionException e) {
            log.warn("[Coordinator] Request {} aborted: {}", request.id(), e.getCause().getMessage());
            return CoordinationOutcome.cancelled();
        } finally {
            waiters.remove(request.id(), waiter);
        }
    }

    @Override
    public boolean resolve(String requestId, CoordinationResponse response) {
        if (requestId == null) {
            return false;
        }
        if (response == null) {
            log.warn("[Coordinator] Ignoring empty response for request {}", requestId);
            return false;
        }
        CompletableFuture<CoordinationResponse> waiter = root().pending.remove(requestId);
        if (waiter == null) {
            log.debug("[Coordinator] Ignoring response for unknown or finished request: {}", requestId);
            return false;
        }
        return waiter.complete(response);
    }

    @Override
    public void addListener(AgentEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(AgentEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public EventCoordinator child() {
        return new DefaultEventCoordinator(this);
    }

    @Override
    public int pendingCount() {
        return root().pending.size();
    }

    /**
     * Attaches this coordinator under another one. Only coordinators that have no
     * pending requests of their own should be re-parented.
     *
     * @throws IllegalArgumentException
     *             if the coordinator would become its own ancestor
     */
    public void setParent(DefaultEventCoordinator newParent) {
        if (newParent == this) {
            throw new IllegalArgumentException(
                    "Cannot set coordinator as its own parent (would create infinite loop in event bubbling)");
        }
        for (DefaultEventCoordinator ancestor = newParent; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == this) {
                throw new IllegalArgumentException(
                        "Cycle detected in coordinator hierarchy (would create infinite loop in event bubbling)");
            }
        }
        this.parent = newParent;
    }

    public DefaultEventCoordinator getParent() {
        return parent;
    }

    /**
     * Stops the drain thread and cancels every pending waiter. Events still in the
     * queue are dropped.
     */
    @Override
    public void close() {
        closed = true;
        pending.values().forEach(waiter -> waiter.cancel(false));
        pending.clear();
        Thread thread = drainThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    DefaultEventCoordinator root() {
        DefaultEventCoordinator current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    private void ensureDrainThread() {
        if (drainThread != null) {
            return;
        }
        synchronized (drainLock) {
            if (drainThread == null) {
                Thread thread = new Thread(this::drain, "agent-event-drain");
                thread.setDaemon(true);
                thread.start();
                drainThread = thread;
            }
        }
    }

    private void drain() {
        while (!closed) {
            Envelope envelope;
            try {
                envelope = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (DefaultEventCoordinator target = envelope.origin(); target != null; target = target.parent) {
                target.dispatch(envelope.event());
            }
        }
    }

    private void dispatch(AgentEvent event) {
        for (AgentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[Coordinator] Listener failed on {}: {}", event.type(), e.getMessage(), e);
            }
        }
    }

    private record Envelope(DefaultEventCoordinator origin, AgentEvent event) {
    }
}
