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

import me.golemcore.agent.domain.model.RunCancellation;

import java.time.Duration;

/**
 * Correlated request/response bus between a running agent and whatever drives
 * it (UI, CLI, transport). Nested agent runs get a {@link #child()} whose events
 * bubble up, so one transport sees everything and can answer requests raised at
 * any depth.
 */
public interface EventCoordinator {

    /**
     * Publishes an event without waiting for listeners.
     */
    void emit(AgentEvent event);

    /**
     * Publishes a request and blocks the caller until it is resolved, times out,
     * or the run is cancelled. Always terminates.
     */
    CoordinationOutcome emitAndAwait(CoordinationRequest request, Duration timeout, RunCancellation cancellation);

    default CoordinationOutcome emitAndAwait(CoordinationRequest request, Duration timeout) {
        return emitAndAwait(request, timeout, RunCancellation.none());
    }

    /**
     * Delivers an answer. Unknown or already answered ids and {@code null}
     * responses are ignored.
     *
     * @return {@code true} if a waiter received the response
     */
    boolean resolve(String requestId, CoordinationResponse response);

    void addListener(AgentEventListener listener);

    void removeListener(AgentEventListener listener);

    /**
     * Creates a coordinator for a nested run. Its events reach this coordinator's
     * listeners too.
     */
    EventCoordinator child();

    /**
     * Number of requests currently waiting for an answer.
     */
    int pendingCount();
}
