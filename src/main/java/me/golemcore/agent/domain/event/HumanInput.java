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
import java.util.Map;

/**
 * Helpers for function bodies that need a human decision mid-turn. They go
 * through the ambient coordinator, so the request reaches the outermost
 * transport even from inside a nested agent.
 */
public final class HumanInput {

    private HumanInput() {
    }

    public static CoordinationOutcome requestPermission(String source, String description,
            Map<String, Object> payload, Duration timeout, RunCancellation cancellation) {
        CoordinationRequest request = CoordinationRequest.permission(source, null, description, payload);
        return requireCoordinator().emitAndAwait(request, timeout, cancellation);
    }

    public static CoordinationOutcome askClarification(String source, String question, Duration timeout,
            RunCancellation cancellation) {
        CoordinationRequest request = CoordinationRequest.clarification(source, question);
        return requireCoordinator().emitAndAwait(request, timeout, cancellation);
    }

    /**
     * Reports progress if a coordinator is active; otherwise does nothing.
     */
    public static void reportProgress(String source, String message) {
        AmbientEventCoordinator.current().ifPresent(coordinator -> coordinator.emit(new ProgressEvent(source, message)));
    }

    private static EventCoordinator requireCoordinator() {
        return AmbientEventCoordinator.current()
                .orElseThrow(() -> new IllegalStateException("No event coordinator is active on this thread"));
    }
}
