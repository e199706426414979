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

import java.util.Map;

/**
 * A single admitted call handed to a function body. The cancellation is
 * scoped to this call: it fires when the run is cancelled or the call's
 * deadline passes.
 */
public record ToolInvocation(String callId, String name, Map<String, Object> arguments,
        RunCancellation cancellation) {

    public ToolInvocation {
        arguments = arguments != null ? arguments : Map.of();
        cancellation = cancellation != null ? cancellation : RunCancellation.none();
    }

    public String stringArgument(String key) {
        Object value = arguments.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
