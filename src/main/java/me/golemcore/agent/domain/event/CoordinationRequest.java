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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Question raised by a running agent that only a human (or the transport
 * acting for one) can answer. The answer is correlated by {@link #id()}.
 *
 * @param source
 *            what asks: a function name, a sub-agent, the loop itself
 */
public record CoordinationRequest(String id, CoordinationKind kind, String source, String prompt,
        Map<String, Object> payload) implements AgentEvent {

    public CoordinationRequest {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static CoordinationRequest permission(String functionName, String callId, String description,
            Map<String, Object> arguments) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (callId != null) {
            payload.put("callId", callId);
        }
        if (arguments != null) {
            payload.put("arguments", new LinkedHashMap<>(arguments));
        }
        String prompt = description != null ? description : "Allow function '" + functionName + "' to run?";
        return new CoordinationRequest(newId(), CoordinationKind.PERMISSION, functionName, prompt, payload);
    }

    public static CoordinationRequest clarification(String source, String question) {
        return new CoordinationRequest(newId(), CoordinationKind.CLARIFICATION, source, question, Map.of());
    }

    public static CoordinationRequest continuation(String runId, int iterations, int extension) {
        return new CoordinationRequest(newId(), CoordinationKind.CONTINUATION, "agent-loop",
                "The agent used " + iterations + " iterations and still wants to call functions. Allow "
                        + extension + " more?",
                Map.of("runId", runId, "iterations", iterations, "extension", extension));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
