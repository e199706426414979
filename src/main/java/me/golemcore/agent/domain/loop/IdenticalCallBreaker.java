package me.golemcore.agent.domain.loop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.agent.domain.model.Message;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stops a run that keeps calling the same function with the same arguments.
 * Checked before a batch runs: if executing it would make some function reach
 * the threshold of identical consecutive calls, the batch is not executed.
 */
public class IdenticalCallBreaker {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final int threshold;
    private final Map<String, String> lastSignature = new HashMap<>();
    private final Map<String, Integer> consecutive = new HashMap<>();

    /**
     * @param threshold
     *            identical consecutive calls that trip the breaker; 0 disables it
     */
    public IdenticalCallBreaker(int threshold) {
        this.threshold = threshold;
    }

    /**
     * @return the first tripped call and the count it would reach
     */
    public Optional<Trip> check(List<Message.ToolCall> toolCalls) {
        if (threshold <= 0 || toolCalls == null) {
            return Optional.empty();
        }
        for (Message.ToolCall toolCall : toolCalls) {
            String signature = signature(toolCall);
            int count = signature.equals(lastSignature.get(toolCall.getName()))
                    ? consecutive.getOrDefault(toolCall.getName(), 0) + 1
                    : 1;
            if (count >= threshold) {
                return Optional.of(new Trip(toolCall.getName(), count));
            }
        }
        return Optional.empty();
    }

    public void record(List<Message.ToolCall> toolCalls) {
        if (threshold <= 0 || toolCalls == null) {
            return;
        }
        for (Message.ToolCall toolCall : toolCalls) {
            String name = toolCall.getName();
            String signature = signature(toolCall);
            if (signature.equals(lastSignature.get(name))) {
                consecutive.merge(name, 1, Integer::sum);
            } else {
                lastSignature.put(name, signature);
                consecutive.put(name, 1);
            }
        }
    }

    static String signature(Message.ToolCall toolCall) {
        if (toolCall.getArguments() == null) {
            return toolCall.getName() + ":" + toolCall.getRawArguments();
        }
        try {
            return toolCall.getName() + ":" + CANONICAL.writeValueAsString(toolCall.getArguments());
        } catch (JsonProcessingException e) {
            return toolCall.getName() + ":" + toolCall.getArguments();
        }
    }

    public record Trip(String toolName, int consecutiveCalls) {
    }
}
