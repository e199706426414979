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

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers a streamed model response into one logical {@link LlmResponse}. Text
 * and reasoning deltas are concatenated, tool calls are collected by id in
 * arrival order, and the last reported usage wins.
 */
public final class StreamingResponseAggregator {

    private StreamingResponseAggregator() {
    }

    public static Mono<LlmResponse> aggregate(Flux<LlmChunk> chunks) {
        return chunks
                .reduceWith(Accumulator::new, Accumulator::add)
                .map(Accumulator::toResponse);
    }

    private static final class Accumulator {

        private final StringBuilder text = new StringBuilder();
        private final StringBuilder reasoning = new StringBuilder();
        private final Map<String, Message.ToolCall> toolCalls = new LinkedHashMap<>();
        private LlmUsage usage;
        private String finishReason;
        private int anonymousCalls;

        Accumulator add(LlmChunk chunk) {
            if (chunk.getText() != null) {
                text.append(chunk.getText());
            }
            if (chunk.getReasoning() != null) {
                reasoning.append(chunk.getReasoning());
            }
            if (chunk.getToolCalls() != null) {
                for (Message.ToolCall toolCall : chunk.getToolCalls()) {
                    String key = toolCall.getId() != null ? toolCall.getId() : "anonymous-" + anonymousCalls++;
                    toolCalls.put(key, toolCall);
                }
            }
            if (chunk.getUsage() != null) {
                usage = chunk.getUsage();
            }
            if (chunk.getFinishReason() != null) {
                finishReason = chunk.getFinishReason();
            }
            return this;
        }

        LlmResponse toResponse() {
            List<Message.ToolCall> calls = toolCalls.isEmpty() ? null : new ArrayList<>(toolCalls.values());
            return LlmResponse.builder()
                    .content(text.length() > 0 ? text.toString() : null)
                    .reasoning(reasoning.length() > 0 ? reasoning.toString() : null)
                    .toolCalls(calls)
                    .usage(usage)
                    .finishReason(finishReason)
                    .build();
        }
    }
}
