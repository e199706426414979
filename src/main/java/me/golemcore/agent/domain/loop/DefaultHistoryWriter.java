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

import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageMetadata;
import me.golemcore.agent.domain.tools.ToolExecutionOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendFinalAssistantAnswer(TurnContext context, LlmResponse response) {
        Message assistant = assistantMessage(response, null);
        context.addMessage(assistant);
        context.addTurnMessage(assistant);
    }

    @Override
    public void appendToolRound(TurnContext context, LlmResponse response, List<ToolExecutionOutcome> outcomes) {
        Message assistant = assistantMessage(response, response.getToolCalls());
        context.addMessage(assistant);

        Set<String> ephemeralCallIds = new HashSet<>();
        for (ToolExecutionOutcome outcome : outcomes) {
            if (outcome.ephemeral()) {
                ephemeralCallIds.add(outcome.toolCallId());
            }
        }

        Message persistedAssistant = assistant;
        if (!ephemeralCallIds.isEmpty()) {
            List<Message.ToolCall> kept = assistant.getToolCalls().stream()
                    .filter(toolCall -> !ephemeralCallIds.contains(toolCall.getId()))
                    .toList();
            persistedAssistant = assistant.toBuilder().toolCalls(kept.isEmpty() ? null : kept).build();
        }
        boolean blank = persistedAssistant.getContent() == null || persistedAssistant.getContent().isBlank();
        if (persistedAssistant.hasToolCalls() || !blank) {
            context.addTurnMessage(persistedAssistant);
        }

        for (ToolExecutionOutcome outcome : outcomes) {
            Message toolMessage = toolMessage(outcome);
            context.addMessage(toolMessage);
            if (!outcome.ephemeral()) {
                context.addTurnMessage(toolMessage);
            }
        }
    }

    private Message assistantMessage(LlmResponse response, List<Message.ToolCall> toolCalls) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent())
                .reasoning(response.getReasoning())
                .toolCalls(toolCalls)
                .usage(response.getUsage())
                .metadata(buildAssistantMetadata(response))
                .timestamp(now())
                .build();
    }

    private Message toolMessage(ToolExecutionOutcome outcome) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (outcome.ephemeral()) {
            metadata.put(MessageMetadata.CONTAINER_RESULT, true);
        }
        if (outcome.failureKind() != null) {
            metadata.put(MessageMetadata.FAILURE_KIND, outcome.failureKind().name());
        }
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .metadata(metadata)
                .timestamp(now())
                .build();
    }

    private Map<String, Object> buildAssistantMetadata(LlmResponse response) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        LlmUsage usage = response.getUsage();
        if (usage != null) {
            metadata.put(MessageMetadata.INPUT_TOKENS, usage.getInputTokens());
            metadata.put(MessageMetadata.OUTPUT_TOKENS, usage.getOutputTokens());
        }
        if (response.getModel() != null && !response.getModel().isBlank()) {
            metadata.put("model", response.getModel());
        }
        return metadata;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
