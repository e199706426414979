package me.golemcore.agent.domain.history;

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
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;
import me.golemcore.agent.port.outbound.LlmPort;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Summarizes a span of conversation with the model. Returns empty when the
 * model is unavailable, slow or silent, which makes the context manager fall
 * back to truncation.
 */
@Slf4j
public class LlmSummarizer implements Summarizer {

    private static final int MAX_MESSAGE_CHARS = 300;

    private static final String SYSTEM_PROMPT = """
            Provide a detailed but concise summary of the conversation below.
            Focus on information that would be helpful for continuing the conversation.
            Include, when applicable:
            - what has been accomplished
            - what is in progress right now
            - decisions made and their rationale
            - user preferences and constraints
            - important details such as referenced files, commands, settings, IDs/URLs
            - open questions, blockers, and next steps
            Keep it factual. Write in the same language the conversation uses.
            Do NOT include greetings, apologies, or meta-commentary. Output only the summary.""";

    private final LlmPort llmPort;
    private final AgentEngineProperties.HistoryProperties settings;
    private final String model;
    private final Clock clock;

    public LlmSummarizer(LlmPort llmPort, AgentEngineProperties.HistoryProperties settings, String model,
            Clock clock) {
        this.llmPort = llmPort;
        this.settings = settings;
        this.model = model;
        this.clock = clock;
    }

    @Override
    public Optional<String> summarize(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        if (llmPort == null || !llmPort.isAvailable()) {
            log.warn("[History] LLM not available, cannot summarize");
            return Optional.empty();
        }

        LlmRequest request = LlmRequest.builder()
                .model(model)
                .messages(List.of(
                        Message.builder().role(Message.ROLE_SYSTEM).content(SYSTEM_PROMPT).build(),
                        Message.builder().role(Message.ROLE_USER).content(formatConversation(messages)).build()))
                .maxTokens(settings.getSummaryMaxTokens())
                .temperature(0.3)
                .build();

        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request)
                    .get(settings.getSummaryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = clock.millis() - start;
            String summary = response != null ? response.getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[History] LLM returned empty summary");
                return Optional.empty();
            }
            log.info("[History] Summarized {} messages in {}ms ({} chars)", messages.size(), elapsed,
                    summary.length());
            return Optional.of(summary);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[History] LLM summarization interrupted: {}", e.getMessage());
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[History] LLM summarization failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String formatConversation(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .map(m -> m.isToolMessage()
                        ? "tool " + m.getToolName() + ": " + truncate(m.getContent(), MAX_MESSAGE_CHARS)
                        : m.getRole() + ": " + truncate(m.getContent(), MAX_MESSAGE_CHARS))
                .collect(Collectors.joining("\n"));
    }

    private String truncate(String text, int maxLen) {
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
