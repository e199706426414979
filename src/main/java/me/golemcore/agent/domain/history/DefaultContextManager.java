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
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageMetadata;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default context manager.
 *
 * <p>
 * Only the region after the most recent summary marker is counted and reduced;
 * everything at or before the marker is left alone so provider prompt caches
 * stay valid. Without a marker the region starts after the leading system
 * messages. System messages inside a reduced span are kept. The cut never
 * separates an assistant tool-call message from its results.
 */
@Slf4j
public class DefaultContextManager implements ContextManager {

    private static final String SUMMARY_PREFIX = "[Conversation summary]\n";

    private final AgentEngineProperties.HistoryProperties settings;
    private final TokenEstimator tokenEstimator;
    private final Summarizer summarizer;
    private final List<ContextProvider> contextProviders;
    private final ReductionTrigger customTrigger;
    private final Clock clock;

    public DefaultContextManager(AgentEngineProperties.HistoryProperties settings, Summarizer summarizer,
            List<ContextProvider> contextProviders, ReductionTrigger customTrigger, Clock clock) {
        this.settings = settings;
        this.tokenEstimator = new TokenEstimator(settings.getCharsPerToken());
        this.summarizer = summarizer;
        this.contextProviders = contextProviders != null ? List.copyOf(contextProviders) : List.of();
        this.customTrigger = customTrigger;
        this.clock = clock;
    }

    @Override
    public List<Message> prepareEffectiveMessages(List<Message> history, List<Message> newMessages) {
        List<Message> prior = history != null ? history : List.of();
        List<Message> incoming = newMessages != null ? newMessages : List.of();
        List<Message> effective = new ArrayList<>(prior.size() + incoming.size() + 1);

        String preamble = settings.getSystemPreamble();
        if (preamble != null && !preamble.isBlank()) {
            effective.add(Message.builder()
                    .role(Message.ROLE_SYSTEM)
                    .content(preamble)
                    .metadata(Map.of(MessageMetadata.PREAMBLE, true))
                    .timestamp(clock.instant())
                    .build());
        }
        effective.addAll(prior);

        for (ContextProvider provider : contextProviders) {
            List<Message> injected = provider.provide(prior, incoming);
            if (injected == null) {
                continue;
            }
            for (Message message : injected) {
                effective.add(message.withMetadata(MessageMetadata.INJECTED_CONTEXT, true));
            }
        }

        effective.addAll(incoming);
        return effective;
    }

    @Override
    public boolean shouldReduce(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return false;
        }
        List<Message> region = messages.subList(regionStart(messages), messages.size());

        if (customTrigger != null) {
            return customTrigger.shouldReduce(region);
        }
        if (settings.getContextWindowTokens() > 0 && settings.getTriggerPercentage() > 0) {
            double limit = settings.getContextWindowTokens() * settings.getTriggerPercentage() / 100.0;
            return tokenEstimator.estimate(region) >= limit;
        }
        if (settings.getMaxTokens() > 0) {
            return tokenEstimator.estimate(region) > settings.getMaxTokens();
        }
        long count = region.stream().filter(message -> !message.isSystemMessage()).count();
        return count > (long) settings.getTargetMessageCount() + settings.getSummarizationThreshold();
    }

    @Override
    public ReductionResult reduceIfNeeded(List<Message> messages) {
        if (!shouldReduce(messages)) {
            return ReductionResult.unchanged(messages);
        }
        return reduce(messages, settings.getStrategy());
    }

    @Override
    public ReductionResult reduce(List<Message> messages, ReductionStrategy strategy) {
        int size = messages.size();
        int start = regionStart(messages);
        int cut = size - Math.max(0, settings.getTargetMessageCount());
        while (cut > start && cut < size && messages.get(cut).isToolMessage()) {
            cut--;
        }
        if (cut <= start) {
            return ReductionResult.unchanged(messages);
        }

        List<Message> retainedSystem = new ArrayList<>();
        List<Message> removed = new ArrayList<>();
        for (Message message : messages.subList(start, cut)) {
            if (message.isSystemMessage()) {
                retainedSystem.add(message);
            } else {
                removed.add(message);
            }
        }
        if (removed.isEmpty()) {
            return ReductionResult.unchanged(messages);
        }

        Message summary = null;
        ReductionStrategy applied = ReductionStrategy.TRUNCATE;
        if (strategy == ReductionStrategy.SUMMARIZE) {
            Optional<String> text = summarize(removed);
            if (text.isPresent()) {
                summary = createSummaryMessage(text.get(), removed.size());
                applied = ReductionStrategy.SUMMARIZE;
            } else {
                log.warn("[History] Summarization unavailable, falling back to truncation");
            }
        }

        List<Message> result = new ArrayList<>(start + retainedSystem.size() + 1 + size - cut);
        result.addAll(messages.subList(0, start));
        result.addAll(retainedSystem);
        if (summary != null) {
            result.add(summary);
        }
        result.addAll(messages.subList(cut, size));

        log.info("[History] Reduced {} -> {} messages ({}, {} removed)", size, result.size(), applied,
                removed.size());
        return new ReductionResult(result, removed.size(), summary, applied);
    }

    private Optional<String> summarize(List<Message> span) {
        if (summarizer == null) {
            return Optional.empty();
        }
        try {
            return summarizer.summarize(span).filter(text -> !text.isBlank());
        } catch (RuntimeException e) {
            log.warn("[History] Summarizer failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    Message createSummaryMessage(String summary, int summarizedCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MessageMetadata.SUMMARY, true);
        metadata.put(MessageMetadata.SUMMARIZED_COUNT, summarizedCount);
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_SYSTEM)
                .content(SUMMARY_PREFIX + summary)
                .metadata(metadata)
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Index of the first message that reduction may touch.
     */
    static int regionStart(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isSummary()) {
                return i + 1;
            }
        }
        int start = 0;
        while (start < messages.size() && messages.get(start).isSystemMessage()) {
            start++;
        }
        return start;
    }
}
