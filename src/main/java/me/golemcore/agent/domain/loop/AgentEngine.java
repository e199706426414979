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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.history.ContextManager;
import me.golemcore.agent.domain.history.ConversationHistory;
import me.golemcore.agent.domain.history.ReductionResult;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.tools.PermissionMemory;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;
import me.golemcore.agent.port.outbound.HistoryStorePort;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for long-lived conversations. One run per conversation at a
 * time: the history's lock is held from the first model call until the
 * produced messages are appended, reduced and saved.
 */
@Slf4j
public class AgentEngine {

    private final AgentLoop loop;
    private final ContextManager contextManager;
    private final HistoryStorePort historyStore;
    private final AgentEngineProperties.LoopProperties settings;
    private final Clock clock;
    private final Map<String, PermissionMemory> permissionMemories = new ConcurrentHashMap<>();

    public AgentEngine(AgentLoop loop, ContextManager contextManager, HistoryStorePort historyStore,
            AgentEngineProperties.LoopProperties settings, Clock clock) {
        this.loop = loop;
        this.contextManager = contextManager;
        this.historyStore = historyStore;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Loads (or creates) the conversation and runs one turn on it.
     */
    public AgentRunResult run(String conversationId, List<Message> newMessages) {
        ConversationHistory history = historyStore.load(conversationId)
                .orElseGet(() -> new ConversationHistory(conversationId, clock.instant()));
        return run(history, newMessages, RunCancellation.none());
    }

    public AgentRunResult run(ConversationHistory history, List<Message> newMessages) {
        return run(history, newMessages, RunCancellation.none());
    }

    public AgentRunResult run(ConversationHistory history, List<Message> newMessages,
            RunCancellation cancellation) {
        List<Message> incoming = newMessages != null ? newMessages : List.of();
        try {
            history.getLock().lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for conversation " + history.getId());
        }
        try {
            AgentRunRequest request = AgentRunRequest.builder()
                    .history(history.getMessages())
                    .newMessages(incoming)
                    .maxIterations(settings.getMaxIterations())
                    .cancellation(cancellation != null ? cancellation : RunCancellation.none())
                    .permissionMemory(permissionMemories.computeIfAbsent(history.getId(), id -> new PermissionMemory()))
                    .build();

            AgentRunResult result;
            try {
                result = loop.run(request);
            } catch (AgentRunException e) {
                log.warn("[Loop] Conversation {} run failed ({}), keeping partial history", history.getId(),
                        e.getReason());
                commit(history, incoming, e.getPartialTurnHistory());
                throw e;
            }
            commit(history, incoming, result.newMessages());
            return result;
        } finally {
            history.getLock().unlock();
        }
    }

    /**
     * Forgets remembered permission answers of a conversation.
     */
    public void resetPermissions(String conversationId) {
        permissionMemories.remove(conversationId);
    }

    private void commit(ConversationHistory history, List<Message> incoming, List<Message> produced) {
        history.addMessages(incoming, clock.instant());
        history.addMessages(produced, clock.instant());

        ReductionResult reduction = contextManager.reduceIfNeeded(history.getMessages());
        if (reduction.isReduced()) {
            history.replaceMessages(reduction.messages(), clock.instant());
            log.info("[History] Conversation {} reduced by {} messages", history.getId(), reduction.removedCount());
        }
        historyStore.save(history);
    }
}
