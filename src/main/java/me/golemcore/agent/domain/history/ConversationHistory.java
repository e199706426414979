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

import me.golemcore.agent.domain.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-lived conversation that outlives single runs. Mutations and reductions
 * happen under {@link #getLock()}, one writer at a time.
 */
public class ConversationHistory {

    private final String id;
    private final List<Message> messages;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private Instant lastActivity;
    private final ReentrantLock lock = new ReentrantLock();

    public ConversationHistory(String id, Instant createdAt) {
        this(id, List.of(), Map.of(), createdAt, createdAt);
    }

    public ConversationHistory(String id, List<Message> messages, Map<String, String> metadata, Instant createdAt,
            Instant lastActivity) {
        this.id = id;
        this.messages = new ArrayList<>(messages != null ? messages : List.of());
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        this.createdAt = createdAt;
        this.lastActivity = lastActivity;
    }

    public String getId() {
        return id;
    }

    /**
     * Read-only view of the messages.
     */
    public synchronized List<Message> getMessages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized void addMessages(List<Message> added, Instant now) {
        if (added == null || added.isEmpty()) {
            return;
        }
        messages.addAll(added);
        lastActivity = now;
    }

    /**
     * Replaces the whole list, typically with the result of a reduction.
     */
    public synchronized void replaceMessages(List<Message> replacement, Instant now) {
        messages.clear();
        messages.addAll(replacement);
        lastActivity = now;
    }

    public synchronized void clear(Instant now) {
        messages.clear();
        lastActivity = now;
    }

    public synchronized Map<String, String> getMetadata() {
        return Map.copyOf(metadata);
    }

    public synchronized void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public ReentrantLock getLock() {
        return lock;
    }
}
