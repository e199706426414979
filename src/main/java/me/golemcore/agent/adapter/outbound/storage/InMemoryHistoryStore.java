package me.golemcore.agent.adapter.outbound.storage;

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
import me.golemcore.agent.domain.history.ConversationHistory;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.port.outbound.HistoryStorePort;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation store kept in process memory.
 *
 * <p>
 * Conversations are held as encoded snapshots, so callers never share mutable
 * state with the store: every {@link #load(String)} returns a fresh copy and
 * changes become visible only after {@link #save(ConversationHistory)}.
 */
@Slf4j
public class InMemoryHistoryStore implements HistoryStorePort {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();
    private final HistoryJsonCodec codec;
    private final Clock clock;

    public InMemoryHistoryStore(HistoryJsonCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public Optional<ConversationHistory> load(String id) {
        String json = snapshots.get(id);
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(json));
    }

    @Override
    public void save(ConversationHistory history) {
        snapshots.put(history.getId(), codec.encode(history));
        log.debug("[History] Saved conversation {} ({} messages)", history.getId(), history.size());
    }

    @Override
    public void append(String id, List<Message> messages) {
        snapshots.compute(id, (key, json) -> {
            ConversationHistory history = json != null
                    ? codec.decode(json)
                    : new ConversationHistory(key, clock.instant());
            history.addMessages(messages, clock.instant());
            return codec.encode(history);
        });
    }

    @Override
    public void clear(String id) {
        String removed = snapshots.remove(id);
        if (removed != null) {
            log.info("[History] Cleared conversation {}", id);
        }
    }
}
