package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.history.ConversationHistory;
import me.golemcore.agent.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting long-lived conversations.
 */
public interface HistoryStorePort {

    Optional<ConversationHistory> load(String id);

    void save(ConversationHistory history);

    /**
     * Appends messages to a stored conversation, creating it when absent.
     */
    void append(String id, List<Message> messages);

    void clear(String id);
}
