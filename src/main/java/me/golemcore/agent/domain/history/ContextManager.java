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

import java.util.List;

/**
 * Owns the model-facing message list of a run and keeps it inside the context
 * window.
 */
public interface ContextManager {

    /**
     * Builds the list sent to the model: system preamble, prior history, injected
     * context, then the new messages.
     */
    List<Message> prepareEffectiveMessages(List<Message> history, List<Message> newMessages);

    boolean shouldReduce(List<Message> messages);

    ReductionResult reduce(List<Message> messages, ReductionStrategy strategy);

    /**
     * Reduces with the configured strategy when a trigger fires.
     */
    ReductionResult reduceIfNeeded(List<Message> messages);
}
