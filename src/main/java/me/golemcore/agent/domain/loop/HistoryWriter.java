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
import me.golemcore.agent.domain.tools.ToolExecutionOutcome;

import java.util.List;

/**
 * Appends what an iteration produced to the model-facing list and to the turn
 * history of a {@link TurnContext}.
 */
public interface HistoryWriter {

    void appendFinalAssistantAnswer(TurnContext context, LlmResponse response);

    /**
     * Appends the assistant tool-call message and one tool message per outcome.
     * Ephemeral outcomes and the calls that produced them stay out of the turn
     * history.
     */
    void appendToolRound(TurnContext context, LlmResponse response, List<ToolExecutionOutcome> outcomes);
}
