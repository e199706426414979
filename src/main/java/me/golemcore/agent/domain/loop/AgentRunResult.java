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

import java.util.List;

/**
 * Outcome of a run that ended normally.
 *
 * @param finalResponse
 *            last model response, {@code null} when the model was never called
 * @param newMessages
 *            messages produced by this run, ready to persist (container
 *            expansion results stripped)
 * @param usage
 *            provider usage summed over all model calls
 */
public record AgentRunResult(String runId, AgentRunStatus status, LlmResponse finalResponse,
        List<Message> newMessages, int iterations, LlmUsage usage) {

    public String finalText() {
        return finalResponse != null ? finalResponse.getContent() : null;
    }

    public boolean isCompleted() {
        return status == AgentRunStatus.COMPLETED;
    }
}
