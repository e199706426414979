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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;

import java.util.List;

/**
 * Drives one agent turn: call the model, run the tools it asks for, feed the
 * results back, repeat.
 */
public interface AgentLoop {

    /**
     * @throws AgentRunException
     *             if the run fails; the exception carries the partial turn history
     */
    AgentRunResult run(AgentRunRequest request);

    default AgentRunResult run(List<Message> history, List<Message> newMessages, int maxIterations) {
        return run(history, newMessages, maxIterations, RunCancellation.none());
    }

    default AgentRunResult run(List<Message> history, List<Message> newMessages, int maxIterations,
            RunCancellation cancellation) {
        return run(AgentRunRequest.builder()
                .history(history != null ? history : List.of())
                .newMessages(newMessages != null ? newMessages : List.of())
                .maxIterations(maxIterations)
                .cancellation(cancellation != null ? cancellation : RunCancellation.none())
                .build());
    }
}
