package me.golemcore.agent.domain.tools;

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

import me.golemcore.agent.domain.loop.TurnContext;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Executes the tool calls of one assistant message.
 */
public interface ToolCallScheduler {

    /**
     * @return one outcome per request, in request order
     * @throws UnknownFunctionException
     *             if unknown calls are configured to reject the whole batch
     */
    List<ToolExecutionOutcome> executeBatch(TurnContext context, List<Message.ToolCall> toolCalls);
}
