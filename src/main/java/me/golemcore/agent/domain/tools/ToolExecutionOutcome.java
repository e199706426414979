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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;

/**
 * Result of one scheduled call, ready to become a tool message.
 *
 * @param messageContent
 *            text fed back to the model (already truncated)
 * @param synthetic
 *            produced without running the function body
 * @param ephemeral
 *            container expansion result; visible to the model for the current
 *            run only and never persisted
 * @param attempts
 *            how many times the function body ran
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic, boolean ephemeral, int attempts) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        ToolResult result = ToolResult.failure(kind, reason);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, "Error: " + reason, true,
                false, 0);
    }

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }

    public ToolFailureKind failureKind() {
        return toolResult != null ? toolResult.getFailureKind() : null;
    }
}
