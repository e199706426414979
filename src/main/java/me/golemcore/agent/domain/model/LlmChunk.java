package me.golemcore.agent.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Incremental piece of a streamed model response. Text and reasoning are
 * deltas; tool calls arrive fully assembled; usage and finish reason usually
 * arrive with the last chunk.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private String reasoning;
    private List<Message.ToolCall> toolCalls;
    private LlmUsage usage;
    private String finishReason;
    private boolean done;
}
