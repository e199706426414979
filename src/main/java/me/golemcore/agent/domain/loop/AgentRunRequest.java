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

import lombok.Builder;
import lombok.Value;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.tools.PermissionMemory;

import java.util.List;

@Value
@Builder
public class AgentRunRequest {

    String runId;

    @Builder.Default
    List<Message> history = List.of();

    @Builder.Default
    List<Message> newMessages = List.of();

    int maxIterations;

    @Builder.Default
    RunCancellation cancellation = RunCancellation.none();

    /**
     * Permission answers remembered across runs of the same conversation.
     */
    @Builder.Default
    PermissionMemory permissionMemory = new PermissionMemory();
}
