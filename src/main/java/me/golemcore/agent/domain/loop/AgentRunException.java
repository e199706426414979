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

import lombok.Getter;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * A run that could not finish. Carries what the run had produced so far; the
 * partial history never contains a tool-call request without its results.
 */
@Getter
public class AgentRunException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AgentFailureReason reason;
    private final transient List<Message> partialTurnHistory;

    public AgentRunException(AgentFailureReason reason, String message, List<Message> partialTurnHistory,
            Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.partialTurnHistory = partialTurnHistory != null ? List.copyOf(partialTurnHistory) : List.of();
    }
}
