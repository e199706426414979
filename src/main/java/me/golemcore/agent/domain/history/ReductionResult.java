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
 * @param summary
 *            inserted summary message, or {@code null} when nothing was
 *            summarized
 * @param strategy
 *            the strategy actually applied (summarization falls back to
 *            truncation)
 */
public record ReductionResult(List<Message> messages, int removedCount, Message summary,
        ReductionStrategy strategy) {

    public static ReductionResult unchanged(List<Message> messages) {
        return new ReductionResult(messages, 0, null, null);
    }

    public boolean isReduced() {
        return removedCount > 0;
    }
}
