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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Token usage reported by the provider for a single model call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private int inputTokens;
    private int outputTokens;
    private int totalTokens;
    private Duration latency;
    private String model;

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }

    /**
     * Sums two usage records. Either side may be null.
     */
    public static LlmUsage add(LlmUsage left, LlmUsage right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return LlmUsage.builder()
                .inputTokens(left.inputTokens + right.inputTokens)
                .outputTokens(left.outputTokens + right.outputTokens)
                .totalTokens(left.totalTokens + right.totalTokens)
                .model(right.model != null ? right.model : left.model)
                .build();
    }
}
