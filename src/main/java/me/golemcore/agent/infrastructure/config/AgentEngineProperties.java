package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agent.domain.history.ReductionStrategy;
import me.golemcore.agent.domain.retry.ErrorCategory;
import me.golemcore.agent.domain.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration of the agent engine, bound from {@code agent.*}.
 *
 * <ul>
 * <li>{@link LoopProperties} - iteration budget, breakers, continuation</li>
 * <li>{@link ModelProperties} - model name and generation parameters</li>
 * <li>{@link ToolsProperties} - scheduling, deadlines and tool retries</li>
 * <li>{@link RetryProperties} - model call retries</li>
 * <li>{@link CoordinationProperties} - human-in-the-loop timeouts</li>
 * <li>{@link HistoryProperties} - reduction triggers and strategy</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentEngineProperties {

    private LoopProperties loop = new LoopProperties();
    private ModelProperties model = new ModelProperties();
    private ToolsProperties tools = new ToolsProperties();
    private RetryProperties retry = new RetryProperties();
    private CoordinationProperties coordination = new CoordinationProperties();
    private HistoryProperties history = new HistoryProperties();

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxIterations = 10;
        private boolean streaming = false;
        private Duration modelTimeout = Duration.ofSeconds(120);

        /**
         * Abort the turn after this many iterations in a row with at least one failed
         * tool call. 0 disables the breaker.
         */
        private int maxConsecutiveToolErrors = 3;

        /**
         * Stop before running the same call (same function, same arguments) this many
         * times in a row. 0 disables the breaker.
         */
        private int maxConsecutiveIdenticalCalls = 3;

        private ContinuationProperties continuation = new ContinuationProperties();
    }

    @Data
    public static class ContinuationProperties {
        private boolean enabled = false;
        private int extension = 3;
        private int maxExtensions = 1;
        private Duration timeout = Duration.ofMinutes(2);
    }

    // ==================== MODEL ====================

    @Data
    public static class ModelProperties {
        private String name;
        private Double temperature = 0.7;
        private Integer maxTokens;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private boolean parallel = true;
        private int maxParallelism = 4;
        private Duration callTimeout = Duration.ofSeconds(30);
        private boolean terminateOnUnknownCalls = false;
        private int maxResultChars = 50000;
        private RetryProperties retry = toolRetryDefaults();

        private static RetryProperties toolRetryDefaults() {
            RetryProperties retry = new RetryProperties();
            retry.setMaxRetries(1);
            retry.setInitialDelay(Duration.ofMillis(500));
            retry.setMaxDelay(Duration.ofSeconds(5));
            return retry;
        }
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitterFactor = 0.1;
        private Map<ErrorCategory, Integer> maxRetriesPerCategory = new EnumMap<>(ErrorCategory.class);

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .maxRetries(maxRetries)
                    .initialDelay(initialDelay)
                    .multiplier(multiplier)
                    .maxDelay(maxDelay)
                    .jitterFactor(jitterFactor)
                    .maxRetriesPerCategory(Map.copyOf(maxRetriesPerCategory))
                    .build();
        }
    }

    // ==================== COORDINATION ====================

    @Data
    public static class CoordinationProperties {
        private Duration permissionTimeout = Duration.ofMinutes(5);
        private Duration clarificationTimeout = Duration.ofMinutes(5);

        /**
         * Let permission-gated functions run when no coordinator is active. Off by
         * default: an unattended run denies them.
         */
        private boolean approveWhenUnattended = false;
    }

    // ==================== HISTORY ====================

    @Data
    public static class HistoryProperties {
        private ReductionStrategy strategy = ReductionStrategy.SUMMARIZE;
        private int targetMessageCount = 20;
        private int summarizationThreshold = 5;
        private int contextWindowTokens = 0;
        private int triggerPercentage = 0;
        private int maxTokens = 0;
        private double charsPerToken = 3.5;
        private String systemPreamble;
        private Duration summaryTimeout = Duration.ofSeconds(30);
        private int summaryMaxTokens = 500;
    }
}
