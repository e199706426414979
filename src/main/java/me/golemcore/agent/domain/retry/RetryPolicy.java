package me.golemcore.agent.domain.retry;

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

import java.time.Duration;
import java.util.Map;

/**
 * Numeric retry budget and backoff shape.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    /**
     * Fraction of the computed delay added or subtracted at random.
     */
    @Builder.Default
    double jitterFactor = 0.1;

    @Builder.Default
    Map<ErrorCategory, Integer> maxRetriesPerCategory = Map.of();

    public int maxRetriesFor(ErrorCategory category) {
        if (category != null && maxRetriesPerCategory != null) {
            Integer perCategory = maxRetriesPerCategory.get(category);
            if (perCategory != null) {
                return perCategory;
            }
        }
        return maxRetries;
    }

    public static RetryPolicy noRetries() {
        return RetryPolicy.builder().maxRetries(0).build();
    }
}
