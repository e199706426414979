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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Pure retry decision: given a failure and the number of the attempt that just
 * failed, decide whether and when to try again.
 *
 * <p>
 * Precedence: a custom {@link RetryStrategy} decides alone when present;
 * otherwise the {@link ErrorClassifier} picks the category and a retryable
 * category waits for the provider hint or for exponential backoff; without a
 * classifier every failure gets backoff. Per-category budgets from the
 * {@link RetryPolicy} cap the classified and generic paths.
 */
public class RetryEngine {

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final RetryStrategy customStrategy;
    private final DoubleSupplier random;

    public RetryEngine(RetryPolicy policy, ErrorClassifier classifier) {
        this(policy, classifier, null, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryEngine(RetryPolicy policy, ErrorClassifier classifier, RetryStrategy customStrategy,
            DoubleSupplier random) {
        this.policy = policy != null ? policy : RetryPolicy.builder().build();
        this.classifier = classifier;
        this.customStrategy = customStrategy;
        this.random = random;
    }

    /**
     * @param attempt
     *            1-based number of the attempt that just failed
     * @return delay before the next attempt, or empty to stop
     */
    public Optional<Duration> classifyAndDelay(Throwable error, int attempt) {
        Throwable cause = unwrap(error);
        if (customStrategy != null) {
            return customStrategy.delayFor(cause, attempt);
        }
        if (classifier == null) {
            if (attempt > policy.getMaxRetries()) {
                return Optional.empty();
            }
            return Optional.of(backoff(attempt));
        }

        ErrorDetails details = classifier.classify(cause);
        ErrorCategory category = details.category();
        if (!category.isRetryable() || attempt > policy.maxRetriesFor(category)) {
            return Optional.empty();
        }
        if (details.retryAfter() != null) {
            return Optional.of(details.retryAfter());
        }
        return Optional.of(backoff(attempt));
    }

    /**
     * Classification used for reporting. Without a classifier everything is
     * {@link ErrorCategory#UNKNOWN}.
     */
    public ErrorDetails classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (classifier == null) {
            return ErrorDetails.of(ErrorCategory.UNKNOWN, cause != null ? cause.getMessage() : null);
        }
        return classifier.classify(cause);
    }

    /**
     * Whether an empty decision for this error means the budget ran out rather
     * than the error being terminal.
     */
    public boolean isRetryable(Throwable error) {
        if (customStrategy != null || classifier == null) {
            return true;
        }
        return classify(error).category().isRetryable();
    }

    Duration backoff(int attempt) {
        double base = policy.getInitialDelay().toMillis() * Math.pow(policy.getMultiplier(), Math.max(0, attempt - 1));
        double capped = Math.min(base, policy.getMaxDelay().toMillis());
        double jitter = capped * policy.getJitterFactor() * (random.getAsDouble() * 2 - 1);
        long millis = Math.round(Math.max(0, Math.min(policy.getMaxDelay().toMillis(), capped + jitter)));
        return Duration.ofMillis(millis);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
