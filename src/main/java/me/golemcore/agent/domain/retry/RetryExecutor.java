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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.RunCancellation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs a call under a {@link RetryEngine}, sleeping cancellably between
 * attempts.
 *
 * <p>
 * An authentication failure triggers at most one credential refresh, followed by
 * an immediate retry that does not count against the numeric budget.
 */
@Slf4j
public class RetryExecutor {

    private final RetryEngine engine;
    private final CredentialRefresher credentialRefresher;
    private final Clock clock;

    public RetryExecutor(RetryEngine engine) {
        this(engine, null, Clock.systemUTC());
    }

    public RetryExecutor(RetryEngine engine, CredentialRefresher credentialRefresher, Clock clock) {
        this.engine = engine;
        this.credentialRefresher = credentialRefresher;
        this.clock = clock;
    }

    public <T> T execute(String operation, Callable<T> call, RunCancellation cancellation) {
        return execute(operation, call, cancellation, RetryListener.NOOP);
    }

    public <T> T execute(String operation, Callable<T> call, RunCancellation cancellation,
            RetryListener listener) {
        RunCancellation signal = cancellation != null ? cancellation : RunCancellation.none();
        RetryListener sink = listener != null ? listener : RetryListener.NOOP;
        Instant start = clock.instant();
        int failures = 0;
        boolean refreshed = false;

        while (true) {
            signal.throwIfCancelled();
            try {
                T result = call.call();
                if (failures > 0) {
                    log.info("[Retry] {} succeeded after {} failed attempt(s)", operation, failures);
                    sink.onAttempt(new RetryAttempt(operation, failures, RetryState.SUCCEEDED, null, null,
                            elapsed(start), null));
                }
                return result;
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                Throwable cause = RetryEngine.unwrap(e);
                if (cause instanceof CancellationException cancelled) {
                    throw cancelled;
                }
                if (cause instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted during " + operation);
                }

                ErrorDetails details = engine.classify(cause);
                if (details.category() == ErrorCategory.AUTH_ERROR && credentialRefresher != null && !refreshed) {
                    refreshed = true;
                    if (refreshCredentials(operation)) {
                        continue;
                    }
                }

                failures++;
                Optional<Duration> delay = engine.classifyAndDelay(cause, failures);
                if (delay.isEmpty()) {
                    if (engine.isRetryable(cause)) {
                        log.warn("[Retry] {} exhausted after {} attempt(s): {}", operation, failures,
                                describe(cause));
                        sink.onAttempt(new RetryAttempt(operation, failures, RetryState.EXHAUSTED,
                                details.category(), null, elapsed(start), describe(cause)));
                        throw new RetryExhaustedException(operation, details.category(), failures, cause);
                    }
                    log.warn("[Retry] {} failed with non-retryable {}: {}", operation, details.category(),
                            describe(cause));
                    sink.onAttempt(new RetryAttempt(operation, failures, RetryState.NON_RETRYABLE,
                            details.category(), null, elapsed(start), describe(cause)));
                    throw new NonRetryableException(operation, details.category(), failures, cause);
                }

                log.info("[Retry] {} attempt {} failed ({}), retrying in {}ms", operation, failures,
                        details.category(), delay.get().toMillis());
                sink.onAttempt(new RetryAttempt(operation, failures, RetryState.RETRYING, details.category(),
                        delay.get(), elapsed(start), describe(cause)));
                signal.sleep(delay.get());
            }
        }
    }

    private boolean refreshCredentials(String operation) {
        try {
            boolean refreshed = credentialRefresher.refresh();
            log.info("[Retry] {} credential refresh {}", operation, refreshed ? "succeeded" : "declined");
            return refreshed;
        } catch (RuntimeException e) {
            log.warn("[Retry] {} credential refresh failed: {}", operation, e.getMessage());
            return false;
        }
    }

    private Duration elapsed(Instant start) {
        return Duration.between(start, clock.instant());
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
