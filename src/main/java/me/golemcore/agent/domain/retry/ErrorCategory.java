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

/**
 * Coarse classification of a failed call, driving the retry decision.
 */
public enum ErrorCategory {

    TRANSIENT(true),
    RATE_LIMIT_RETRYABLE(true),
    /**
     * Quota or credit exhausted; waiting does not help.
     */
    RATE_LIMIT_TERMINAL(false),
    CLIENT_ERROR(false),
    AUTH_ERROR(false),
    CONTEXT_TOO_LARGE(false),
    SERVER_ERROR(true),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
