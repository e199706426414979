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

/**
 * Classification result: category plus whatever the provider told us.
 *
 * @param retryAfter
 *            explicit wait hint from the provider, or {@code null}
 */
public record ErrorDetails(ErrorCategory category, Integer statusCode, String errorCode, String message,
        Duration retryAfter) {

    public static ErrorDetails of(ErrorCategory category, String message) {
        return new ErrorDetails(category, null, null, message, null);
    }

    public ErrorDetails withRetryAfter(Duration hint) {
        return new ErrorDetails(category, statusCode, errorCode, message, hint);
    }
}
