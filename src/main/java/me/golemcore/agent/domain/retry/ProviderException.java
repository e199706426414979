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

import lombok.Getter;

import java.time.Duration;

/**
 * Structured provider failure for adapters that talk HTTP themselves. Carries
 * the status code, the provider's error code and an explicit wait hint when the
 * response had one.
 */
@Getter
public class ProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String errorCode;
    private final Duration retryAfter;

    public ProviderException(int statusCode, String message) {
        this(statusCode, null, message, null);
    }

    public ProviderException(int statusCode, String errorCode, String message, Duration retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public int statusCode() {
        return statusCode;
    }
}
