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

/**
 * Machine-readable classification of tool failures. The loop and the model use
 * it to tell a corrective usage error apart from a runtime failure.
 */
public enum ToolFailureKind {

    /**
     * The model asked for a function the registry does not know.
     */
    UNKNOWN_FUNCTION,

    /**
     * A container function was called with arguments instead of being expanded.
     */
    CONTAINER_MISUSE,

    /**
     * Arguments could not be parsed or required parameters are missing.
     */
    INVALID_ARGUMENTS,

    /**
     * The human (or a remembered choice) denied the call.
     */
    PERMISSION_DENIED,

    /**
     * Nobody answered the permission request in time.
     */
    PERMISSION_TIMEOUT,

    /**
     * The run was cancelled before or during the call.
     */
    CANCELLED,

    /**
     * The call exceeded its deadline.
     */
    TIMEOUT,

    /**
     * Tool execution failed during runtime (exceptions, non-retryable errors,
     * exhausted retries).
     */
    EXECUTION_FAILED
}
