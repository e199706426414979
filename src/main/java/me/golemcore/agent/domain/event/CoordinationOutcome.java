package me.golemcore.agent.domain.event;

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
 * Terminal result of waiting for a coordination response. A timeout is its own
 * outcome and never reads as approval or denial.
 */
public record CoordinationOutcome(Status status, CoordinationResponse response) {

    public enum Status {
        RESOLVED, TIMED_OUT, CANCELLED
    }

    public static CoordinationOutcome resolved(CoordinationResponse response) {
        return new CoordinationOutcome(Status.RESOLVED, response);
    }

    public static CoordinationOutcome timedOut() {
        return new CoordinationOutcome(Status.TIMED_OUT, null);
    }

    public static CoordinationOutcome cancelled() {
        return new CoordinationOutcome(Status.CANCELLED, null);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public boolean isApproved() {
        return status == Status.RESOLVED && response != null && response.approved();
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
