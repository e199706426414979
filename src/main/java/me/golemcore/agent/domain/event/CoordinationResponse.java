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
 * Answer to a {@link CoordinationRequest}.
 *
 * @param choice
 *            how long a permission answer applies; {@code null} for one call
 */
public record CoordinationResponse(String requestId, boolean approved, String answer, PermissionChoice choice) {

    public static CoordinationResponse approve(String requestId) {
        return new CoordinationResponse(requestId, true, null, null);
    }

    public static CoordinationResponse deny(String requestId) {
        return new CoordinationResponse(requestId, false, null, null);
    }

    public static CoordinationResponse answer(String requestId, String answer) {
        return new CoordinationResponse(requestId, true, answer, null);
    }

    public static CoordinationResponse remember(String requestId, PermissionChoice choice) {
        return new CoordinationResponse(requestId, choice == PermissionChoice.ALWAYS_ALLOW, null, choice);
    }
}
