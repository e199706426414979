package me.golemcore.agent.domain.tools;

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

import me.golemcore.agent.domain.model.ToolFailureKind;

public record AdmissionDecision(boolean admitted, ToolFailureKind failureKind, String reason) {

    private static final AdmissionDecision ADMIT = new AdmissionDecision(true, null, null);

    public static AdmissionDecision admit() {
        return ADMIT;
    }

    public static AdmissionDecision deny(ToolFailureKind kind, String reason) {
        return new AdmissionDecision(false, kind, reason);
    }
}
