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

import me.golemcore.agent.domain.event.PermissionChoice;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembered "always allow" / "always deny" answers, per function name.
 */
public class PermissionMemory {

    private final Map<String, PermissionChoice> choices = new ConcurrentHashMap<>();

    public Optional<PermissionChoice> get(String functionName) {
        return Optional.ofNullable(choices.get(functionName));
    }

    public void remember(String functionName, PermissionChoice choice) {
        if (choice == null || choice == PermissionChoice.ASK) {
            choices.remove(functionName);
        } else {
            choices.put(functionName, choice);
        }
    }

    public void clear() {
        choices.clear();
    }
}
