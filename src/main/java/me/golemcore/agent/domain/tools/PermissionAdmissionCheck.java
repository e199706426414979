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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.event.AmbientEventCoordinator;
import me.golemcore.agent.domain.event.CoordinationOutcome;
import me.golemcore.agent.domain.event.CoordinationRequest;
import me.golemcore.agent.domain.event.EventCoordinator;
import me.golemcore.agent.domain.event.PermissionChoice;
import me.golemcore.agent.domain.loop.TurnContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;

import java.util.Optional;

/**
 * Asks the human before running functions flagged {@code requiresPermission}.
 * The request goes through the ambient coordinator, so a call made inside a
 * nested agent still reaches the outermost transport.
 */
@Slf4j
public class PermissionAdmissionCheck implements AdmissionCheck {

    private final AgentEngineProperties.CoordinationProperties settings;

    public PermissionAdmissionCheck(AgentEngineProperties.CoordinationProperties settings) {
        this.settings = settings;
    }

    @Override
    public AdmissionDecision check(TurnContext context, ToolDefinition definition, Message.ToolCall toolCall) {
        if (!definition.isRequiresPermission()) {
            return AdmissionDecision.admit();
        }
        String name = definition.getName();

        Optional<PermissionChoice> remembered = context.getPermissionMemory().get(name);
        if (remembered.isPresent() && remembered.get() == PermissionChoice.ALWAYS_ALLOW) {
            return AdmissionDecision.admit();
        }
        if (remembered.isPresent() && remembered.get() == PermissionChoice.ALWAYS_DENY) {
            return AdmissionDecision.deny(ToolFailureKind.PERMISSION_DENIED,
                    "Permission denied for '" + name + "' (remembered choice)");
        }

        Optional<EventCoordinator> coordinator = AmbientEventCoordinator.current();
        if (coordinator.isEmpty()) {
            if (settings.isApproveWhenUnattended()) {
                log.debug("[Tools] No coordinator active, running '{}' unattended", name);
                return AdmissionDecision.admit();
            }
            return AdmissionDecision.deny(ToolFailureKind.PERMISSION_DENIED,
                    "Permission required for '" + name + "' but nobody is available to approve it");
        }

        log.info("[Tools] Requesting permission for '{}'", name);
        CoordinationRequest request = CoordinationRequest.permission(name, toolCall.getId(),
                describe(definition, toolCall), toolCall.getArguments());
        CoordinationOutcome outcome = coordinator.get().emitAndAwait(request, settings.getPermissionTimeout(),
                context.getCancellation());

        return switch (outcome.status()) {
        case RESOLVED -> resolved(context, name, outcome);
        case TIMED_OUT -> AdmissionDecision.deny(ToolFailureKind.PERMISSION_TIMEOUT,
                "Permission request for '" + name + "' timed out without an answer");
        case CANCELLED -> AdmissionDecision.deny(ToolFailureKind.CANCELLED,
                "Permission request for '" + name + "' was cancelled");
        };
    }

    private AdmissionDecision resolved(TurnContext context, String name, CoordinationOutcome outcome) {
        if (outcome.response().choice() != null) {
            context.getPermissionMemory().remember(name, outcome.response().choice());
        }
        if (outcome.isApproved()) {
            return AdmissionDecision.admit();
        }
        return AdmissionDecision.deny(ToolFailureKind.PERMISSION_DENIED, "Permission denied by user for '"
                + name + "'");
    }

    private String describe(ToolDefinition definition, Message.ToolCall toolCall) {
        StringBuilder sb = new StringBuilder("Allow function '").append(definition.getName()).append("' to run");
        if (toolCall.getArguments() != null && !toolCall.getArguments().isEmpty()) {
            sb.append(" with ").append(toolCall.getArguments());
        }
        return sb.append('?').toString();
    }
}
