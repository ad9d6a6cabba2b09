package me.golemcore.runtime.domain.service;

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
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides which in-process tool calls need a human approval before they run,
 * and describes the action for the approval prompt. Driven by
 * {@code runtime.tools.confirmation-required}.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    private final Set<String> confirmationRequired;

    public ToolConfirmationPolicy(RuntimeProperties properties) {
        this.confirmationRequired = new LinkedHashSet<>(properties.getTools().getConfirmationRequired());
        log.info("ToolConfirmationPolicy: confirmation required for {}", confirmationRequired);
    }

    public boolean requiresConfirmation(ToolInvocation invocation) {
        return !invocation.confirmedByHuman() && confirmationRequired.contains(invocation.toolName());
    }

    /**
     * Key identifying what is being approved. Approvals are per tool.
     */
    public String setupKey(ToolInvocation invocation) {
        return "tool:" + invocation.toolName();
    }

    public String describeCommand(ToolInvocation invocation) {
        String command = invocation.toolName() + " " + invocation.arguments();
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return command;
    }

    public String describeAction(ToolInvocation invocation) {
        Map<String, Object> args = invocation.arguments();
        if (args.isEmpty()) {
            return "Run tool '" + invocation.toolName() + "' without arguments";
        }
        return "Run tool '" + invocation.toolName() + "' with arguments " + args.keySet();
    }
}
