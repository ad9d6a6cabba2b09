package me.golemcore.runtime.tools;

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
import me.golemcore.runtime.domain.model.ChildSpec;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.service.SubchatOrchestrator;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.inbound.ToolHandler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Splits work across child conversations: one subchat per task, all started at
 * once. The call stays pending until every child delivers its value, and the
 * model then receives the values as a JSON array in task order, or a timeout
 * error.
 *
 * <p>
 * Tasks are strings or objects {@code {"content", "title", "profile"}}. A
 * task without a profile runs under the top-level {@code profile} argument,
 * or {@code runtime.subchat.default-profile}.
 */
@Component
@Slf4j
public class DelegateSubtasksTool implements ToolHandler {

    public static final String NAME = "delegate_subtasks";

    private final SubchatOrchestrator orchestrator;
    private final String defaultProfile;
    private final int maxChildren;

    public DelegateSubtasksTool(SubchatOrchestrator orchestrator, RuntimeProperties properties) {
        this.orchestrator = orchestrator;
        this.defaultProfile = properties.getSubchat().getDefaultProfile();
        this.maxChildren = properties.getSubchat().getMaxChildren();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Run several subtasks in parallel child conversations and wait for all results. "
                        + "Results come back as a JSON array in the order of the tasks.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "tasks", Map.of(
                                        "type", "array",
                                        "description", "Subtasks, each a string or {content, title, profile}",
                                        "items", Map.of()),
                                "profile", Map.of(
                                        "type", "string",
                                        "description", "Control profile for tasks that do not name one")),
                        "required", List.of("tasks")))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutcome> execute(ToolInvocation invocation) {
        Object profileArg = invocation.arguments().get("profile");
        String profile = profileArg instanceof String text && !text.isBlank() ? text : defaultProfile;

        List<ChildSpec> specs;
        try {
            specs = toSpecs(invocation.arguments().get("tasks"), profile);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ToolOutcome.completed(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage())));
        }

        String groupId = orchestrator.spawn(invocation.invocationId(), invocation.conversationId(), specs);
        log.info("[Tools] {} delegated {} subtask(s) as group {}", invocation.invocationId(), specs.size(), groupId);
        return CompletableFuture.completedFuture(ToolOutcome.awaitingChildren(groupId));
    }

    private List<ChildSpec> toSpecs(Object tasks, String profile) {
        if (!(tasks instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("'tasks' must be a non-empty array");
        }
        if (list.size() > maxChildren) {
            throw new IllegalArgumentException("At most " + maxChildren + " tasks can be delegated at once, got "
                    + list.size());
        }
        List<ChildSpec> specs = new ArrayList<>();
        for (Object task : list) {
            specs.add(toSpec(task, profile));
        }
        return specs;
    }

    private ChildSpec toSpec(Object task, String profile) {
        if (task instanceof String content && !content.isBlank()) {
            return ChildSpec.builder().openingContent(content).controlProfile(profile).build();
        }
        if (task instanceof Map<?, ?> map && map.get("content") instanceof String content && !content.isBlank()) {
            Object title = map.get("title");
            Object taskProfile = map.get("profile");
            return ChildSpec.builder()
                    .openingContent(content)
                    .title(title instanceof String t ? t : null)
                    .controlProfile(taskProfile instanceof String p && !p.isBlank() ? p : profile)
                    .build();
        }
        throw new IllegalArgumentException("Each task must be a non-empty string or an object with 'content'");
    }
}
