package me.golemcore.runtime.domain.loop;

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
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.port.inbound.ToolHandler;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tool name to in-process {@link ToolHandler}. Filled once from the Spring
 * context; a second handler for the same name fails startup.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolHandler> toolHandlers;

    public ToolRegistry(List<ToolHandler> handlers) {
        Map<String, ToolHandler> tools = new LinkedHashMap<>();
        for (ToolHandler handler : handlers) {
            String name = handler.getToolName();
            if (name == null || name.isBlank()) {
                throw new DuplicateHandlerException("Tool handler without a name: " + handler.getClass().getName());
            }
            ToolHandler existing = tools.putIfAbsent(name, handler);
            if (existing != null) {
                throw new DuplicateHandlerException("Duplicate handler for tool '" + name + "': "
                        + existing.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        this.toolHandlers = Collections.unmodifiableMap(tools);
        log.info("[Registry] {} in-process tool(s): {}", tools.size(), tools.keySet());
    }

    public ToolHandler find(String toolName) {
        return toolName != null ? toolHandlers.get(toolName) : null;
    }

    public boolean isClaimed(String toolName) {
        return find(toolName) != null;
    }

    public Set<String> getToolNames() {
        return toolHandlers.keySet();
    }

    public List<ToolDefinition> getDefinitions() {
        return toolHandlers.values().stream().map(ToolHandler::getDefinition).toList();
    }
}
