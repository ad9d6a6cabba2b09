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
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discriminator to handler table used by the dispatcher: event kind to
 * {@link EventHandler}, and through the {@link ToolRegistry} tool name to tool
 * handler. Read-only after construction. A second handler for the same
 * discriminator fails startup.
 */
@Component
@Slf4j
public class HandlerRegistry {

    private final Map<FeedEventKind, EventHandler> eventHandlers;
    private final ToolRegistry toolRegistry;

    public HandlerRegistry(List<EventHandler> eventHandlers, ToolRegistry toolRegistry) {
        Map<FeedEventKind, EventHandler> events = new EnumMap<>(FeedEventKind.class);
        for (EventHandler handler : eventHandlers) {
            FeedEventKind kind = handler.getKind();
            if (kind == FeedEventKind.TOOL_INVOCATION) {
                throw new DuplicateHandlerException(
                        "Tool invocations are routed by tool name, not by an event handler: "
                                + handler.getClass().getSimpleName());
            }
            EventHandler existing = events.putIfAbsent(kind, handler);
            if (existing != null) {
                throw new DuplicateHandlerException("Duplicate handler for event kind " + kind + ": "
                        + existing.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        this.eventHandlers = Collections.unmodifiableMap(events);
        this.toolRegistry = toolRegistry;
        log.info("[Registry] {} event handler(s): {}", events.size(), events.keySet());
    }

    public EventHandler findEventHandler(FeedEventKind kind) {
        return eventHandlers.get(kind);
    }

    public boolean isToolClaimed(String toolName) {
        return toolRegistry.isClaimed(toolName);
    }

    public List<ToolDefinition> getToolDefinitions() {
        return toolRegistry.getDefinitions();
    }

    /**
     * Kinds to request from the feed: every kind with a handler, plus tool
     * invocations, minus process-internal kinds.
     */
    public Set<FeedEventKind> getSubscribedKinds() {
        Set<FeedEventKind> kinds = EnumSet.of(FeedEventKind.TOOL_INVOCATION);
        for (FeedEventKind kind : eventHandlers.keySet()) {
            if (!kind.isInternal()) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
