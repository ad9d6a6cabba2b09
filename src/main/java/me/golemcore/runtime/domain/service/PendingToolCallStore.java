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
import me.golemcore.runtime.domain.model.PendingToolCall;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pending tool calls by invocation id, with the bookkeeping that makes result
 * delivery happen exactly once.
 *
 * <p>
 * Besides live calls it remembers recently resolved ids, so a replayed
 * invocation or a late handler completion is recognized, and cancellation
 * tombstones for ids that were cancelled before their invocation arrived.
 * Tombstones belong to the conversation that asked for the cancellation. Every
 * collection is bounded; calls nobody answers in-process are evicted oldest
 * first. Mutated on the dispatcher thread only.
 */
@Component
@Slf4j
public class PendingToolCallStore {

    static final int MAX_REMEMBERED_IDS = 10_000;

    private final Map<String, PendingToolCall> pending = new LinkedHashMap<>();
    private final Set<String> resolved = new LinkedHashSet<>();
    private final Set<String> tombstones = new LinkedHashSet<>();

    /**
     * Registers a call, replacing an earlier registration of the same id.
     *
     * @return {@code false} if the id was already resolved
     */
    public boolean register(PendingToolCall call) {
        if (resolved.contains(call.getInvocationId())) {
            return false;
        }
        pending.put(call.getInvocationId(), call);
        if (pending.size() > MAX_REMEMBERED_IDS) {
            Iterator<PendingToolCall> oldest = pending.values().iterator();
            PendingToolCall evicted = oldest.next();
            oldest.remove();
            log.warn("[ToolRouter] Too many open calls, forgetting {} ({}, {})", evicted.getInvocationId(),
                    evicted.getToolName(), evicted.getState());
        }
        return true;
    }

    public Optional<PendingToolCall> find(String invocationId) {
        return Optional.ofNullable(pending.get(invocationId));
    }

    /**
     * Marks the id resolved.
     *
     * @return {@code true} only the first time for a given id
     */
    public boolean resolve(String invocationId) {
        if (invocationId == null || resolved.contains(invocationId)) {
            return false;
        }
        PendingToolCall call = pending.remove(invocationId);
        if (call != null) {
            tombstones.remove(tombstoneKey(call.getConversationId(), invocationId));
        }
        remember(resolved, invocationId);
        return true;
    }

    public boolean isResolved(String invocationId) {
        return resolved.contains(invocationId);
    }

    public void markCancelled(String conversationId, String invocationId) {
        remember(tombstones, tombstoneKey(conversationId, invocationId));
    }

    public boolean isCancelled(String conversationId, String invocationId) {
        return tombstones.contains(tombstoneKey(conversationId, invocationId));
    }

    public List<PendingToolCall> pendingFor(String conversationId) {
        return pending.values().stream()
                .filter(call -> conversationId.equals(call.getConversationId()))
                .toList();
    }

    public int size() {
        return pending.size();
    }

    private static String tombstoneKey(String conversationId, String invocationId) {
        return (conversationId != null ? conversationId : "") + '\n' + invocationId;
    }

    private static void remember(Set<String> ids, String id) {
        ids.add(id);
        if (ids.size() > MAX_REMEMBERED_IDS) {
            Iterator<String> oldest = ids.iterator();
            oldest.next();
            oldest.remove();
        }
    }
}
