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

import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.ConversationState;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Local view of every conversation this process drives. Top-level
 * conversations are registered on first sight; children when their group is
 * spawned.
 *
 * <p>
 * Holds at most {@link #MAX_CONVERSATIONS}. Beyond that the least recently
 * used conversation is dropped if it is idle or closed.
 */
@Component
public class ConversationRegistry {

    static final int MAX_CONVERSATIONS = 10_000;

    private final Map<String, Conversation> conversations = new LinkedHashMap<>(16, 0.75f, true) {
        private static final long serialVersionUID = 1L;

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Conversation> eldest) {
            if (size() <= MAX_CONVERSATIONS) {
                return false;
            }
            ConversationState state = eldest.getValue().getState();
            return state == ConversationState.IDLE || state.isClosed();
        }
    };

    public Conversation getOrCreate(String conversationId) {
        return conversations.computeIfAbsent(conversationId, id -> Conversation.builder().id(id).build());
    }

    public Conversation registerChild(String childId, String groupId, String controlProfile) {
        Conversation child = Conversation.builder()
                .id(childId)
                .parentGroupId(groupId)
                .controlProfile(controlProfile)
                .build();
        conversations.put(childId, child);
        return child;
    }

    public Optional<Conversation> find(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    public Optional<Conversation> remove(String conversationId) {
        return Optional.ofNullable(conversations.remove(conversationId));
    }

    public int size() {
        return conversations.size();
    }

    public boolean isInState(String conversationId, ConversationState state) {
        Conversation conversation = conversations.get(conversationId);
        return conversation != null && conversation.getState() == state;
    }

    public Collection<Conversation> all() {
        return Collections.unmodifiableCollection(conversations.values());
    }
}
