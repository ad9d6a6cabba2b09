package me.golemcore.runtime.domain.handler;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.service.ConversationRegistry;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

/**
 * Tracks conversations announced by the remote side and their control profile.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationUpdatedHandler implements EventHandler {

    private final ConversationRegistry conversations;

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.CONVERSATION_UPDATED;
    }

    @Override
    public void handle(FeedEvent event) {
        if (event.conversationId() == null) {
            log.warn("[Conversations] Update without conversation id: {}", event.describe());
            return;
        }
        boolean known = conversations.find(event.conversationId()).isPresent();
        Conversation conversation = conversations.getOrCreate(event.conversationId());
        String profile = event.payloadString("control_profile");
        if (profile != null && !profile.isBlank()) {
            conversation.setControlProfile(profile);
        }
        log.debug("[Conversations] {} conversation {} (profile={}, state={})", known ? "Updated" : "New",
                conversation.getId(), conversation.effectiveProfile(), conversation.getState());
    }
}
