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
import me.golemcore.runtime.domain.model.ConversationTurn;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.TurnToolCall;
import me.golemcore.runtime.domain.service.ConversationRegistry;
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.domain.service.TurnCoordinator;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Feeds appended messages into the turn coordinator: assistant messages are
 * generated turns, tool messages are answered calls, user messages are human
 * input. A message id seen before for the same conversation is ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageAppendedHandler implements EventHandler {

    private final TurnCoordinator turnCoordinator;
    private final ConversationRegistry conversations;
    private final ToolRouter toolRouter;

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.MESSAGE_APPENDED;
    }

    @Override
    public void handle(FeedEvent event) {
        String conversationId = event.conversationId();
        if (conversationId == null) {
            log.warn("[Messages] Message without conversation: {}", event.describe());
            return;
        }
        ConversationTurn turn = toTurn(event);
        if (isDuplicate(conversationId, turn.getMessageId())) {
            log.debug("[Messages] Message {} already recorded", turn.getMessageId());
            return;
        }

        String role = turn.getRole() != null ? turn.getRole() : "";
        switch (role) {
        case ConversationTurn.ROLE_ASSISTANT -> turnCoordinator.onTurnGenerated(conversationId, turn);
        case ConversationTurn.ROLE_TOOL -> turnCoordinator.onToolResultAppended(conversationId, turn);
        case ConversationTurn.ROLE_USER -> turnCoordinator.onUserMessage(conversationId, turn);
        default -> log.debug("[Messages] Ignoring {} message {} in {}", role, turn.getMessageId(), conversationId);
        }
    }

    private boolean isDuplicate(String conversationId, String messageId) {
        if (messageId == null) {
            return false;
        }
        return conversations.find(conversationId)
                .map(Conversation::getTurns)
                .map(turns -> turns.stream().anyMatch(t -> messageId.equals(t.getMessageId())))
                .orElse(false);
    }

    private ConversationTurn toTurn(FeedEvent event) {
        Double cost = event.payloadDouble("cost");
        Object content = event.payload().get("content");
        return ConversationTurn.builder()
                .messageId(event.payloadString("message_id"))
                .role(event.payloadString("role"))
                .content(content == null || content instanceof String ? (String) content
                        : toolRouter.argumentsText(content))
                .toolCalls(toolCalls(event.payloadList("tool_calls")))
                .toolCallId(event.payloadString("tool_call_id"))
                .cost(cost != null ? cost : 0)
                .createdAt(event.receivedAt())
                .build();
    }

    private List<TurnToolCall> toolCalls(List<?> raw) {
        List<TurnToolCall> calls = new ArrayList<>();
        for (Object item : raw) {
            if (item instanceof Map<?, ?> map && map.get("id") instanceof String id) {
                Object name = map.get("name");
                calls.add(new TurnToolCall(id, name != null ? name.toString() : null,
                        toolRouter.argumentsText(map.get("arguments"))));
            }
        }
        return calls;
    }
}
