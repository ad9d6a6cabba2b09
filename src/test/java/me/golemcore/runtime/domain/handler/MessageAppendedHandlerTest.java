package me.golemcore.runtime.domain.handler;

import me.golemcore.runtime.domain.model.ConversationTurn;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.TurnToolCall;
import me.golemcore.runtime.domain.service.ConversationRegistry;
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.domain.service.TurnCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MessageAppendedHandlerTest {

    private TurnCoordinator turnCoordinator;
    private ConversationRegistry conversations;
    private ToolRouter toolRouter;
    private MessageAppendedHandler handler;

    @BeforeEach
    void setUp() {
        turnCoordinator = mock(TurnCoordinator.class);
        conversations = new ConversationRegistry();
        toolRouter = mock(ToolRouter.class);
        when(toolRouter.argumentsText(any())).thenAnswer(invocation -> {
            Object value = invocation.getArgument(0);
            return value instanceof String text ? text : "{\"city\":\"Paris\"}";
        });
        handler = new MessageAppendedHandler(turnCoordinator, conversations, toolRouter);
    }

    private static FeedEvent message(Map<String, Object> payload) {
        return FeedEvent.builder()
                .kind(FeedEventKind.MESSAGE_APPENDED)
                .conversationId("conv-1")
                .sequenceMarker(3)
                .payload(payload)
                .build();
    }

    @Test
    void shouldPassAssistantTurnWithToolCalls() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("message_id", "m-1");
        payload.put("role", "assistant");
        payload.put("content", "let me check");
        payload.put("cost", 0.25);
        payload.put("tool_calls", List.of(
                Map.of("id", "tc-1", "name", "weather", "arguments", Map.of("city", "Paris")),
                Map.of("name", "no_id")));

        handler.handle(message(payload));

        ArgumentCaptor<ConversationTurn> captor = ArgumentCaptor.forClass(ConversationTurn.class);
        verify(turnCoordinator).onTurnGenerated(eq("conv-1"), captor.capture());
        ConversationTurn turn = captor.getValue();
        assertEquals("m-1", turn.getMessageId());
        assertEquals(0.25, turn.getCost(), 1e-9);
        assertEquals(List.of(new TurnToolCall("tc-1", "weather", "{\"city\":\"Paris\"}")), turn.getToolCalls());
    }

    @Test
    void shouldPassToolResultMessage() {
        handler.handle(message(Map.of("message_id", "m-2", "role", "tool", "tool_call_id", "tc-1",
                "content", "sunny")));

        ArgumentCaptor<ConversationTurn> captor = ArgumentCaptor.forClass(ConversationTurn.class);
        verify(turnCoordinator).onToolResultAppended(eq("conv-1"), captor.capture());
        assertEquals("tc-1", captor.getValue().getToolCallId());
        assertEquals("sunny", captor.getValue().getContent());
    }

    @Test
    void shouldPassUserMessage() {
        handler.handle(message(Map.of("message_id", "m-3", "role", "user", "content", "hi")));

        verify(turnCoordinator).onUserMessage(eq("conv-1"), any());
    }

    @Test
    void shouldIgnoreAlreadyRecordedMessage() {
        conversations.getOrCreate("conv-1").getTurns()
                .add(ConversationTurn.builder().messageId("m-1").role("user").build());

        handler.handle(message(Map.of("message_id", "m-1", "role", "user", "content", "hi")));

        verify(turnCoordinator, never()).onUserMessage(any(), any());
    }

    @Test
    void shouldIgnoreUnknownRoleAndMissingConversation() {
        handler.handle(message(Map.of("message_id", "m-4", "role", "system", "content", "x")));
        handler.handle(FeedEvent.builder().kind(FeedEventKind.MESSAGE_APPENDED).payload(Map.of("role", "user"))
                .build());

        verifyNoInteractions(turnCoordinator);
    }
}
