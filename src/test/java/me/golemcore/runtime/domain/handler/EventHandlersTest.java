package me.golemcore.runtime.domain.handler;

import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.service.ConversationRegistry;
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.port.outbound.ConversationPort;
import me.golemcore.runtime.testsupport.fakes.RecordingConversationPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventHandlersTest {

    private static FeedEvent event(FeedEventKind kind, String conversationId, Map<String, Object> payload) {
        return FeedEvent.builder().kind(kind).conversationId(conversationId).payload(payload).build();
    }

    // ==================== Conversation updates ====================

    @Test
    void shouldRecordControlProfile() {
        ConversationRegistry conversations = new ConversationRegistry();
        ConversationUpdatedHandler handler = new ConversationUpdatedHandler(conversations);

        handler.handle(event(FeedEventKind.CONVERSATION_UPDATED, "conv-1", Map.of("control_profile", "strict")));
        handler.handle(event(FeedEventKind.CONVERSATION_UPDATED, "conv-1", Map.of("title", "renamed")));

        assertEquals("strict", conversations.find("conv-1").orElseThrow().getControlProfile());
    }

    // ==================== Confirmations ====================

    @Test
    void shouldForwardConfirmationDecision() {
        ToolRouter router = mock(ToolRouter.class);
        ConfirmationResolvedHandler handler = new ConfirmationResolvedHandler(router);

        handler.handle(event(FeedEventKind.CONFIRMATION_RESOLVED, "conv-1",
                Map.of("invocation_id", "tc-1", "approved", true)));
        handler.handle(event(FeedEventKind.CONFIRMATION_RESOLVED, "conv-1", Map.of("approved", "false")));

        verify(router).onConfirmationResolved("tc-1", true);
        verify(router, times(1)).onConfirmationResolved(any(), anyBoolean());
    }

    @Test
    void shouldForwardToolCompletion() {
        ToolRouter router = mock(ToolRouter.class);
        FeedEvent completed = event(FeedEventKind.TOOL_COMPLETED, "conv-1", Map.of("invocation_id", "tc-1"));

        new ToolCompletedHandler(router).handle(completed);

        verify(router).onToolCompleted(completed);
    }

    // ==================== Tasks and schedules ====================

    @Test
    void shouldKeepLatestTaskState() {
        TaskUpdatedHandler handler = new TaskUpdatedHandler();

        handler.handle(event(FeedEventKind.TASK_UPDATED, null, Map.of("task_id", "t-1", "status", "open")));
        handler.handle(event(FeedEventKind.TASK_UPDATED, null, Map.of("task_id", "t-1", "status", "done")));
        handler.handle(event(FeedEventKind.TASK_UPDATED, null, Map.of("status", "orphan")));

        assertEquals(1, handler.size());
        assertEquals("done", handler.latestTask("t-1").orElseThrow().get("status"));
    }

    @Test
    void shouldActivateSchedule() {
        RecordingConversationPort port = new RecordingConversationPort();
        ScheduledActivationHandler handler = new ScheduledActivationHandler(port);

        handler.handle(event(FeedEventKind.SCHEDULED_ACTIVATION, null,
                Map.of("sched_id", "daily-report", "sched_type", "cron", "details", Map.of("hour", 9))));
        handler.handle(event(FeedEventKind.SCHEDULED_ACTIVATION, null, Map.of()));

        assertEquals(List.of("daily-report"), port.activations);
    }

    @Test
    void shouldSurviveFailedActivation() {
        ConversationPort port = mock(ConversationPort.class);
        when(port.activate(any(), any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("x")));

        assertDoesNotThrow(() -> new ScheduledActivationHandler(port)
                .handle(event(FeedEventKind.SCHEDULED_ACTIVATION, null, Map.of("sched_id", "s-1"))));
    }

    // ==================== Feed sync ====================

    @Test
    void shouldCountSyncs() {
        FeedSyncedHandler handler = new FeedSyncedHandler(new ConversationRegistry(), List.of());

        handler.handle(event(FeedEventKind.FEED_SYNCED, null, Map.of()));
        handler.handle(event(FeedEventKind.FEED_SYNCED, null, Map.of()));

        assertEquals(2, handler.getSyncCount());
    }
}
