package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.port.inbound.EventHandler;
import me.golemcore.runtime.port.inbound.ToolHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class HandlerRegistryTest {

    private static EventHandler eventHandler(FeedEventKind kind) {
        return new EventHandler() {
            @Override
            public FeedEventKind getKind() {
                return kind;
            }

            @Override
            public void handle(FeedEvent event) {
                // no-op
            }
        };
    }

    private static ToolHandler toolHandler(String name) {
        return new ToolHandler() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple(name, "test tool " + name);
            }

            @Override
            public CompletableFuture<ToolOutcome> execute(ToolInvocation invocation) {
                return CompletableFuture.completedFuture(ToolOutcome.completed("ok"));
            }
        };
    }

    @Test
    void shouldFindRegisteredHandlers() {
        EventHandler tasks = eventHandler(FeedEventKind.TASK_UPDATED);
        ToolRegistry tools = new ToolRegistry(List.of(toolHandler("weather")));
        HandlerRegistry registry = new HandlerRegistry(List.of(tasks), tools);

        assertSame(tasks, registry.findEventHandler(FeedEventKind.TASK_UPDATED));
        assertNull(registry.findEventHandler(FeedEventKind.BUDGET_RESET));
        assertTrue(registry.isToolClaimed("weather"));
        assertFalse(registry.isToolClaimed("shell"));
        assertFalse(registry.isToolClaimed(null));
    }

    @Test
    void shouldFailOnDuplicateEventKind() {
        ToolRegistry tools = new ToolRegistry(List.of());
        List<EventHandler> handlers = List.of(eventHandler(FeedEventKind.TASK_UPDATED),
                eventHandler(FeedEventKind.TASK_UPDATED));

        DuplicateHandlerException error = assertThrows(DuplicateHandlerException.class,
                () -> new HandlerRegistry(handlers, tools));
        assertTrue(error.getMessage().contains("TASK_UPDATED"));
    }

    @Test
    void shouldFailOnDuplicateToolName() {
        List<ToolHandler> handlers = List.of(toolHandler("weather"), toolHandler("weather"));

        DuplicateHandlerException error = assertThrows(DuplicateHandlerException.class,
                () -> new ToolRegistry(handlers));
        assertTrue(error.getMessage().contains("weather"));
    }

    @Test
    void shouldRejectEventHandlerForToolInvocations() {
        ToolRegistry tools = new ToolRegistry(List.of());
        List<EventHandler> handlers = List.of(eventHandler(FeedEventKind.TOOL_INVOCATION));

        assertThrows(DuplicateHandlerException.class, () -> new HandlerRegistry(handlers, tools));
    }

    @Test
    void shouldSubscribeToHandledKindsPlusToolInvocations() {
        ToolRegistry tools = new ToolRegistry(List.of(toolHandler("weather")));
        HandlerRegistry registry = new HandlerRegistry(List.of(
                eventHandler(FeedEventKind.MESSAGE_APPENDED),
                eventHandler(FeedEventKind.TOOL_COMPLETED)), tools);

        assertEquals(Set.of(FeedEventKind.MESSAGE_APPENDED, FeedEventKind.TOOL_INVOCATION),
                registry.getSubscribedKinds());
        assertEquals(List.of("weather"),
                registry.getToolDefinitions().stream().map(ToolDefinition::getName).toList());
    }
}
