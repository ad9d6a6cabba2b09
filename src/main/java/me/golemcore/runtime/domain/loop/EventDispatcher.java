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
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.PendingToolCall;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.domain.service.SubchatOrchestrator;
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded run loop draining the {@link EventPark}.
 *
 * <p>
 * Each iteration checks subchat deadlines, takes the oldest parked event and
 * hands it to its single handler: tool invocations go to the
 * {@link ToolRouter}, every other kind to the {@link EventHandler} registered
 * for it. Only one handler runs at a time. A failing handler is logged with the
 * event identity and the loop moves on.
 *
 * <p>
 * An event nobody claims is handled according to
 * {@link UnregisteredEventPolicy}. Under {@code SHUTDOWN} the loop cancels its
 * token and returns {@link DispatchResult#FATAL_UNREGISTERED}.
 */
@Component
@Slf4j
public class EventDispatcher {

    private final EventPark park;
    private final HandlerRegistry registry;
    private final ToolRouter toolRouter;
    private final SubchatOrchestrator orchestrator;
    private final Clock clock;
    private final UnregisteredEventPolicy unregisteredPolicy;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile boolean fatal;

    public EventDispatcher(EventPark park, HandlerRegistry registry, ToolRouter toolRouter,
            SubchatOrchestrator orchestrator, Clock clock, RuntimeProperties properties) {
        this.park = park;
        this.registry = registry;
        this.toolRouter = toolRouter;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.unregisteredPolicy = properties.getDispatcher().getUnregisteredPolicy();
    }

    /**
     * Runs until the token is cancelled. The event in flight when cancellation
     * happens is finished first.
     */
    public DispatchResult run(Duration sleepIfIdle, CancellationToken token) {
        log.info("[Dispatcher] Started (sleepIfIdle={}, unregisteredPolicy={})", sleepIfIdle, unregisteredPolicy);
        while (!token.isCancelled()) {
            try {
                dispatchNext(sleepIfIdle, token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[Dispatcher] Interrupted, stopping");
                token.cancel();
            }
        }
        DispatchResult result = fatal ? DispatchResult.FATAL_UNREGISTERED : DispatchResult.CANCELLED;
        log.info("[Dispatcher] Stopped: {} ({} event(s) left parked)", result, park.size());
        return result;
    }

    /**
     * One loop iteration: deadline check, then at most one event.
     *
     * @return {@code true} if an event was taken from the park
     */
    public boolean dispatchNext(Duration wait, CancellationToken token) throws InterruptedException {
        checkDeadlines();
        FeedEvent event = park.poll(wait);
        if (event == null) {
            return false;
        }
        dispatch(event, token);
        return true;
    }

    void dispatch(FeedEvent event, CancellationToken token) {
        if (event.conversationId() != null && orchestrator.isRetired(event.conversationId())) {
            log.debug("[Dispatcher] Dropping {} of retired subchat", event.describe());
            return;
        }

        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        long startMs = clock.millis();
        try {
            if (event.kind() == FeedEventKind.TOOL_INVOCATION) {
                dispatchToolInvocation(event, token);
            } else {
                dispatchToHandler(event, token);
            }
            log.debug("[Dispatcher] {} handled in {}ms", event.describe(), clock.millis() - startMs);
        } catch (RuntimeException e) { // NOSONAR - one bad event must not stop the loop
            log.error("[Dispatcher] Handler failed for {} after {}ms: {}", event.describe(),
                    clock.millis() - startMs, e.getMessage(), e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void dispatchToHandler(FeedEvent event, CancellationToken token) {
        EventHandler handler = registry.findEventHandler(event.kind());
        if (handler == null) {
            onUnregistered("event kind " + event.kind(), event, token);
            return;
        }
        handler.handle(event);
    }

    private void dispatchToolInvocation(FeedEvent event, CancellationToken token) {
        PendingToolCall call = toPendingCall(event);
        if (call.getInvocationId() == null || call.getToolName() == null) {
            log.warn("[Dispatcher] Tool invocation without id or tool name: {}", event.describe());
            return;
        }
        if (toolRouter.isAnswered(call.getInvocationId())) {
            log.debug("[Dispatcher] Invocation {} already answered, ignoring replay", call.getInvocationId());
            return;
        }
        ToolOutcome outcome = toolRouter.route(call);
        if (outcome instanceof ToolOutcome.Unclaimed) {
            onUnregistered("tool '" + call.getToolName() + "'", event, token);
        }
    }

    private void onUnregistered(String discriminator, FeedEvent event, CancellationToken token) {
        if (unregisteredPolicy == UnregisteredEventPolicy.LEAVE_PENDING) {
            log.warn("[Dispatcher] No handler for {} ({}), leaving it pending", discriminator, event.describe());
            return;
        }
        log.error("[Dispatcher] No handler for {} ({}): the advertised capabilities do not match this process, "
                + "shutting down", discriminator, event.describe());
        fatal = true;
        token.cancel();
    }

    private PendingToolCall toPendingCall(FeedEvent event) {
        return PendingToolCall.builder()
                .invocationId(event.payloadString("invocation_id"))
                .conversationId(event.conversationId())
                .toolName(event.payloadString("tool_name"))
                .arguments(toolRouter.argumentsText(event.payload().get("arguments")))
                .confirmedByHuman(event.payloadBoolean("confirmed_by_human"))
                .createdAt(event.receivedAt() != null ? event.receivedAt() : clock.instant())
                .build();
    }

    private void checkDeadlines() {
        try {
            orchestrator.checkDeadlines(clock.instant());
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Dispatcher] Subchat deadline check failed: {}", e.getMessage(), e);
        }
    }

    public boolean isFatal() {
        return fatal;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getMaxObservedInFlight() {
        return maxInFlight.get();
    }
}
