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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.EventPark;
import me.golemcore.runtime.domain.loop.ToolRegistry;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.PendingToolCall;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.port.inbound.ToolHandler;
import me.golemcore.runtime.port.outbound.ConfirmationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Routes pending tool calls to in-process {@link ToolHandler}s and turns their
 * outcomes into posted results.
 *
 * <p>
 * Calls for tools without an in-process handler are registered as pending and
 * left alone: an external service owns them. Handler futures that are not
 * complete when {@code execute} returns are finished later on the dispatcher
 * thread through a {@link FeedEventKind#TOOL_COMPLETED} event, so a
 * cancellation applied in between always wins.
 */
@Service
@Slf4j
public class ToolRouter {

    static final String ARGUMENTS_ERROR_PREFIX = "Arguments expected to be a valid json, problem: ";
    static final String CANCELLED_MESSAGE = "Tool call was cancelled";
    static final String DENIED_MESSAGE = "Tool call was denied by the user";

    public static final String PAYLOAD_INVOCATION_ID = "invocation_id";
    public static final String PAYLOAD_OUTCOME = "outcome";
    public static final String PAYLOAD_ERROR = "error";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final PendingToolCallStore store;
    private final ToolRegistry registry;
    private final ToolResultDelivery delivery;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final ConfirmationPort confirmationPort;
    private final EventPark park;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ToolRouter(PendingToolCallStore store, ToolRegistry registry, ToolResultDelivery delivery,
            ToolConfirmationPolicy confirmationPolicy, ConfirmationPort confirmationPort, EventPark park,
            ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.delivery = delivery;
        this.confirmationPolicy = confirmationPolicy;
        this.confirmationPort = confirmationPort;
        this.park = park;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Routes one call. A redelivered invocation that is answered already or
     * still open is not run again.
     *
     * @return what happened; {@link ToolOutcome.Unclaimed} when no in-process
     *         handler owns the tool, {@link ToolOutcome.Duplicate} for a
     *         redelivery
     */
    public ToolOutcome route(PendingToolCall call) {
        String invocationId = call.getInvocationId();
        if (store.isResolved(invocationId)) {
            log.debug("[ToolRouter] Invocation {} already answered", invocationId);
            return new ToolOutcome.Duplicate();
        }
        Optional<PendingToolCall> open = store.find(invocationId);
        if (open.isPresent() && open.get().getState() != PendingToolCall.State.PENDING) {
            log.info("[ToolRouter] Invocation {} redelivered while {}, not running it again", invocationId,
                    open.get().getState());
            return new ToolOutcome.Duplicate();
        }
        return dispatch(call);
    }

    private ToolOutcome dispatch(PendingToolCall call) {
        String invocationId = call.getInvocationId();
        if (!store.register(call)) {
            log.debug("[ToolRouter] Invocation {} already answered", invocationId);
            return new ToolOutcome.Duplicate();
        }

        if (store.isCancelled(call.getConversationId(), invocationId)) {
            log.info("[ToolRouter] Invocation {} ({}) was cancelled before it arrived", invocationId,
                    call.getToolName());
            delivery.deliver(invocationId, call.getConversationId(), cancellationResult());
            return new ToolOutcome.Cancelled();
        }

        ToolHandler handler = registry.find(call.getToolName());
        if (handler == null) {
            log.debug("[ToolRouter] Tool '{}' is not handled in-process, leaving {} pending", call.getToolName(),
                    invocationId);
            return new ToolOutcome.Unclaimed();
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(call.getArguments());
        } catch (IllegalArgumentException e) {
            // Models produce malformed JSON on occasion, no stack trace needed
            log.info("[ToolRouter] Bad arguments for '{}' ({}): {}", call.getToolName(), invocationId,
                    e.getMessage());
            ToolResult result = ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    ARGUMENTS_ERROR_PREFIX + e.getMessage());
            delivery.deliver(invocationId, call.getConversationId(), result);
            return new ToolOutcome.Completed(result);
        }

        ToolInvocation invocation = new ToolInvocation(invocationId, call.getConversationId(),
                call.getToolName(), arguments, call.isConfirmedByHuman());
        if (confirmationPolicy.requiresConfirmation(invocation)) {
            return apply(call, ToolOutcome.needsConfirmation(confirmationPolicy.setupKey(invocation),
                    confirmationPolicy.describeCommand(invocation), confirmationPolicy.describeAction(invocation)));
        }
        return invoke(call, handler, invocation);
    }

    /**
     * Applies an asynchronous handler completion on the dispatcher thread.
     */
    public void onToolCompleted(FeedEvent event) {
        String invocationId = event.payloadString(PAYLOAD_INVOCATION_ID);
        Optional<PendingToolCall> call = store.find(invocationId);
        if (call.isEmpty()) {
            log.debug("[ToolRouter] Late completion for {} ignored, already answered", invocationId);
            return;
        }
        Object error = event.payload().get(PAYLOAD_ERROR);
        if (error instanceof Throwable throwable) {
            fail(call.get(), throwable);
            return;
        }
        Object outcome = event.payload().get(PAYLOAD_OUTCOME);
        apply(call.get(), outcome instanceof ToolOutcome toolOutcome ? toolOutcome : null);
    }

    /**
     * Resolves a call that waited for human approval.
     */
    public void onConfirmationResolved(String invocationId, boolean approved) {
        Optional<PendingToolCall> found = store.find(invocationId);
        if (found.isEmpty()) {
            log.debug("[ToolRouter] Confirmation for unknown or answered invocation {}", invocationId);
            return;
        }
        PendingToolCall call = found.get();
        if (!approved) {
            log.info("[ToolRouter] Invocation {} ({}) denied", invocationId, call.getToolName());
            delivery.deliver(invocationId, call.getConversationId(),
                    ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, DENIED_MESSAGE));
            return;
        }
        log.info("[ToolRouter] Invocation {} ({}) approved", invocationId, call.getToolName());
        dispatch(call.toBuilder().confirmedByHuman(true).state(PendingToolCall.State.PENDING).build());
    }

    /**
     * Answers a call of the given conversation with the cancellation result. An
     * id that has not arrived yet is remembered for that conversation so that
     * its invocation is answered the same way. Calls of other conversations are
     * left alone.
     *
     * @return {@code true} if a pending call was cancelled now
     */
    public boolean cancel(String conversationId, String invocationId) {
        if (store.isResolved(invocationId)) {
            log.debug("[ToolRouter] Cancel of {} ignored, already answered", invocationId);
            return false;
        }
        Optional<PendingToolCall> call = store.find(invocationId);
        if (call.isEmpty()) {
            log.info("[ToolRouter] Cancel of unseen invocation {} in {}, remembering it", invocationId,
                    conversationId);
            store.markCancelled(conversationId, invocationId);
            return false;
        }
        if (!Objects.equals(conversationId, call.get().getConversationId())) {
            log.warn("[ToolRouter] Conversation {} cannot cancel {}, it belongs to {}", conversationId,
                    invocationId, call.get().getConversationId());
            return false;
        }
        log.info("[ToolRouter] Cancelling {} ({})", invocationId, call.get().getToolName());
        return delivery.deliver(invocationId, conversationId, cancellationResult());
    }

    public boolean isAnswered(String invocationId) {
        return store.isResolved(invocationId);
    }

    /**
     * Normalizes the wire form of tool arguments, which may be JSON text or an
     * already decoded object, to JSON text.
     */
    public String argumentsText(Object arguments) {
        if (arguments == null) {
            return null;
        }
        if (arguments instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments);
        }
    }

    private ToolOutcome invoke(PendingToolCall call, ToolHandler handler, ToolInvocation invocation) {
        call.setState(PendingToolCall.State.RUNNING);
        log.debug("[ToolRouter] Executing '{}' for {}", call.getToolName(), call.getInvocationId());

        CompletableFuture<ToolOutcome> future;
        try {
            future = handler.execute(invocation);
        } catch (RuntimeException e) { // NOSONAR - tool faults become results
            return fail(call, e);
        }
        if (future == null) {
            return fail(call, new IllegalStateException("Tool handler returned no future"));
        }

        if (future.isDone()) {
            try {
                return apply(call, future.join());
            } catch (CompletionException | CancellationException e) {
                return fail(call, e.getCause() != null ? e.getCause() : e);
            }
        }

        String invocationId = call.getInvocationId();
        String conversationId = call.getConversationId();
        future.whenComplete((outcome, error) -> park.submit(completionEvent(invocationId, conversationId,
                outcome, error)));
        return new ToolOutcome.Deferred();
    }

    private ToolOutcome apply(PendingToolCall call, ToolOutcome outcome) {
        String invocationId = call.getInvocationId();
        if (outcome instanceof ToolOutcome.Completed completed) {
            if (completed.result() == null) {
                return fail(call, new IllegalStateException("Tool handler completed without a result"));
            }
            delivery.deliver(invocationId, call.getConversationId(), completed.result());
            return outcome;
        }
        if (outcome instanceof ToolOutcome.NeedsConfirmation confirmation) {
            call.setState(PendingToolCall.State.AWAITING_CONFIRMATION);
            log.info("[ToolRouter] Invocation {} ({}) needs confirmation: {}", invocationId, call.getToolName(),
                    confirmation.explanation());
            confirmationPort.requestConfirmation(invocationId, confirmation.setupKey(), confirmation.command(),
                    confirmation.explanation()).whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.error("[ToolRouter] Failed to request confirmation for {}: {}", invocationId,
                                    error.getMessage());
                        }
                    });
            return outcome;
        }
        if (outcome instanceof ToolOutcome.AwaitingChildren awaiting) {
            call.setState(PendingToolCall.State.AWAITING_CHILDREN);
            log.info("[ToolRouter] Invocation {} waits for subchat group {}", invocationId, awaiting.groupId());
            return outcome;
        }
        if (outcome instanceof ToolOutcome.Cancelled) {
            delivery.deliver(invocationId, call.getConversationId(), cancellationResult());
            return outcome;
        }
        return fail(call, new IllegalStateException("Unusable tool outcome: " + outcome));
    }

    private ToolOutcome fail(PendingToolCall call, Throwable error) {
        log.error("[ToolRouter] Tool '{}' failed for invocation {}: {}", call.getToolName(), call.getInvocationId(),
                error.getMessage(), error);
        ToolResult result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, ToolResultDelivery.OPAQUE_ERROR);
        delivery.deliver(call.getInvocationId(), call.getConversationId(), result);
        return new ToolOutcome.Completed(result);
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object, got " + (node == null ? "nothing"
                    : node.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return objectMapper.convertValue(node, ARGUMENTS_TYPE);
    }

    private FeedEvent completionEvent(String invocationId, String conversationId, ToolOutcome outcome,
            Throwable error) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PAYLOAD_INVOCATION_ID, invocationId);
        if (outcome != null) {
            payload.put(PAYLOAD_OUTCOME, outcome);
        }
        if (error != null) {
            payload.put(PAYLOAD_ERROR, error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error);
        }
        return FeedEvent.builder()
                .kind(FeedEventKind.TOOL_COMPLETED)
                .conversationId(conversationId)
                .sequenceMarker(-1)
                .payload(payload)
                .receivedAt(clock.instant())
                .build();
    }

    private static ToolResult cancellationResult() {
        return ToolResult.failure(ToolFailureKind.CANCELLED, CANCELLED_MESSAGE);
    }
}
