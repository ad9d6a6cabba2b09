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
import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.ConversationState;
import me.golemcore.runtime.domain.model.ConversationTurn;
import me.golemcore.runtime.domain.model.TurnToolCall;
import me.golemcore.runtime.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Decides when a conversation takes its next generation step.
 *
 * <p>
 * A step starts on human input to an idle conversation, or when the last
 * pending tool call of a turn has its result appended. Before each step the
 * budget is checked and the control script runs; after each generated turn
 * the turn is charged and the control script runs again.
 */
@Service
@Slf4j
public class TurnCoordinator {

    private final ConversationRegistry conversations;
    private final BudgetTracker budgetTracker;
    private final TurnControlEvaluator evaluator;
    private final ConversationPort conversationPort;
    private final Clock clock;

    public TurnCoordinator(ConversationRegistry conversations, BudgetTracker budgetTracker,
            TurnControlEvaluator evaluator, ConversationPort conversationPort, Clock clock) {
        this.conversations = conversations;
        this.budgetTracker = budgetTracker;
        this.evaluator = evaluator;
        this.conversationPort = conversationPort;
        this.clock = clock;
    }

    /**
     * Starts a generation step if the conversation is runnable.
     *
     * @return {@code true} if the remote side was asked to generate
     */
    public boolean requestGeneration(String conversationId) {
        Conversation conversation = conversations.getOrCreate(conversationId);
        if (!isRunnable(conversation)) {
            log.debug("[Turn] Conversation {} not runnable in state {} ({} pending)", conversationId,
                    conversation.getState(), conversation.getPendingInvocationIds().size());
            return false;
        }
        if (budgetTracker.isBlocked(conversationId)) {
            log.info("[Turn] Conversation {} is over budget, waiting for a reset", conversationId);
            conversation.setState(ConversationState.BLOCKED);
            return false;
        }

        evaluator.apply(conversation, evaluator.beforeTurn(conversation));
        if (conversation.getState().isClosed()) {
            return false;
        }

        String instruction = conversation.getPendingInstruction();
        if (instruction != null) {
            conversation.addTurn(ConversationTurn.systemInstruction(instruction, clock.instant()));
            conversation.setPendingInstruction(null);
        }

        conversation.setState(ConversationState.GENERATING);
        log.debug("[Turn] Generating for conversation {}", conversationId);
        conversationPort.generate(conversationId, instruction).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[Turn] Generation request for {} failed: {}", conversationId, error.getMessage());
            }
        });
        return true;
    }

    /**
     * Records a generated turn, charges it and runs the after-turn script.
     */
    public void onTurnGenerated(String conversationId, ConversationTurn turn) {
        Conversation conversation = conversations.getOrCreate(conversationId);
        if (conversation.getState().isClosed()) {
            log.debug("[Turn] Ignoring turn for closed conversation {} ({})", conversationId,
                    conversation.getState());
            return;
        }
        conversation.addTurn(turn);
        if (turn.getCost() > 0) {
            budgetTracker.charge(conversationId, turn.getCost());
        }
        List<TurnToolCall> toolCalls = turn.getToolCalls() != null ? turn.getToolCalls() : List.of();
        for (TurnToolCall call : toolCalls) {
            conversation.getPendingInvocationIds().add(call.invocationId());
        }

        evaluator.apply(conversation, evaluator.afterTurn(conversation, turn));
        if (conversation.getState().isClosed()) {
            return;
        }

        if (conversation.getState() == ConversationState.AWAITING_CHILDREN) {
            return;
        }
        if (!conversation.getPendingInvocationIds().isEmpty()) {
            conversation.setState(ConversationState.AWAITING_TOOLS);
        } else {
            conversation.setState(ConversationState.IDLE);
        }
    }

    /**
     * A tool result was appended to the conversation. Generation resumes once no
     * call of the last turn is pending.
     */
    public void onToolResultAppended(String conversationId, ConversationTurn toolTurn) {
        Conversation conversation = conversations.getOrCreate(conversationId);
        if (toolTurn != null) {
            conversation.addTurn(toolTurn);
        }
        String invocationId = toolTurn != null ? toolTurn.getToolCallId() : null;
        if (invocationId != null) {
            conversation.getPendingInvocationIds().remove(invocationId);
        }
        if (!conversation.getPendingInvocationIds().isEmpty()) {
            return;
        }
        ConversationState state = conversation.getState();
        if (state == ConversationState.AWAITING_TOOLS || state == ConversationState.AWAITING_CHILDREN) {
            conversation.setState(ConversationState.AWAITING_TOOLS);
            requestGeneration(conversationId);
        }
    }

    /**
     * Human input. Starts a step when the conversation is idle.
     */
    public void onUserMessage(String conversationId, ConversationTurn userTurn) {
        Conversation conversation = conversations.getOrCreate(conversationId);
        if (conversation.getState().isClosed()) {
            log.debug("[Turn] Ignoring user message for closed conversation {}", conversationId);
            return;
        }
        if (userTurn != null) {
            conversation.addTurn(userTurn);
        }
        if (conversation.getState() == ConversationState.IDLE) {
            requestGeneration(conversationId);
        }
    }

    /**
     * Resumes a conversation whose budget block was lifted.
     */
    public void onBudgetUnblocked(String conversationId) {
        conversations.find(conversationId).ifPresent(conversation -> {
            if (conversation.getState() == ConversationState.BLOCKED) {
                log.info("[Turn] Resuming conversation {} after budget reset", conversationId);
                requestGeneration(conversationId);
            }
        });
    }

    private static boolean isRunnable(Conversation conversation) {
        return switch (conversation.getState()) {
        case IDLE, BLOCKED -> true;
        case AWAITING_TOOLS -> conversation.getPendingInvocationIds().isEmpty();
        default -> false;
        };
    }
}
