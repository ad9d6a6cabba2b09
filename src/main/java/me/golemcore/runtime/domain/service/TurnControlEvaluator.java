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
import me.golemcore.runtime.domain.model.ControlScriptInput;
import me.golemcore.runtime.domain.model.ControlScriptResult;
import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.ConversationState;
import me.golemcore.runtime.domain.model.ConversationTurn;
import me.golemcore.runtime.domain.model.TurnPhase;
import me.golemcore.runtime.domain.model.TurnToolCall;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ControlScriptPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the conversation's control script around each generation step and
 * applies what it asked for.
 *
 * <p>
 * Outputs are applied in a fixed order: hard error, cancellations, injected
 * instruction, terminal value. A script that fails or exceeds its limits
 * counts as having asked for nothing.
 */
@Service
@Slf4j
public class TurnControlEvaluator {

    private final ControlScriptPort scriptPort;
    private final BudgetTracker budgetTracker;
    private final ToolRouter toolRouter;
    private final SubchatOrchestrator orchestrator;
    private final Map<String, String> profiles;

    public TurnControlEvaluator(ControlScriptPort scriptPort, BudgetTracker budgetTracker, ToolRouter toolRouter,
            SubchatOrchestrator orchestrator, RuntimeProperties properties) {
        this.scriptPort = scriptPort;
        this.budgetTracker = budgetTracker;
        this.toolRouter = toolRouter;
        this.orchestrator = orchestrator;
        this.profiles = Map.copyOf(properties.getControl().getProfiles());
    }

    public ControlScriptResult beforeTurn(Conversation conversation) {
        return evaluate(conversation, TurnPhase.BEFORE, null);
    }

    public ControlScriptResult afterTurn(Conversation conversation, ConversationTurn generatedTurn) {
        return evaluate(conversation, TurnPhase.AFTER, generatedTurn);
    }

    /**
     * Applies a script result to the conversation.
     */
    public void apply(Conversation conversation, ControlScriptResult result) {
        if (result == null || result.isEmpty()) {
            return;
        }
        String conversationId = conversation.getId();

        if (result.hasHardError()) {
            log.warn("[TurnControl] Conversation {} failed: {}", conversationId, result.hardError());
            conversation.setState(ConversationState.FAILED);
            conversation.setFailureReason(result.hardError());
        }

        for (String invocationId : result.cancelInvocationIds()) {
            if (invocationId != null && !invocationId.isBlank()) {
                toolRouter.cancel(conversationId, invocationId);
            }
        }

        if (result.hasInjectInstruction()) {
            log.debug("[TurnControl] Instruction queued for conversation {}", conversationId);
            conversation.setPendingInstruction(result.injectInstruction());
        }

        if (result.hasTerminalValue()) {
            if (conversation.isChild()) {
                log.info("[TurnControl] Child {} delivered its terminal value", conversationId);
                orchestrator.onChildFinalized(conversation.getParentGroupId(), conversationId,
                        result.terminalValue());
                if (!conversation.getState().isClosed()) {
                    conversation.setState(ConversationState.FINISHED);
                }
            } else {
                log.debug("[TurnControl] Ignoring terminal value on top-level conversation {}", conversationId);
            }
        }
    }

    private ControlScriptResult evaluate(Conversation conversation, TurnPhase phase, ConversationTurn generated) {
        String profile = conversation.effectiveProfile();
        String source = profile != null ? profiles.get(profile) : null;
        if (source == null || source.isBlank()) {
            return ControlScriptResult.empty();
        }

        String conversationId = conversation.getId();
        ControlScriptInput input = ControlScriptInput.builder()
                .turnHistory(history(conversation, generated))
                .spendSoFar(budgetTracker.spent(conversationId))
                .spendCeiling(budgetTracker.ceiling(conversationId))
                .softLimitReached(budgetTracker.isSoftLimitReached(conversationId))
                .phase(phase.scriptName())
                .child(conversation.isChild())
                .build();
        try {
            ControlScriptResult result = scriptPort.evaluate(profile, source, input);
            if (result == null) {
                return ControlScriptResult.empty();
            }
            if (!result.isEmpty()) {
                log.debug("[TurnControl] {} script '{}' for {}: {}", phase.scriptName(), profile, conversationId,
                        result);
            }
            return result;
        } catch (RuntimeException e) { // NOSONAR - a broken script must not stop the conversation
            log.warn("[TurnControl] {} script '{}' failed for conversation {}: {}", phase.scriptName(), profile,
                    conversationId, e.getMessage());
            return ControlScriptResult.empty();
        }
    }

    private static List<Map<String, Object>> history(Conversation conversation, ConversationTurn generated) {
        List<Map<String, Object>> history = new ArrayList<>();
        for (ConversationTurn turn : conversation.getTurns()) {
            history.add(toScriptTurn(turn));
        }
        if (generated != null && !conversation.getTurns().contains(generated)) {
            history.add(toScriptTurn(generated));
        }
        return history;
    }

    private static Map<String, Object> toScriptTurn(ConversationTurn turn) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("role", turn.getRole());
        entry.put("content", turn.getContent());
        List<Map<String, Object>> toolCalls = new ArrayList<>();
        if (turn.getToolCalls() != null) {
            for (TurnToolCall call : turn.getToolCalls()) {
                Map<String, Object> callEntry = new HashMap<>();
                callEntry.put("id", call.invocationId());
                callEntry.put("name", call.toolName());
                callEntry.put("arguments", call.arguments());
                toolCalls.add(callEntry);
            }
        }
        entry.put("tool_calls", toolCalls);
        entry.put("tool_call_id", turn.getToolCallId());
        return entry;
    }
}
