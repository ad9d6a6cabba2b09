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
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ToolResultPort;
import org.springframework.stereotype.Service;

/**
 * Posts tool results, at most once per invocation id.
 *
 * <p>
 * Every path that answers a tool call goes through here: handler outcomes,
 * argument errors, cancellations, denials and subchat aggregates. The first
 * delivery for an id wins; later ones are ignored. Spend reported by the tool
 * is charged to the owning conversation.
 */
@Service
@Slf4j
public class ToolResultDelivery {

    static final String OPAQUE_ERROR = "Tool error, see logs for details";
    private static final String TRUNCATION_SUFFIX = "\n... [truncated]";

    private final PendingToolCallStore store;
    private final BudgetTracker budgetTracker;
    private final ToolResultPort toolResultPort;
    private final int maxResultChars;

    public ToolResultDelivery(PendingToolCallStore store, BudgetTracker budgetTracker,
            ToolResultPort toolResultPort, RuntimeProperties properties) {
        this.store = store;
        this.budgetTracker = budgetTracker;
        this.toolResultPort = toolResultPort;
        this.maxResultChars = properties.getTools().getMaxResultChars();
    }

    /**
     * Delivers the result unless the invocation was already answered.
     *
     * @return {@code true} if the result was posted
     */
    public boolean deliver(String invocationId, String conversationId, ToolResult result) {
        if (!store.resolve(invocationId)) {
            log.debug("[ToolRouter] Invocation {} already answered, dropping {}", invocationId,
                    result.isSuccess() ? "result" : result.getFailureKind());
            return false;
        }

        ToolResult checked = check(invocationId, result);
        if (checked.getDollars() > 0 && conversationId != null) {
            budgetTracker.charge(conversationId, checked.getDollars());
        }

        log.debug("[ToolRouter] Posting result for {} (success={}, dollars={})", invocationId,
                checked.isSuccess(), checked.getDollars());
        toolResultPort.postResult(invocationId, checked).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[ToolRouter] Failed to post result for {}: {}", invocationId, error.getMessage());
            }
        });
        return true;
    }

    private ToolResult check(String invocationId, ToolResult result) {
        try {
            result.validate();
        } catch (IllegalArgumentException e) {
            log.error("[ToolRouter] Invalid result for {}: {}", invocationId, e.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, OPAQUE_ERROR);
        }
        if (result.isMultipart()) {
            return result;
        }
        String content = result.getContent();
        if (result.isSuccess() && (content == null || content.isEmpty())) {
            log.warn("[ToolRouter] Tool returned an empty result for {}", invocationId);
            return result.toBuilder().content("").build();
        }
        if (content != null && maxResultChars > 0 && content.length() > maxResultChars) {
            log.info("[ToolRouter] Truncating result for {} from {} to {} chars", invocationId, content.length(),
                    maxResultChars);
            return result.toBuilder().content(content.substring(0, maxResultChars) + TRUNCATION_SUFFIX).build();
        }
        return result;
    }
}
