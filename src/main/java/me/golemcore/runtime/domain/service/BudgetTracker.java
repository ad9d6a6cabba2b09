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
import me.golemcore.runtime.domain.model.Budget;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spend counters per conversation.
 *
 * <p>
 * A conversation is blocked as soon as its spend reaches the ceiling and stays
 * blocked until {@link #reset} or {@link #resetAll}. Counters are created on
 * first use with the configured default ceiling. Mutated on the dispatcher
 * thread only.
 *
 * <p>
 * At most {@link #MAX_BUDGETS} counters are kept. Beyond that the least
 * recently charged counter is dropped unless it is blocked.
 */
@Service
@Slf4j
public class BudgetTracker {

    static final int MAX_BUDGETS = 10_000;

    private final Map<String, Budget> budgets = new LinkedHashMap<>(16, 0.75f, true) {
        private static final long serialVersionUID = 1L;

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Budget> eldest) {
            return size() > MAX_BUDGETS && !eldest.getValue().isBlocked();
        }
    };
    private final double defaultCeiling;
    private final double softThresholdRatio;

    public BudgetTracker(RuntimeProperties properties) {
        this.defaultCeiling = properties.getBudget().getDefaultCeiling();
        this.softThresholdRatio = properties.getBudget().getSoftThresholdRatio();
    }

    /**
     * Adds spend to a conversation.
     *
     * @return {@code true} if this charge blocked the conversation
     */
    public boolean charge(String conversationId, double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Charge must not be negative: " + amount);
        }
        Budget budget = budget(conversationId);
        boolean wasSoft = budget.isSoftLimitReached();
        budget.setSpent(budget.getSpent() + amount);
        if (!wasSoft && budget.isSoftLimitReached()) {
            log.info("[Budget] Conversation {} passed the soft limit: {}/{}", conversationId,
                    budget.getSpent(), budget.getCeiling());
        }
        if (!budget.isBlocked() && budget.getSpent() >= budget.getCeiling()) {
            budget.setBlocked(true);
            log.warn("[Budget] Conversation {} blocked: spent {} of {}", conversationId,
                    budget.getSpent(), budget.getCeiling());
            return true;
        }
        return false;
    }

    public double remaining(String conversationId) {
        return budget(conversationId).remaining();
    }

    public double spent(String conversationId) {
        return budget(conversationId).getSpent();
    }

    public double ceiling(String conversationId) {
        return budget(conversationId).getCeiling();
    }

    public boolean isBlocked(String conversationId) {
        Budget budget = budgets.get(conversationId);
        return budget != null && budget.isBlocked();
    }

    public boolean isSoftLimitReached(String conversationId) {
        return budget(conversationId).isSoftLimitReached();
    }

    /**
     * Clears the spend of one conversation, optionally with a new ceiling.
     *
     * @return {@code true} if the conversation was blocked before the reset
     */
    public boolean reset(String conversationId, Double newCeiling) {
        Budget budget = budget(conversationId);
        boolean wasBlocked = budget.isBlocked();
        budget.setSpent(0);
        if (newCeiling != null && newCeiling > 0) {
            budget.setCeiling(newCeiling);
        }
        budget.setBlocked(false);
        log.info("[Budget] Conversation {} reset, ceiling {}", conversationId, budget.getCeiling());
        return wasBlocked;
    }

    /**
     * Resets every known conversation.
     *
     * @return ids of conversations that were blocked
     */
    public List<String> resetAll() {
        List<String> unblocked = new ArrayList<>();
        for (Budget budget : budgets.values()) {
            if (budget.isBlocked()) {
                unblocked.add(budget.getConversationId());
            }
            budget.setSpent(0);
            budget.setBlocked(false);
        }
        log.info("[Budget] Reset all {} budget(s), {} unblocked", budgets.size(), unblocked.size());
        return unblocked;
    }

    int trackedCount() {
        return budgets.size();
    }

    private Budget budget(String conversationId) {
        return budgets.computeIfAbsent(conversationId,
                id -> new Budget(id, defaultCeiling, softThresholdRatio));
    }
}
