package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Local view of one conversation driven by this agent. Top-level
 * conversations have no parent group; children belong to exactly one
 * {@link SubchatGroup}.
 */
@Data
@Builder
public class Conversation {

    public static final String DEFAULT_PROFILE = "default";

    /** Turns kept per conversation; older ones are dropped first. */
    public static final int MAX_TURNS = 500;

    private String id;
    private String parentGroupId;
    private String controlProfile;

    @Builder.Default
    private ConversationState state = ConversationState.IDLE;

    @Builder.Default
    private List<ConversationTurn> turns = new ArrayList<>();

    private String pendingInstruction;

    @Builder.Default
    private Set<String> pendingInvocationIds = new LinkedHashSet<>();

    private String failureReason;

    public void addTurn(ConversationTurn turn) {
        turns.add(turn);
        if (turns.size() > MAX_TURNS) {
            turns.subList(0, turns.size() - MAX_TURNS).clear();
        }
    }

    public boolean isChild() {
        return parentGroupId != null;
    }

    public String effectiveProfile() {
        if (controlProfile != null && !controlProfile.isBlank()) {
            return controlProfile;
        }
        return isChild() ? null : DEFAULT_PROFILE;
    }
}
