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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a conversation history. Synthetic turns are created locally,
 * for example the system turn carrying an injected instruction.
 */
@Data
@Builder
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";
    public static final String ROLE_SYSTEM = "system";

    private String messageId;
    private String role;
    private String content;

    @Builder.Default
    private List<TurnToolCall> toolCalls = new ArrayList<>();

    private String toolCallId;
    private double cost;
    private boolean synthetic;
    private Instant createdAt;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static ConversationTurn systemInstruction(String instruction, Instant now) {
        return ConversationTurn.builder()
                .role(ROLE_SYSTEM)
                .content(instruction)
                .synthetic(true)
                .createdAt(now)
                .build();
    }
}
