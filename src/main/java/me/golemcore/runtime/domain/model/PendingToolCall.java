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

/**
 * A tool call created by the remote side and not yet answered. Lives until
 * exactly one result is posted for its invocation id.
 */
@Data
@Builder(toBuilder = true)
public class PendingToolCall {

    private String invocationId;
    private String conversationId;
    private String toolName;

    /** Raw JSON text as produced by the model. */
    private String arguments;

    private Instant createdAt;
    private boolean confirmedByHuman;

    @Builder.Default
    private State state = State.PENDING;

    public enum State {
        PENDING, RUNNING, AWAITING_CONFIRMATION, AWAITING_CHILDREN
    }
}
