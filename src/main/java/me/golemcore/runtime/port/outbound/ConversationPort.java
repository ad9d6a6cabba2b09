package me.golemcore.runtime.port.outbound;

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

import me.golemcore.runtime.domain.model.ChildConversation;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Remote conversation operations. All calls are asynchronous and must not be
 * joined on the dispatcher thread.
 */
public interface ConversationPort {

    /**
     * Creates a child conversation under the given parent.
     */
    CompletableFuture<Void> createChild(String parentConversationId, ChildConversation child);

    /**
     * Asks the remote side to run one generation step.
     *
     * @param injectedInstruction
     *            synthetic system instruction to prepend, or {@code null}
     */
    CompletableFuture<Void> generate(String conversationId, String injectedInstruction);

    CompletableFuture<Void> terminate(String conversationId, String reason);

    /**
     * Starts a scheduled activation of this agent.
     */
    CompletableFuture<Void> activate(String scheduleId, Map<String, Object> details);
}
