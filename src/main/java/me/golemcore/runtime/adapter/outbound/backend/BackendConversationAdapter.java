package me.golemcore.runtime.adapter.outbound.backend;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import me.golemcore.runtime.domain.model.ChildConversation;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Conversation operations on the backend API.
 *
 * <ul>
 * <li>POST /v1/conversations - create a child conversation</li>
 * <li>POST /v1/conversations/{id}/generate - run one generation step</li>
 * <li>POST /v1/conversations/{id}/terminate - stop a conversation</li>
 * <li>POST /v1/activations - start a scheduled activation</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class BackendConversationAdapter implements ConversationPort {

    private final BackendHttpClient client;
    private final RuntimeProperties properties;

    @Override
    public CompletableFuture<Void> createChild(String parentConversationId, ChildConversation child) {
        return client.post("/v1/conversations", new CreateChildRequest(child.getChildId(), parentConversationId,
                child.getGroupId(), properties.getAgentId(), child.getOpeningContent(), child.getControlProfile(),
                child.getTitle()));
    }

    @Override
    public CompletableFuture<Void> generate(String conversationId, String injectedInstruction) {
        return client.post("/v1/conversations/" + conversationId + "/generate",
                new GenerateRequest(properties.getAgentId(), injectedInstruction));
    }

    @Override
    public CompletableFuture<Void> terminate(String conversationId, String reason) {
        return client.post("/v1/conversations/" + conversationId + "/terminate", new TerminateRequest(reason));
    }

    @Override
    public CompletableFuture<Void> activate(String scheduleId, Map<String, Object> details) {
        return client.post("/v1/activations", new ActivationRequest(properties.getAgentId(), scheduleId, details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateChildRequest(
            @JsonProperty("conversation_id") String conversationId,
            @JsonProperty("parent_conversation_id") String parentConversationId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("agent_id") String agentId,
            @JsonProperty("opening_content") String openingContent,
            @JsonProperty("control_profile") String controlProfile,
            String title) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateRequest(@JsonProperty("agent_id") String agentId,
            @JsonProperty("injected_instruction") String injectedInstruction) {
    }

    record TerminateRequest(String reason) {
    }

    record ActivationRequest(@JsonProperty("agent_id") String agentId, @JsonProperty("sched_id") String scheduleId,
            Map<String, Object> details) {
    }
}
