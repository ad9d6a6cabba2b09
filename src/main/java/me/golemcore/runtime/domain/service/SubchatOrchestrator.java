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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.ChildConversation;
import me.golemcore.runtime.domain.model.ChildSpec;
import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.ConversationState;
import me.golemcore.runtime.domain.model.SubchatGroup;
import me.golemcore.runtime.domain.model.SubchatResolution;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns subchat groups and their child conversations.
 *
 * <p>
 * A group is spawned on behalf of one tool invocation and resolves exactly
 * once: when every child has delivered its value the parent invocation gets
 * the values as a JSON array in spawn order; when the deadline passes first it
 * gets a timeout error and the unfinished children are terminated. Everything
 * after resolution is a no-op.
 *
 * <p>
 * A resolved group is forgotten together with its children. Only the ids of
 * retired children are kept, up to {@link #MAX_RETIRED_IDS}, so that late
 * events for them can be dropped.
 *
 * <p>
 * The deadline is the same for every group, {@code runtime.subchat.deadline}.
 * A child cannot receive human input, so an open group with no deadline could
 * never be recovered.
 */
@Service
@Slf4j
public class SubchatOrchestrator {

    static final String TERMINATE_REASON = "subchat deadline passed";
    static final int MAX_RETIRED_IDS = 10_000;

    private final ToolResultDelivery delivery;
    private final ConversationRegistry conversations;
    private final ConversationPort conversationPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration deadline;

    private final Map<String, SubchatGroup> groups = new LinkedHashMap<>();
    private final Map<String, ChildConversation> childrenById = new HashMap<>();
    private final Set<String> retired = new LinkedHashSet<>();

    public SubchatOrchestrator(ToolResultDelivery delivery, ConversationRegistry conversations,
            ConversationPort conversationPort, ObjectMapper objectMapper, Clock clock,
            RuntimeProperties properties) {
        this.delivery = delivery;
        this.conversations = conversations;
        this.conversationPort = conversationPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.deadline = properties.getSubchat().getDeadline();
    }

    /**
     * Creates one child conversation per {@link ChildSpec} and returns at once. The parent
     * conversation produces no further generation until the group resolves.
     *
     * @return the new group id
     */
    public String spawn(String parentInvocationId, String parentConversationId, List<ChildSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("A subchat group needs at least one child");
        }
        Instant now = clock.instant();
        String groupId = "sg-" + UUID.randomUUID();
        SubchatGroup group = SubchatGroup.builder()
                .groupId(groupId)
                .parentInvocationId(parentInvocationId)
                .parentConversationId(parentConversationId)
                .createdAt(now)
                .deadline(now.plus(deadline))
                .build();

        for (int i = 0; i < specs.size(); i++) {
            ChildSpec spec = specs.get(i);
            ChildConversation child = ChildConversation.builder()
                    .childId("sc-" + UUID.randomUUID())
                    .groupId(groupId)
                    .index(i)
                    .openingContent(spec.openingContent())
                    .controlProfile(spec.controlProfile())
                    .title(spec.title())
                    .build();
            group.getChildren().add(child);
            childrenById.put(child.getChildId(), child);
            conversations.registerChild(child.getChildId(), groupId, spec.controlProfile());
        }
        groups.put(groupId, group);

        Conversation parent = conversations.getOrCreate(parentConversationId);
        parent.setState(ConversationState.AWAITING_CHILDREN);

        log.info("[Subchat] Spawned group {} with {} child(ren) for invocation {}, deadline {}", groupId,
                specs.size(), parentInvocationId, group.getDeadline());
        for (ChildConversation child : group.getChildren()) {
            conversationPort.createChild(parentConversationId, child).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("[Subchat] Failed to create child {} of group {}: {}", child.getChildId(), groupId,
                            error.getMessage());
                }
            });
        }
        return groupId;
    }

    /**
     * Records a child's value. The first value of a child wins; calls for a
     * resolved group are ignored.
     */
    public void onChildFinalized(String groupId, String childId, Object value) {
        SubchatGroup group = groups.get(groupId);
        if (group == null) {
            log.debug("[Subchat] Finalization for unknown or resolved group {} (child {})", groupId, childId);
            return;
        }
        if (!group.isOpen()) {
            log.debug("[Subchat] Group {} already {}, ignoring finalization of {}", groupId, group.getResolution(),
                    childId);
            return;
        }
        Optional<ChildConversation> found = group.findChild(childId);
        if (found.isEmpty()) {
            log.warn("[Subchat] Child {} does not belong to group {}", childId, groupId);
            return;
        }
        ChildConversation child = found.get();
        if (child.isFinalized()) {
            log.debug("[Subchat] Child {} already finalized", childId);
            return;
        }
        child.setFinalized(true);
        child.setValue(value);
        conversations.find(childId).ifPresent(c -> c.setState(ConversationState.FINISHED));
        log.info("[Subchat] Child {} of group {} finalized ({}/{})", childId, groupId, group.finalizedCount(),
                group.getChildren().size());

        if (group.allFinalized()) {
            complete(group);
        }
    }

    /**
     * Resolves an open group with the timeout error. Idempotent.
     */
    public void onDeadline(String groupId) {
        SubchatGroup group = groups.get(groupId);
        if (group == null || !group.isOpen()) {
            return;
        }
        group.setResolution(SubchatResolution.TIMED_OUT);
        log.warn("[Subchat] Group {} timed out with {}/{} child(ren) finalized", groupId, group.finalizedCount(),
                group.getChildren().size());

        delivery.deliver(group.getParentInvocationId(), group.getParentConversationId(),
                ToolResult.failure(ToolFailureKind.SUBCHAT_TIMEOUT, timeoutMessage()));

        for (ChildConversation child : group.getChildren()) {
            if (child.isFinalized()) {
                continue;
            }
            child.setTerminated(true);
            conversations.find(child.getChildId()).ifPresent(c -> c.setState(ConversationState.TERMINATED));
            conversationPort.terminate(child.getChildId(), TERMINATE_REASON).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("[Subchat] Failed to terminate child {}: {}", child.getChildId(), error.getMessage());
                }
            });
        }
        resumeParent(group);
        retire(group);
    }

    /**
     * Times out every open group whose deadline is not after {@code now}.
     *
     * @return number of groups timed out
     */
    public int checkDeadlines(Instant now) {
        List<String> expired = new ArrayList<>();
        for (SubchatGroup group : groups.values()) {
            if (group.isOpen() && !now.isBefore(group.getDeadline())) {
                expired.add(group.getGroupId());
            }
        }
        expired.forEach(this::onDeadline);
        return expired.size();
    }

    public Optional<SubchatGroup> findGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public Optional<ChildConversation> findChild(String childId) {
        return Optional.ofNullable(childrenById.get(childId));
    }

    /**
     * Whether the conversation was a child of a group that has resolved.
     */
    public boolean isRetired(String conversationId) {
        return retired.contains(conversationId);
    }

    int openGroupCount() {
        return groups.size();
    }

    String timeoutMessage() {
        return "Error: subchats did not finish within " + deadline.toSeconds() + " seconds";
    }

    private void complete(SubchatGroup group) {
        List<Object> values = group.getChildren().stream()
                .sorted(Comparator.comparingInt(ChildConversation::getIndex))
                .map(ChildConversation::getValue)
                .toList();
        group.setAggregatedResult(values);
        group.setResolution(SubchatResolution.COMPLETED);

        String json;
        try {
            json = objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.error("[Subchat] Cannot serialize values of group {}: {}", group.getGroupId(), e.getMessage(), e);
            json = String.valueOf(values);
        }
        log.info("[Subchat] Group {} completed", group.getGroupId());
        delivery.deliver(group.getParentInvocationId(), group.getParentConversationId(), ToolResult.success(json));
        resumeParent(group);
        retire(group);
    }

    private void resumeParent(SubchatGroup group) {
        conversations.find(group.getParentConversationId()).ifPresent(parent -> {
            if (parent.getState() == ConversationState.AWAITING_CHILDREN) {
                parent.setState(ConversationState.AWAITING_TOOLS);
            }
        });
    }

    private void retire(SubchatGroup group) {
        groups.remove(group.getGroupId());
        for (ChildConversation child : group.getChildren()) {
            childrenById.remove(child.getChildId());
            conversations.remove(child.getChildId());
            retired.add(child.getChildId());
        }
        Iterator<String> oldest = retired.iterator();
        while (retired.size() > MAX_RETIRED_IDS && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        log.debug("[Subchat] Group {} retired, {} group(s) still open", group.getGroupId(), groups.size());
    }
}
