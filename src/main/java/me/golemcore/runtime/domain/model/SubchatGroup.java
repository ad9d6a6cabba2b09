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
import java.util.Optional;

/**
 * The set of child conversations spawned on behalf of one tool invocation. The
 * group resolves exactly once: either every child finalized, or the deadline
 * passed first.
 */
@Data
@Builder
public class SubchatGroup {

    private String groupId;
    private String parentInvocationId;
    private String parentConversationId;

    @Builder.Default
    private List<ChildConversation> children = new ArrayList<>();

    private Instant createdAt;
    private Instant deadline;

    @Builder.Default
    private SubchatResolution resolution = SubchatResolution.OPEN;

    private List<Object> aggregatedResult;

    public boolean isOpen() {
        return resolution == SubchatResolution.OPEN;
    }

    public boolean allFinalized() {
        return children.stream().allMatch(ChildConversation::isFinalized);
    }

    public long finalizedCount() {
        return children.stream().filter(ChildConversation::isFinalized).count();
    }

    public Optional<ChildConversation> findChild(String childId) {
        return children.stream()
                .filter(child -> child.getChildId().equals(childId))
                .findFirst();
    }

    public List<String> childIds() {
        return children.stream().map(ChildConversation::getChildId).toList();
    }
}
