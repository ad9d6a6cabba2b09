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

/**
 * A child conversation spawned for a subchat group. {@code index} is its
 * position in the spawning request and decides where its value lands in the
 * aggregated result.
 */
@Data
@Builder
public class ChildConversation {

    private String childId;
    private String groupId;
    private int index;
    private String openingContent;
    private String controlProfile;
    private String title;
    private boolean finalized;
    private Object value;
    private boolean terminated;
}
