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

import java.util.Locale;

/**
 * Discriminator of events arriving from the remote feed.
 *
 * <p>
 * {@link #TOOL_COMPLETED} is process-internal: it is submitted by the tool
 * router when an asynchronous in-process tool handler finishes, so that the
 * outcome is applied on the dispatcher thread.
 */
public enum FeedEventKind {

    CONVERSATION_UPDATED, MESSAGE_APPENDED, TOOL_INVOCATION, TASK_UPDATED, SCHEDULED_ACTIVATION, BUDGET_RESET, CONFIRMATION_RESOLVED, FEED_SYNCED, TOOL_COMPLETED;

    public boolean isInternal() {
        return this == TOOL_COMPLETED;
    }

    /**
     * Resolves a wire name such as {@code "message_appended"}.
     *
     * @return the kind, or {@code null} when the name is unknown or internal
     */
    public static FeedEventKind fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return null;
        }
        try {
            FeedEventKind kind = valueOf(wireName.trim().toUpperCase(Locale.ROOT));
            return kind.isInternal() ? null : kind;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
