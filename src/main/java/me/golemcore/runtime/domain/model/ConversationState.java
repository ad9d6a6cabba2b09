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

/**
 * Lifecycle of a conversation as seen by this runtime.
 */
public enum ConversationState {

    /** Waiting for a human message (top level) or for finalization (child). */
    IDLE,

    /** A generation step was requested and its turn has not arrived yet. */
    GENERATING,

    /** The last turn requested tool calls that are still pending. */
    AWAITING_TOOLS,

    /** A tool call of this conversation spawned subchats. */
    AWAITING_CHILDREN,

    /** Spend reached the ceiling. Cleared by a budget reset. */
    BLOCKED,

    /** Turn control reported a hard error. */
    FAILED,

    /** A child delivered its terminal value. */
    FINISHED,

    /** Stopped by the subchat deadline. Later events are dropped. */
    TERMINATED;

    public boolean isClosed() {
        return this == FAILED || this == FINISHED || this == TERMINATED;
    }
}
