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
 * Tagged outcome of routing one tool invocation.
 *
 * <p>
 * In-process handlers return {@link Completed}, {@link NeedsConfirmation} or
 * {@link AwaitingChildren}. The router itself produces {@link Deferred} while
 * an asynchronous handler is still running, {@link Unclaimed} when no
 * in-process handler owns the tool, {@link Cancelled} when turn control
 * cancelled the call first, and {@link Duplicate} when the invocation was
 * redelivered after it was answered or while it is still open.
 */
public sealed interface ToolOutcome permits ToolOutcome.Completed, ToolOutcome.NeedsConfirmation,
        ToolOutcome.AwaitingChildren, ToolOutcome.Deferred, ToolOutcome.Unclaimed, ToolOutcome.Cancelled,
        ToolOutcome.Duplicate {

    static ToolOutcome completed(String content) {
        return new Completed(ToolResult.success(content));
    }

    static ToolOutcome completed(ToolResult result) {
        return new Completed(result);
    }

    static ToolOutcome needsConfirmation(String setupKey, String command, String explanation) {
        return new NeedsConfirmation(setupKey, command, explanation);
    }

    static ToolOutcome awaitingChildren(String groupId) {
        return new AwaitingChildren(groupId);
    }

    /**
     * The handler produced a result that should be posted now.
     */
    record Completed(ToolResult result) implements ToolOutcome {
    }

    /**
     * The call is suspended until a human approves or denies it. Re-entrant on
     * the same invocation id.
     */
    record NeedsConfirmation(String setupKey, String command, String explanation) implements ToolOutcome {
    }

    /**
     * The handler spawned a subchat group; the result is delivered when the group
     * resolves.
     */
    record AwaitingChildren(String groupId) implements ToolOutcome {
    }

    record Deferred() implements ToolOutcome {
    }

    record Unclaimed() implements ToolOutcome {
    }

    record Cancelled() implements ToolOutcome {
    }

    /**
     * Nothing was done: the id is answered already or still in progress.
     */
    record Duplicate() implements ToolOutcome {
    }
}
