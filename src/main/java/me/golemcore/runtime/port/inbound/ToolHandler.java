package me.golemcore.runtime.port.inbound;

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

import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * In-process implementation of a tool the model can call. Tools expose their
 * JSON Schema definition, which is advertised in the feed subscription, and
 * implement the execution logic.
 */
public interface ToolHandler {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Invoked on the dispatcher thread; long-running work
     * should complete the returned future from another thread.
     *
     * @param invocation
     *            invocation identity and parsed arguments
     * @return a future containing the outcome
     */
    CompletableFuture<ToolOutcome> execute(ToolInvocation invocation);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
