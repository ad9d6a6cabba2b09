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

import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.ToolDefinition;

import java.util.List;
import java.util.Set;

/**
 * Live subscription to the remote event feed. Received events are submitted to
 * the event park from the adapter's own threads.
 */
public interface EventSourcePort {

    /**
     * Opens the subscription, advertising the wanted event kinds and the tools
     * this process handles in-process.
     */
    void start(Set<FeedEventKind> kinds, List<ToolDefinition> inProcessTools);

    /**
     * Unsubscribes and releases the connection. Safe to call more than once.
     */
    void close();

    boolean isConnected();
}
