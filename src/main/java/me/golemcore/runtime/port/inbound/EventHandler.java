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

import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;

/**
 * Handler for one kind of feed event. Exactly one handler may be registered per
 * kind; {@link FeedEventKind#TOOL_INVOCATION} is routed through tool handlers
 * instead and cannot be claimed here.
 */
public interface EventHandler {

    FeedEventKind getKind();

    /**
     * Handles the event on the dispatcher thread. Exceptions are caught and
     * logged by the dispatcher.
     */
    void handle(FeedEvent event);
}
