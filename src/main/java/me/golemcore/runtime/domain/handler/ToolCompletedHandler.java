package me.golemcore.runtime.domain.handler;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

/**
 * Applies asynchronous tool handler completions on the dispatcher thread.
 */
@Component
@RequiredArgsConstructor
public class ToolCompletedHandler implements EventHandler {

    private final ToolRouter toolRouter;

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.TOOL_COMPLETED;
    }

    @Override
    public void handle(FeedEvent event) {
        toolRouter.onToolCompleted(event);
    }
}
