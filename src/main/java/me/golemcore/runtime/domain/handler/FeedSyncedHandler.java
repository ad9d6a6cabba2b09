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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.service.ConversationRegistry;
import me.golemcore.runtime.port.inbound.EventHandler;
import me.golemcore.runtime.port.inbound.ToolHandler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The remote side finished replaying the initial state.
 */
@Component
@Slf4j
public class FeedSyncedHandler implements EventHandler {

    private final ConversationRegistry conversations;
    private final List<ToolHandler> toolHandlers;
    private final AtomicInteger syncCount = new AtomicInteger();

    public FeedSyncedHandler(ConversationRegistry conversations, List<ToolHandler> toolHandlers) {
        this.conversations = conversations;
        this.toolHandlers = toolHandlers;
    }

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.FEED_SYNCED;
    }

    @Override
    public void handle(FeedEvent event) {
        int count = syncCount.incrementAndGet();
        log.info("[Feed] Initial sync over (#{}), {} conversation(s) known", count, conversations.all().size());
        if (toolHandlers.isEmpty()) {
            log.warn("[Feed] No in-process tools registered, every tool call is left to external services");
        }
    }

    public int getSyncCount() {
        return syncCount.get();
    }
}
