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
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the latest state of every task the agent is assigned.
 */
@Component
@Slf4j
public class TaskUpdatedHandler implements EventHandler {

    private final Map<String, Map<String, Object>> latestTasks = new LinkedHashMap<>();

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.TASK_UPDATED;
    }

    @Override
    public void handle(FeedEvent event) {
        String taskId = event.payloadString("task_id");
        if (taskId == null) {
            log.warn("[Tasks] Task update without task_id: {}", event.describe());
            return;
        }
        latestTasks.put(taskId, event.payload());
        log.debug("[Tasks] Task {} is now {}", taskId, event.payloadString("status"));
    }

    public Optional<Map<String, Object>> latestTask(String taskId) {
        return Optional.ofNullable(latestTasks.get(taskId));
    }

    public int size() {
        return latestTasks.size();
    }
}
