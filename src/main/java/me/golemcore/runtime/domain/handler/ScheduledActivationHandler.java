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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.port.inbound.EventHandler;
import me.golemcore.runtime.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

/**
 * A schedule fired: asks the remote side to start an activation of this
 * agent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledActivationHandler implements EventHandler {

    private final ConversationPort conversationPort;

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.SCHEDULED_ACTIVATION;
    }

    @Override
    public void handle(FeedEvent event) {
        String scheduleId = event.payloadString("sched_id");
        if (scheduleId == null) {
            log.warn("[Schedule] Activation without sched_id: {}", event.describe());
            return;
        }
        log.info("[Schedule] Activation {} ({})", scheduleId, event.payloadString("sched_type"));
        conversationPort.activate(scheduleId, event.payloadMap("details")).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[Schedule] Activation {} failed: {}", scheduleId, error.getMessage());
            }
        });
    }
}
