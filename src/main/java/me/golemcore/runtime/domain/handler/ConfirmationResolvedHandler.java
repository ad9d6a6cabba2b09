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
import me.golemcore.runtime.domain.service.ToolRouter;
import me.golemcore.runtime.port.inbound.EventHandler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationResolvedHandler implements EventHandler {

    private final ToolRouter toolRouter;

    @Override
    public FeedEventKind getKind() {
        return FeedEventKind.CONFIRMATION_RESOLVED;
    }

    @Override
    public void handle(FeedEvent event) {
        String invocationId = event.payloadString("invocation_id");
        if (invocationId == null) {
            log.warn("[Confirmations] Resolution without invocation id: {}", event.describe());
            return;
        }
        toolRouter.onConfirmationResolved(invocationId, event.payloadBoolean("approved"));
    }
}
