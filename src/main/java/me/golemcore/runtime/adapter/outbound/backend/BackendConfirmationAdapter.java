package me.golemcore.runtime.adapter.outbound.backend;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import me.golemcore.runtime.port.outbound.ConfirmationPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Sends approval requests to {@code POST /v1/tool-calls/{invocationId}/confirmation}.
 * The human's decision comes back as a confirmation-resolved feed event.
 */
@Component
@RequiredArgsConstructor
public class BackendConfirmationAdapter implements ConfirmationPort {

    private final BackendHttpClient client;

    @Override
    public CompletableFuture<Void> requestConfirmation(String invocationId, String setupKey, String command,
            String explanation) {
        return client.post("/v1/tool-calls/" + invocationId + "/confirmation",
                new ConfirmationRequest(setupKey, command, explanation));
    }

    record ConfirmationRequest(@JsonProperty("setup_key") String setupKey, String command, String explanation) {
    }
}
