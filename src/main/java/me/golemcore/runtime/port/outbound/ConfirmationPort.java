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

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human to approve a tool call before it runs. The decision
 * arrives later as a confirmation-resolved feed event.
 */
public interface ConfirmationPort {

    /**
     * Sends an approval request for a pending invocation.
     *
     * @param invocationId
     *            the invocation awaiting approval
     * @param setupKey
     *            identifies what is being approved
     * @param command
     *            the action that will run
     * @param explanation
     *            human-readable description of the action
     */
    CompletableFuture<Void> requestConfirmation(String invocationId, String setupKey, String command,
            String explanation);
}
