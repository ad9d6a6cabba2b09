package me.golemcore.runtime.domain.model;

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

import lombok.Builder;

import java.util.List;

/**
 * What a turn-control script asked for. Every field is optional; the evaluator
 * applies them in declaration order.
 */
@Builder
public record ControlScriptResult(String hardError, List<String> cancelInvocationIds, String injectInstruction,
        Object terminalValue) {

    private static final ControlScriptResult EMPTY = new ControlScriptResult(null, List.of(), null, null);

    public ControlScriptResult {
        cancelInvocationIds = cancelInvocationIds != null ? List.copyOf(cancelInvocationIds) : List.of();
    }

    public static ControlScriptResult empty() {
        return EMPTY;
    }

    public boolean hasHardError() {
        return hardError != null && !hardError.isBlank();
    }

    public boolean hasInjectInstruction() {
        return injectInstruction != null && !injectInstruction.isBlank();
    }

    public boolean hasTerminalValue() {
        return terminalValue != null;
    }

    public boolean isEmpty() {
        return !hasHardError() && cancelInvocationIds.isEmpty() && !hasInjectInstruction() && !hasTerminalValue();
    }
}
