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

import lombok.Data;

/**
 * Spend counter of one conversation.
 */
@Data
public class Budget {

    private final String conversationId;
    private double spent;
    private double ceiling;
    private double softThresholdRatio;
    private boolean blocked;

    public Budget(String conversationId, double ceiling, double softThresholdRatio) {
        this.conversationId = conversationId;
        this.ceiling = ceiling;
        this.softThresholdRatio = softThresholdRatio;
    }

    public double remaining() {
        return Math.max(0, ceiling - spent);
    }

    public boolean isSoftLimitReached() {
        return spent >= ceiling * softThresholdRatio;
    }
}
