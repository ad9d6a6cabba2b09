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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Typed input handed to a turn-control script. Serialized to the snake_case
 * variable names the script sees.
 */
@Builder
public record ControlScriptInput(
        @JsonProperty("turn_history") List<Map<String, Object>> turnHistory,
        @JsonProperty("spend_so_far") double spendSoFar,
        @JsonProperty("spend_ceiling") double spendCeiling,
        @JsonProperty("soft_limit_reached") boolean softLimitReached,
        @JsonProperty("phase") String phase,
        @JsonProperty("is_child") boolean child) {
}
