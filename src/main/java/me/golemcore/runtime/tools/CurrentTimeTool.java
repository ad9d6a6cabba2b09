package me.golemcore.runtime.tools;

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

import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.port.inbound.ToolHandler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current date and time.
 *
 * <p>
 * Returns the current date/time in a specified timezone, or the runtime's
 * default zone. Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}.
 */
@Component
public class CurrentTimeTool implements ToolHandler {

    public static final String NAME = "current_time";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public CurrentTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is the runtime timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutcome> execute(ToolInvocation invocation) {
        Object timezone = invocation.arguments().get("timezone");
        ZoneId zoneId;
        if (timezone instanceof String zone && !zone.isBlank()) {
            try {
                zoneId = ZoneId.of(zone.trim());
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolOutcome.completed(
                        ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid timezone: " + zone)));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String text = now.format(FORMATTER) + " ("
                + now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + ")";
        return CompletableFuture.completedFuture(ToolOutcome.completed(text));
    }
}
