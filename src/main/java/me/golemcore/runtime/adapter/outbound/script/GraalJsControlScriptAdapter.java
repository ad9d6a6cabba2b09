package me.golemcore.runtime.adapter.outbound.script;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.ControlScriptInput;
import me.golemcore.runtime.domain.model.ControlScriptResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ControlScriptPort;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs turn-control scripts in a GraalJS context with no host access, no I/O,
 * no threads and no process creation.
 *
 * <p>
 * The script sees its inputs as global variables ({@code turn_history},
 * {@code spend_so_far}, {@code spend_ceiling}, {@code soft_limit_reached},
 * {@code phase}, {@code is_child}) and answers by assigning any of
 * {@code hard_error}, {@code cancel_invocation_ids}, {@code inject_instruction}
 * and {@code terminal_value}. Values cross the boundary as JSON only. A value
 * of the wrong shape is treated as not set.
 *
 * <p>
 * Each run gets a fresh context bounded by a statement limit and a wall-clock
 * watchdog that cancels the context.
 */
@Component
@Slf4j
public class GraalJsControlScriptAdapter implements ControlScriptPort {

    private static final String INPUT_BINDING = "__input_json";

    private static final String PRELUDE = """
            var __input = JSON.parse(__input_json);
            var turn_history = __input.turn_history;
            var spend_so_far = __input.spend_so_far;
            var spend_ceiling = __input.spend_ceiling;
            var soft_limit_reached = __input.soft_limit_reached;
            var phase = __input.phase;
            var is_child = __input.is_child;
            var hard_error = null;
            var cancel_invocation_ids = null;
            var inject_instruction = null;
            var terminal_value = null;
            """;

    private static final String EPILOGUE = """
            JSON.stringify({
              hard_error: hard_error,
              cancel_invocation_ids: cancel_invocation_ids,
              inject_instruction: inject_instruction,
              terminal_value: terminal_value === undefined ? null : terminal_value
            });
            """;

    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final long statementLimit;
    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "control-script-watchdog");
        t.setDaemon(true);
        return t;
    });

    public GraalJsControlScriptAdapter(ObjectMapper objectMapper, RuntimeProperties properties) {
        this.objectMapper = objectMapper;
        this.timeout = properties.getControl().getTimeout();
        this.statementLimit = properties.getControl().getStatementLimit();
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
        try {
            watchdog.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ControlScriptResult evaluate(String profile, String source, ControlScriptInput input) {
        String inputJson;
        try {
            inputJson = objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new ControlScriptException("Cannot serialize script input", e);
        }

        String output = run(profile, source, inputJson);
        return parseResult(profile, output);
    }

    private String run(String profile, String source, String inputJson) {
        AtomicBoolean timedOut = new AtomicBoolean(false);
        Context context = newContext();
        ScheduledFuture<?> kill = watchdog.schedule(() -> {
            timedOut.set(true);
            context.close(true);
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            context.getBindings("js").putMember(INPUT_BINDING, inputJson);
            context.eval(Source.newBuilder("js", PRELUDE, "prelude.js").buildLiteral());
            context.eval(Source.newBuilder("js", source, profile + ".js").buildLiteral());
            Value result = context.eval(Source.newBuilder("js", EPILOGUE, "epilogue.js").buildLiteral());
            if (!result.isString()) {
                throw new ControlScriptException("Script '" + profile + "' produced no output");
            }
            return result.asString();
        } catch (PolyglotException e) {
            if (timedOut.get()) {
                throw new ControlScriptException("Script '" + profile + "' exceeded " + timeout.toMillis() + "ms", e);
            }
            // the statement limit is the only other reason the context gets cancelled
            if (e.isResourceExhausted() || e.isCancelled()) {
                throw new ControlScriptException("Script '" + profile + "' exceeded " + statementLimit
                        + " statements", e);
            }
            throw new ControlScriptException("Script '" + profile + "' failed: " + e.getMessage(), e);
        } finally {
            kill.cancel(false);
            if (!timedOut.get()) {
                context.close(true);
            }
        }
    }

    private Context newContext() {
        return Context.newBuilder("js")
                .allowHostAccess(HostAccess.NONE)
                .allowPolyglotAccess(PolyglotAccess.NONE)
                .allowIO(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowNativeAccess(false)
                .option("engine.WarnInterpreterOnly", "false")
                .resourceLimits(ResourceLimits.newBuilder()
                        .statementLimit(statementLimit, null)
                        .build())
                .build();
    }

    private ControlScriptResult parseResult(String profile, String output) {
        JsonNode node;
        try {
            node = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new ControlScriptException("Script '" + profile + "' produced invalid output", e);
        }
        if (node == null || !node.isObject()) {
            return ControlScriptResult.empty();
        }

        return ControlScriptResult.builder()
                .hardError(text(profile, node, "hard_error"))
                .cancelInvocationIds(invocationIds(profile, node.get("cancel_invocation_ids")))
                .injectInstruction(text(profile, node, "inject_instruction"))
                .terminalValue(terminalValue(profile, node.get("terminal_value")))
                .build();
    }

    private String text(String profile, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            log.warn("[TurnControl] Script '{}' set {} to a {}, ignoring", profile, field, value.getNodeType());
            return null;
        }
        return value.asText();
    }

    private List<String> invocationIds(String profile, JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            log.warn("[TurnControl] Script '{}' set cancel_invocation_ids to a {}, ignoring", profile,
                    value.getNodeType());
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                ids.add(item.asText());
            } else {
                log.warn("[TurnControl] Script '{}' listed a non-string invocation id, skipping", profile);
            }
        }
        return ids;
    }

    private Object terminalValue(String profile, JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(value, Object.class);
        } catch (JsonProcessingException e) {
            log.warn("[TurnControl] Script '{}' terminal value is unusable: {}", profile, e.getMessage());
            return null;
        }
    }
}
