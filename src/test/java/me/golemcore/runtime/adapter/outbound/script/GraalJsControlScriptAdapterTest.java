package me.golemcore.runtime.adapter.outbound.script;

import me.golemcore.runtime.domain.model.ControlScriptInput;
import me.golemcore.runtime.domain.model.ControlScriptResult;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ControlScriptPort.ControlScriptException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraalJsControlScriptAdapterTest {

    private RuntimeProperties properties;
    private GraalJsControlScriptAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getControl().setTimeout(Duration.ofSeconds(5));
        properties.getControl().setStatementLimit(100_000);
        adapter = new GraalJsControlScriptAdapter(RuntimeConfiguration.objectMapper(), properties);
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private static ControlScriptInput input(String phase, boolean softLimit) {
        return ControlScriptInput.builder()
                .turnHistory(List.of(
                        Map.of("role", "user", "content", "hello", "tool_calls", List.of()),
                        Map.of("role", "assistant", "content", "42", "tool_calls", List.of())))
                .spendSoFar(8.0)
                .spendCeiling(10.0)
                .softLimitReached(softLimit)
                .phase(phase)
                .child(true)
                .build();
    }

    // ==================== Outputs ====================

    @Test
    void shouldReturnEmptyResultForScriptThatSetsNothing() {
        ControlScriptResult result = adapter.evaluate("noop", "var x = 1;", input("before", false));

        assertTrue(result.isEmpty());
    }

    @Test
    void shouldReadInputsAndProduceInstruction() {
        String script = """
                if (phase === 'before' && soft_limit_reached) {
                  inject_instruction = 'Spent ' + spend_so_far + ' of ' + spend_ceiling + ', wrap up';
                }
                """;

        ControlScriptResult result = adapter.evaluate("default", script, input("before", true));

        assertEquals("Spent 8 of 10, wrap up", result.injectInstruction());
    }

    @Test
    void shouldProduceTerminalValueFromHistory() {
        String script = """
                var last = turn_history[turn_history.length - 1];
                if (is_child && phase === 'after' && last.role === 'assistant') {
                  terminal_value = last.content;
                }
                """;

        ControlScriptResult result = adapter.evaluate("subtask", script, input("after", false));

        assertEquals("42", result.terminalValue());
    }

    @Test
    void shouldKeepStructuredTerminalValue() {
        ControlScriptResult result = adapter.evaluate("subtask", "terminal_value = {score: 3, tags: ['a']};",
                input("after", false));

        assertEquals(Map.of("score", 3, "tags", List.of("a")), result.terminalValue());
    }

    @Test
    void shouldProduceHardErrorAndCancellations() {
        String script = """
                hard_error = 'too expensive';
                cancel_invocation_ids = ['tc-1', 7, 'tc-2'];
                """;

        ControlScriptResult result = adapter.evaluate("strict", script, input("after", false));

        assertEquals("too expensive", result.hardError());
        assertEquals(List.of("tc-1", "tc-2"), result.cancelInvocationIds());
    }

    @Test
    void shouldDropOutputsOfWrongShape() {
        String script = """
                hard_error = 42;
                inject_instruction = {text: 'no'};
                cancel_invocation_ids = 'tc-1';
                """;

        ControlScriptResult result = adapter.evaluate("sloppy", script, input("after", false));

        assertTrue(result.isEmpty());
    }

    // ==================== Failures and limits ====================

    @Test
    void shouldReportScriptError() {
        ControlScriptException error = assertThrows(ControlScriptException.class,
                () -> adapter.evaluate("broken", "throw new Error('bad');", input("before", false)));

        assertTrue(error.getMessage().contains("failed"));
    }

    @Test
    void shouldReportSyntaxError() {
        assertThrows(ControlScriptException.class,
                () -> adapter.evaluate("broken", "if (", input("before", false)));
    }

    @Test
    void shouldDenyHostAccess() {
        assertThrows(ControlScriptException.class,
                () -> adapter.evaluate("escape", "Java.type('java.lang.System').exit(1);", input("before", false)));
    }

    @Test
    void shouldStopInfiniteLoopAtStatementLimit() {
        ControlScriptException error = assertThrows(ControlScriptException.class,
                () -> adapter.evaluate("loop", "while (true) {}", input("before", false)));

        assertTrue(error.getMessage().contains("exceeded"));
    }

    @Test
    void shouldStopLongRunningScriptAtTimeout() {
        properties.getControl().setTimeout(Duration.ofMillis(200));
        properties.getControl().setStatementLimit(Long.MAX_VALUE);
        GraalJsControlScriptAdapter slow = new GraalJsControlScriptAdapter(RuntimeConfiguration.objectMapper(),
                properties);
        try {
            long start = System.nanoTime();
            ControlScriptException error = assertThrows(ControlScriptException.class,
                    () -> slow.evaluate("loop", "while (true) {}", input("before", false)));

            assertTrue(error.getMessage().contains("exceeded 200ms"));
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        } finally {
            slow.shutdown();
        }
    }

    @Test
    void shouldIsolateRunsFromEachOther() {
        adapter.evaluate("leak", "globalThis.leaked = 'x'; inject_instruction = 'first';", input("before", false));

        ControlScriptResult second = adapter.evaluate("leak",
                "if (typeof leaked !== 'undefined') { hard_error = 'state leaked'; }", input("before", false));

        assertFalse(second.hasHardError());
    }
}
