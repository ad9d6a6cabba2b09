package me.golemcore.runtime.tools;

import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolInvocation;
import me.golemcore.runtime.domain.model.ToolOutcome;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.testsupport.fakes.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurrentTimeToolTest {

    private CurrentTimeTool tool;

    @BeforeEach
    void setUp() {
        // Sunday
        tool = new CurrentTimeTool(new MutableClock(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
    }

    private ToolResult run(Map<String, Object> arguments) {
        ToolOutcome outcome = tool.execute(new ToolInvocation("tc-1", "conv-1", CurrentTimeTool.NAME, arguments,
                false)).join();
        return assertInstanceOf(ToolOutcome.Completed.class, outcome).result();
    }

    @Test
    void shouldDescribeItself() {
        assertEquals("current_time", tool.getToolName());
        assertEquals("object", tool.getDefinition().getInputSchema().get("type"));
    }

    @Test
    void shouldUseClockZoneByDefault() {
        ToolResult result = run(Map.of());

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().startsWith("2026-03-01 10:15:30"));
        assertTrue(result.getContent().endsWith("(Sunday)"));
    }

    @Test
    void shouldUseRequestedTimezone() {
        ToolResult result = run(Map.of("timezone", "Asia/Tokyo"));

        assertTrue(result.getContent().startsWith("2026-03-01 19:15:30"));
    }

    @Test
    void shouldTreatNullTimezoneAsDefault() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("timezone", null);

        assertTrue(run(arguments).isSuccess());
    }

    @Test
    void shouldRejectUnknownTimezone() {
        ToolResult result = run(Map.of("timezone", "Mars/Olympus"));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals("Invalid timezone: Mars/Olympus", result.getContent());
    }
}
