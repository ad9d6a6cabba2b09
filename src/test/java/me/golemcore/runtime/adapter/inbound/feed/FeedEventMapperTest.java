package me.golemcore.runtime.adapter.inbound.feed;

import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.testsupport.fakes.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeedEventMapperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private FeedEventMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new FeedEventMapper(RuntimeConfiguration.objectMapper(), new MutableClock(NOW));
    }

    @Test
    void shouldMapToolInvocationFrame() {
        FeedEvent event = mapper.map("""
                {"kind":"tool_invocation","conversation_id":"conv-1","sequence_marker":12,
                 "payload":{"invocation_id":"tc-1","tool_name":"weather","arguments":{"city":"Paris"}}}
                """);

        assertNotNull(event);
        assertEquals(FeedEventKind.TOOL_INVOCATION, event.kind());
        assertEquals("conv-1", event.conversationId());
        assertEquals(12, event.sequenceMarker());
        assertEquals("tc-1", event.payloadString("invocation_id"));
        assertEquals(Map.of("city", "Paris"), event.payloadMap("arguments"));
        assertEquals(NOW, event.receivedAt());
    }

    @Test
    void shouldDefaultMissingMarkerAndConversation() {
        FeedEvent event = mapper.map("{\"kind\":\"budget_reset\"}");

        assertNotNull(event);
        assertNull(event.conversationId());
        assertEquals(-1, event.sequenceMarker());
        assertTrue(event.payload().isEmpty());
    }

    @Test
    void shouldTreatEmptyConversationIdAsNone() {
        FeedEvent event = mapper.map("{\"kind\":\"task_updated\",\"conversation_id\":\"\",\"sequence_marker\":1}");

        assertNull(event.conversationId());
    }

    @Test
    void shouldKeepPayloadLists() {
        FeedEvent event = mapper.map("""
                {"kind":"message_appended","conversation_id":"c","payload":{"tool_calls":[{"id":"tc-1"}]}}
                """);

        assertEquals(List.of(Map.of("id", "tc-1")), event.payloadList("tool_calls"));
    }

    @Test
    void shouldIgnoreUnusableFrames() {
        assertNull(mapper.map("not json"));
        assertNull(mapper.map("[1,2]"));
        assertNull(mapper.map("{\"type\":\"subscribed\"}"));
        assertNull(mapper.map("{\"kind\":\"weather_changed\"}"));
        // internal kinds never come from the wire
        assertNull(mapper.map("{\"kind\":\"tool_completed\",\"payload\":{\"invocation_id\":\"tc-1\"}}"));
    }
}
