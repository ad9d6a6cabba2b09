package me.golemcore.runtime.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldDropOldestTurnsBeyondLimit() {
        Conversation conversation = Conversation.builder().id("conv-1").build();

        for (int i = 0; i < Conversation.MAX_TURNS + 5; i++) {
            conversation.addTurn(ConversationTurn.builder().messageId("m-" + i).role("user").createdAt(NOW).build());
        }

        assertEquals(Conversation.MAX_TURNS, conversation.getTurns().size());
        assertEquals("m-5", conversation.getTurns().get(0).getMessageId());
        assertEquals("m-" + (Conversation.MAX_TURNS + 4),
                conversation.getTurns().get(Conversation.MAX_TURNS - 1).getMessageId());
    }

    @Test
    void shouldUseDefaultProfileOnlyForTopLevel() {
        Conversation top = Conversation.builder().id("conv-1").build();
        Conversation child = Conversation.builder().id("sc-1").parentGroupId("sg-1").build();

        assertEquals(Conversation.DEFAULT_PROFILE, top.effectiveProfile());
        assertNull(child.effectiveProfile());
    }
}
