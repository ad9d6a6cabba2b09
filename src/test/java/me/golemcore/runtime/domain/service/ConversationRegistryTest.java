package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.Conversation;
import me.golemcore.runtime.domain.model.ConversationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversationRegistryTest {

    private ConversationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConversationRegistry();
    }

    @Test
    void shouldCreateTopLevelConversationOnce() {
        Conversation first = registry.getOrCreate("conv-1");

        assertSame(first, registry.getOrCreate("conv-1"));
        assertFalse(first.isChild());
        assertEquals(Conversation.DEFAULT_PROFILE, first.effectiveProfile());
    }

    @Test
    void shouldRemoveConversation() {
        registry.registerChild("sc-1", "sg-1", "subtask");

        assertTrue(registry.remove("sc-1").isPresent());
        assertTrue(registry.find("sc-1").isEmpty());
        assertTrue(registry.remove("sc-1").isEmpty());
    }

    // ==================== Bounds ====================

    @Test
    void shouldDropLeastRecentlyUsedIdleConversationBeyondLimit() {
        registry.getOrCreate("old");
        registry.getOrCreate("recent");
        for (int i = 0; i < ConversationRegistry.MAX_CONVERSATIONS; i++) {
            if (i == ConversationRegistry.MAX_CONVERSATIONS / 2) {
                registry.find("recent");
            }
            registry.getOrCreate("c" + i);
        }

        assertEquals(ConversationRegistry.MAX_CONVERSATIONS, registry.size());
        assertTrue(registry.find("old").isEmpty());
        assertTrue(registry.find("recent").isPresent());
    }

    @Test
    void shouldKeepBusyConversationBeyondLimit() {
        registry.getOrCreate("busy").setState(ConversationState.AWAITING_CHILDREN);
        for (int i = 0; i < ConversationRegistry.MAX_CONVERSATIONS; i++) {
            registry.getOrCreate("c" + i);
        }

        assertEquals(ConversationRegistry.MAX_CONVERSATIONS + 1, registry.size());
        assertTrue(registry.isInState("busy", ConversationState.AWAITING_CHILDREN));
    }
}
