package me.golemcore.runtime.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeConfigurationTest {

    private RuntimeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.setAgentId("agent-7");
        properties.getFeed().setUrl("ws://feed.test/v1/feed");
        properties.getBackend().setBaseUrl("http://backend.test");
    }

    @Test
    void shouldAcceptCompleteConfiguration() {
        assertDoesNotThrow(() -> RuntimeConfiguration.validate(properties));
    }

    @Test
    void shouldRequireAgentId() {
        properties.setAgentId(" ");

        RuntimeConfigurationException error = assertThrows(RuntimeConfigurationException.class,
                () -> RuntimeConfiguration.validate(properties));
        assertTrue(error.getMessage().contains("runtime.agent-id"));
    }

    @Test
    void shouldRequireFeedAndBackendUrls() {
        properties.getFeed().setUrl(null);
        assertThrows(RuntimeConfigurationException.class, () -> RuntimeConfiguration.validate(properties));

        properties.getFeed().setUrl("ws://feed.test");
        properties.getBackend().setBaseUrl("");
        assertThrows(RuntimeConfigurationException.class, () -> RuntimeConfiguration.validate(properties));
    }

    @Test
    void shouldRejectInvalidBudgetSettings() {
        properties.getBudget().setDefaultCeiling(0);
        assertThrows(RuntimeConfigurationException.class, () -> RuntimeConfiguration.validate(properties));

        properties.getBudget().setDefaultCeiling(10);
        properties.getBudget().setSoftThresholdRatio(1.5);
        assertThrows(RuntimeConfigurationException.class, () -> RuntimeConfiguration.validate(properties));
    }

    @Test
    void shouldRejectNonPositiveDeadline() {
        properties.getSubchat().setDeadline(Duration.ZERO);

        assertThrows(RuntimeConfigurationException.class, () -> RuntimeConfiguration.validate(properties));
    }

    @Test
    void shouldHaveDefaults() {
        RuntimeProperties defaults = new RuntimeProperties();

        assertEquals(Duration.ofSeconds(10), defaults.getDispatcher().getSleepIfIdle());
        assertEquals(Duration.ofHours(1), defaults.getSubchat().getDeadline());
        assertEquals(Duration.ofMillis(500), defaults.getControl().getTimeout());
        assertEquals(0.8, defaults.getBudget().getSoftThresholdRatio(), 1e-9);
    }
}
