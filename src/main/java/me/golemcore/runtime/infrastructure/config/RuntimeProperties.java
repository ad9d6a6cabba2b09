package me.golemcore.runtime.infrastructure.config;

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
import me.golemcore.runtime.domain.loop.UnregisteredEventPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code runtime.*} prefix:
 * <ul>
 * <li>{@link FeedProperties} - event feed subscription</li>
 * <li>{@link BackendProperties} - backend HTTP API</li>
 * <li>{@link DispatcherProperties} - event loop behaviour</li>
 * <li>{@link SubchatProperties} - child conversation deadlines</li>
 * <li>{@link ControlProperties} - turn-control scripts and their limits</li>
 * <li>{@link BudgetProperties} - spend ceilings</li>
 * <li>{@link ToolsProperties} - in-process tool settings</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "runtime")
@Data
public class RuntimeProperties {

    private String agentId;
    private FeedProperties feed = new FeedProperties();
    private BackendProperties backend = new BackendProperties();
    private HttpProperties http = new HttpProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();
    private SubchatProperties subchat = new SubchatProperties();
    private ControlProperties control = new ControlProperties();
    private BudgetProperties budget = new BudgetProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class FeedProperties {
        private String url;
        private Duration reconnectMinBackoff = Duration.ofSeconds(1);
        private Duration reconnectMaxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class BackendProperties {
        private String baseUrl;
        private String apiKey;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class DispatcherProperties {
        private Duration sleepIfIdle = Duration.ofSeconds(10);
        private UnregisteredEventPolicy unregisteredPolicy = UnregisteredEventPolicy.SHUTDOWN;
    }

    @Data
    public static class SubchatProperties {
        private Duration deadline = Duration.ofHours(1);
        private String defaultProfile = "subtask";
        private int maxChildren = 16;
    }

    // ==================== TURN CONTROL ====================

    @Data
    public static class ControlProperties {
        private Duration timeout = Duration.ofMillis(500);
        private long statementLimit = 1_000_000;
        /** Profile name to script source. */
        private Map<String, String> profiles = new HashMap<>();
    }

    @Data
    public static class BudgetProperties {
        private double defaultCeiling = 100000;
        private double softThresholdRatio = 0.8;
    }

    @Data
    public static class ToolsProperties {
        private List<String> confirmationRequired = new ArrayList<>();
        private int maxResultChars = 100000;
    }
}
