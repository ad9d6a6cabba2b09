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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup validation of the runtime configuration.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RuntimeConfiguration {

    private final RuntimeProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        validate(properties);
        log.info("Agent runtime starting for agent '{}'", properties.getAgentId());
        log.info("Feed: {}", properties.getFeed().getUrl());
        log.info("Backend: {}", properties.getBackend().getBaseUrl());
        log.info("Control profiles: {}", properties.getControl().getProfiles().keySet());
        log.info("Unregistered tool policy: {}", properties.getDispatcher().getUnregisteredPolicy());
    }

    static void validate(RuntimeProperties properties) {
        requireText(properties.getAgentId(), "runtime.agent-id");
        requireText(properties.getFeed().getUrl(), "runtime.feed.url");
        requireText(properties.getBackend().getBaseUrl(), "runtime.backend.base-url");
        if (properties.getBudget().getDefaultCeiling() <= 0) {
            throw new RuntimeConfigurationException("runtime.budget.default-ceiling must be positive");
        }
        double ratio = properties.getBudget().getSoftThresholdRatio();
        if (ratio <= 0 || ratio > 1) {
            throw new RuntimeConfigurationException("runtime.budget.soft-threshold-ratio must be in (0, 1]");
        }
        if (properties.getSubchat().getDeadline().isNegative() || properties.getSubchat().getDeadline().isZero()) {
            throw new RuntimeConfigurationException("runtime.subchat.deadline must be positive");
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new RuntimeConfigurationException("Missing required property: " + key);
        }
    }
}
