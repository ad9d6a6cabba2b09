package me.golemcore.runtime.adapter.inbound.feed;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Maps feed frames {@code {"kind", "conversation_id", "sequence_marker",
 * "payload"}} to {@link FeedEvent}s. Frames that are not events (subscription
 * acknowledgements, pings) and unknown kinds map to {@code null}.
 */
@Component
@Slf4j
public class FeedEventMapper {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FeedEventMapper(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public FeedEvent map(String frame) {
        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("[Feed] Unparseable frame: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject() || !node.hasNonNull("kind")) {
            log.debug("[Feed] Ignoring non-event frame");
            return null;
        }

        String wireKind = node.get("kind").asText();
        FeedEventKind kind = FeedEventKind.fromWireName(wireKind);
        if (kind == null) {
            log.debug("[Feed] Ignoring frame of unknown kind '{}'", wireKind);
            return null;
        }

        JsonNode conversation = node.get("conversation_id");
        JsonNode marker = node.get("sequence_marker");
        JsonNode payload = node.get("payload");
        return FeedEvent.builder()
                .kind(kind)
                .conversationId(conversation != null && conversation.isTextual() && !conversation.asText().isEmpty()
                        ? conversation.asText()
                        : null)
                .sequenceMarker(marker != null && marker.canConvertToLong() ? marker.asLong() : -1)
                .payload(payload != null && payload.isObject() ? objectMapper.convertValue(payload, PAYLOAD_TYPE)
                        : Map.of())
                .receivedAt(clock.instant())
                .build();
    }
}
