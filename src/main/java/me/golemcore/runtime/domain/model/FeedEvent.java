package me.golemcore.runtime.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One remote-side change delivered by the event feed: a conversation update, an
 * appended message, a tool invocation, a task update and so on.
 *
 * <p>
 * Events are created by the feed adapter, consumed exactly once by the
 * dispatcher and then discarded. The sequence marker is non-decreasing per
 * source; a source is the conversation id, or the empty string for events that
 * belong to no conversation.
 */
@Builder
public record FeedEvent(FeedEventKind kind, String conversationId, long sequenceMarker, Map<String, Object> payload,
        Instant receivedAt) {

    public static final String GLOBAL_SOURCE = "";

    public FeedEvent {
        payload = payload != null ? Collections.unmodifiableMap(payload) : Map.of();
    }

    public String sourceKey() {
        return conversationId != null ? conversationId : GLOBAL_SOURCE;
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value instanceof String text ? text : null;
    }

    public boolean payloadBoolean(String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value instanceof String text && Boolean.parseBoolean(text);
    }

    public Double payloadDouble(String key) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> payloadMap(String key) {
        Object value = payload.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    public List<?> payloadList(String key) {
        Object value = payload.get(key);
        return value instanceof List<?> list ? list : List.of();
    }

    public String describe() {
        return kind + "(conversation=" + conversationId + ", marker=" + sequenceMarker + ")";
    }
}
