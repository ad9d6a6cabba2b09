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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.EventPark;
import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.EventSourcePort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket subscription to the remote event feed.
 *
 * <p>
 * On open the adapter sends a subscribe frame naming the agent, the wanted
 * event kinds and the in-process tools. Every event frame is mapped and
 * submitted to the {@link EventPark}. A dropped connection is reopened with
 * exponential backoff; the remote side replays from its last known state and
 * the park drops the duplicates. The reconnect thread lives from
 * {@link #start} to {@link #close}; the adapter can be started again after a
 * close.
 */
@Component
@Slf4j
public class WebSocketEventFeedAdapter implements EventSourcePort {

    private static final int NORMAL_CLOSURE = 1000;
    private static final long PING_INTERVAL_SECONDS = 30;

    private final RuntimeProperties properties;
    private final OkHttpClient httpClient;
    private final FeedEventMapper mapper;
    private final EventPark park;
    private final ObjectMapper objectMapper;
    private final AtomicInteger failedAttempts = new AtomicInteger();

    private volatile ScheduledExecutorService reconnectExecutor;
    private volatile WebSocket webSocket;
    private volatile String subscribeFrame;
    private volatile boolean connected;
    private volatile boolean closed;

    public WebSocketEventFeedAdapter(RuntimeProperties properties, OkHttpClient baseHttpClient,
            FeedEventMapper mapper, EventPark park, ObjectMapper objectMapper) {
        this.properties = properties;
        this.mapper = mapper;
        this.park = park;
        this.objectMapper = objectMapper;
        // Feed connections are long-lived and mostly idle
        this.httpClient = baseHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .pingInterval(PING_INTERVAL_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public synchronized void start(Set<FeedEventKind> kinds, List<ToolDefinition> inProcessTools) {
        subscribeFrame = buildSubscribeFrame(kinds, inProcessTools);
        ScheduledExecutorService executor = reconnectExecutor;
        if (executor == null || executor.isShutdown()) {
            reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "feed-reconnect");
                t.setDaemon(true);
                return t;
            });
        }
        failedAttempts.set(0);
        closed = false;
        log.info("[Feed] Subscribing to {} for kinds {} with {} in-process tool(s)", properties.getFeed().getUrl(),
                kinds, inProcessTools.size());
        connect();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.send(unsubscribeFrame());
            socket.close(NORMAL_CLOSURE, "shutdown");
            log.info("[Feed] Unsubscribed");
        }
        connected = false;
        ScheduledExecutorService executor = reconnectExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @PreDestroy
    public void shutdown() {
        close();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    void connect() {
        if (closed) {
            return;
        }
        Request.Builder request = new Request.Builder().url(properties.getFeed().getUrl());
        String apiKey = properties.getBackend().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        webSocket = httpClient.newWebSocket(request.build(), new FeedListener());
    }

    Duration nextBackoff(int attempt) {
        Duration min = properties.getFeed().getReconnectMinBackoff();
        Duration max = properties.getFeed().getReconnectMaxBackoff();
        long millis = min.toMillis() << Math.min(attempt, 20);
        return Duration.ofMillis(Math.min(millis, max.toMillis()));
    }

    /**
     * Schedules the next connection attempt unless the adapter is closed.
     *
     * @return {@code true} if an attempt was scheduled
     */
    boolean scheduleReconnect() {
        ScheduledExecutorService executor = reconnectExecutor;
        if (closed || executor == null || executor.isShutdown()) {
            return false;
        }
        Duration delay = nextBackoff(failedAttempts.getAndIncrement());
        try {
            executor.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // closed in the meantime
            log.debug("[Feed] Reconnect not scheduled, feed is closed");
            return false;
        }
        log.info("[Feed] Reconnecting in {}ms", delay.toMillis());
        return true;
    }

    private String buildSubscribeFrame(Set<FeedEventKind> kinds, List<ToolDefinition> tools) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "subscribe");
        frame.put("agent_id", properties.getAgentId());
        frame.put("kinds", kinds.stream().map(FeedEventKind::wireName).toList());
        frame.put("inprocess_tools", tools.stream().map(tool -> Map.of(
                "name", tool.getName(),
                "description", tool.getDescription() != null ? tool.getDescription() : "",
                "parameters", tool.getInputSchema() != null ? tool.getInputSchema() : Map.of())).toList());
        return toJson(frame);
    }

    private String unsubscribeFrame() {
        return toJson(Map.of("type", "unsubscribe", "agent_id", properties.getAgentId()));
    }

    private String toJson(Map<String, Object> frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize feed frame", e);
        }
    }

    private final class FeedListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket socket, Response response) {
            if (socket != webSocket) {
                return;
            }
            connected = true;
            failedAttempts.set(0);
            socket.send(subscribeFrame);
            log.info("[Feed] Connected");
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            FeedEvent event = mapper.map(text);
            if (event != null) {
                park.submit(event);
            }
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            if (socket != webSocket) {
                return;
            }
            connected = false;
            log.info("[Feed] Closed: {} {}", code, reason);
            scheduleReconnect();
        }

        @Override
        public void onFailure(WebSocket socket, Throwable error, Response response) {
            if (socket != webSocket) {
                return;
            }
            connected = false;
            log.warn("[Feed] Connection failed: {}", error.getMessage());
            scheduleReconnect();
        }
    }
}
