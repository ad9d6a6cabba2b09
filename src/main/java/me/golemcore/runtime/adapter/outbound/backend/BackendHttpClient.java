package me.golemcore.runtime.adapter.outbound.backend;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * JSON-over-HTTP access to the backend API.
 *
 * <p>
 * Every call runs off the caller's thread and completes exceptionally with a
 * {@link BackendCallException} on transport errors and non-2xx statuses.
 * Requests carry the agent id and, when configured, a bearer API key.
 */
@Component
@Slf4j
public class BackendHttpClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    private final RuntimeProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public BackendHttpClient(RuntimeProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Void> post(String path, Object body) {
        return CompletableFuture.runAsync(() -> execute(path, body));
    }

    void execute(String path, Object body) {
        String url = baseUrl() + path;
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendCallException("Cannot serialize request for " + path, e);
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .header("X-Agent-Id", properties.getAgentId())
                .post(RequestBody.create(json, JSON));
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody responseBody = response.body();
                String error = responseBody != null ? responseBody.string() : "";
                log.warn("[Backend] POST {} failed: HTTP {}", path, response.code());
                throw new BackendCallException("POST " + path + " failed: HTTP " + response.code() + " "
                        + truncate(error), response.code());
            }
            log.debug("[Backend] POST {} -> {}", path, response.code());
        } catch (IOException e) {
            log.warn("[Backend] POST {} error: {}", path, e.getMessage());
            throw new BackendCallException("POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    private String baseUrl() {
        String base = properties.getBackend().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getBackend().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }
}
