package me.golemcore.runtime.adapter.outbound.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.ChildConversation;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ToolResultPart;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class BackendAdaptersTest {

    private OkHttpMockEngine engine;
    private RuntimeProperties properties;
    private ObjectMapper objectMapper;
    private BackendHttpClient client;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new RuntimeProperties();
        properties.setAgentId("agent-7");
        properties.getBackend().setBaseUrl("http://backend.test/");
        properties.getBackend().setApiKey("secret");
        objectMapper = RuntimeConfiguration.objectMapper();
        client = new BackendHttpClient(properties, engine.client(), objectMapper);
    }

    private JsonNode body(OkHttpMockEngine.CapturedRequest request) throws IOException {
        return objectMapper.readTree(request.body());
    }

    // ==================== Tool results ====================

    @Test
    void shouldPostTextResult() throws Exception {
        engine.enqueueJson(200, "{}");
        BackendToolResultAdapter adapter = new BackendToolResultAdapter(client);

        adapter.postResult("tc-1", ToolResult.success("sunny").withDollars(0.5)).get();

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/v1/tool-calls/tc-1/result", request.path());
        assertEquals("agent-7", request.header("X-Agent-Id"));
        assertEquals("Bearer secret", request.header("Authorization"));
        JsonNode json = body(request);
        assertEquals("sunny", json.get("content").asText());
        assertEquals(0.5, json.get("dollars").asDouble(), 1e-9);
        assertTrue(json.get("success").asBoolean());
        assertFalse(json.has("parts"));
        assertFalse(json.has("failure_kind"));
    }

    @Test
    void shouldPostPartsAndFailureKind() throws Exception {
        engine.enqueueJson(200, "{}");
        engine.enqueueJson(200, "{}");
        BackendToolResultAdapter adapter = new BackendToolResultAdapter(client);

        adapter.postResult("tc-2", ToolResult.multipart(List.of(new ToolResultPart("image/png", "AAAA")))).get();
        adapter.postResult("tc-3", ToolResult.failure(ToolFailureKind.CANCELLED, "Tool call was cancelled")).get();

        JsonNode multipart = body(engine.takeRequest());
        assertFalse(multipart.has("content"));
        assertEquals("image/png", multipart.get("parts").get(0).get("m_type").asText());
        assertEquals("AAAA", multipart.get("parts").get(0).get("m_content").asText());

        JsonNode failure = body(engine.takeRequest());
        assertFalse(failure.get("success").asBoolean());
        assertEquals("CANCELLED", failure.get("failure_kind").asText());
    }

    @Test
    void shouldFailOnErrorStatus() {
        engine.enqueueJson(409, "{\"error\":\"already answered\"}");
        BackendToolResultAdapter adapter = new BackendToolResultAdapter(client);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.postResult("tc-1", ToolResult.success("x")).get());

        BackendCallException cause = assertInstanceOf(BackendCallException.class, error.getCause());
        assertEquals(409, cause.getStatusCode());
        assertTrue(cause.getMessage().contains("already answered"));
    }

    @Test
    void shouldFailOnTransportError() {
        engine.enqueueFailure(new IOException("connection refused"));
        BackendToolResultAdapter adapter = new BackendToolResultAdapter(client);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.postResult("tc-1", ToolResult.success("x")).get());

        BackendCallException cause = assertInstanceOf(BackendCallException.class, error.getCause());
        assertEquals(-1, cause.getStatusCode());
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() throws Exception {
        properties.getBackend().setApiKey(null);
        engine.enqueueJson(200, "{}");

        new BackendConfirmationAdapter(client).requestConfirmation("tc-1", "tool:shell", "shell ls", "Run").get();

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertNull(request.header("Authorization"));
        assertEquals("/v1/tool-calls/tc-1/confirmation", request.path());
        JsonNode json = body(request);
        assertEquals("tool:shell", json.get("setup_key").asText());
        assertEquals("shell ls", json.get("command").asText());
    }

    // ==================== Conversations ====================

    @Test
    void shouldCreateChildConversation() throws Exception {
        engine.enqueueJson(201, "{}");
        BackendConversationAdapter adapter = new BackendConversationAdapter(client, properties);
        ChildConversation child = ChildConversation.builder()
                .childId("sc-1")
                .groupId("sg-1")
                .index(0)
                .openingContent("Summarize chapter 1")
                .controlProfile("subtask")
                .build();

        adapter.createChild("conv-1", child).get();

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/v1/conversations", request.path());
        JsonNode json = body(request);
        assertEquals("sc-1", json.get("conversation_id").asText());
        assertEquals("conv-1", json.get("parent_conversation_id").asText());
        assertEquals("sg-1", json.get("group_id").asText());
        assertEquals("Summarize chapter 1", json.get("opening_content").asText());
        assertEquals("subtask", json.get("control_profile").asText());
        assertFalse(json.has("title"));
    }

    @Test
    void shouldRequestGenerationTerminationAndActivation() throws Exception {
        engine.enqueueJson(200, "{}");
        engine.enqueueJson(200, "{}");
        engine.enqueueJson(200, "{}");
        BackendConversationAdapter adapter = new BackendConversationAdapter(client, properties);

        adapter.generate("conv-1", "be brief").get();
        adapter.terminate("sc-1", "subchat deadline passed").get();
        adapter.activate("daily", Map.of("hour", 9)).get();

        OkHttpMockEngine.CapturedRequest generate = engine.takeRequest();
        assertEquals("/v1/conversations/conv-1/generate", generate.path());
        assertEquals("be brief", body(generate).get("injected_instruction").asText());

        OkHttpMockEngine.CapturedRequest terminate = engine.takeRequest();
        assertEquals("/v1/conversations/sc-1/terminate", terminate.path());
        assertEquals("subchat deadline passed", body(terminate).get("reason").asText());

        OkHttpMockEngine.CapturedRequest activate = engine.takeRequest();
        assertEquals("/v1/activations", activate.path());
        assertEquals("daily", body(activate).get("sched_id").asText());
        assertEquals(9, body(activate).get("details").get("hour").asInt());
        assertEquals(3, engine.getRequestCount());
    }
}
