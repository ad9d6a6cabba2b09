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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ToolResultPart;
import me.golemcore.runtime.port.outbound.ToolResultPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Posts tool results to {@code POST /v1/tool-calls/{invocationId}/result}.
 */
@Component
@RequiredArgsConstructor
public class BackendToolResultAdapter implements ToolResultPort {

    private final BackendHttpClient client;

    @Override
    public CompletableFuture<Void> postResult(String invocationId, ToolResult result) {
        return client.post("/v1/tool-calls/" + invocationId + "/result", toRequest(result));
    }

    static ResultRequest toRequest(ToolResult result) {
        List<PartRequest> parts = result.isMultipart()
                ? result.getParts().stream().map(PartRequest::of).toList()
                : null;
        return new ResultRequest(
                result.isMultipart() ? null : result.getContent(),
                parts,
                result.getDollars(),
                result.isSuccess(),
                result.getFailureKind() != null ? result.getFailureKind().name() : null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ResultRequest(String content, List<PartRequest> parts, double dollars, boolean success,
            @JsonProperty("failure_kind") String failureKind) {
    }

    record PartRequest(@JsonProperty("m_type") String type, @JsonProperty("m_content") String content) {

        static PartRequest of(ToolResultPart part) {
            return new PartRequest(part.partType(), part.partContent());
        }
    }
}
