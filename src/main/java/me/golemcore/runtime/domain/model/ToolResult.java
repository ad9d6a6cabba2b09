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
import lombok.Data;

import java.util.List;

/**
 * Result posted back for a tool invocation. Carries either text content or an
 * ordered list of typed parts, never both, plus the spend the tool incurred.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String content;
    private List<ToolResultPart> parts;
    private double dollars;
    private ToolFailureKind failureKind;

    /**
     * Creates a successful text result.
     */
    public static ToolResult success(String content) {
        return ToolResult.builder()
                .success(true)
                .content(content)
                .build();
    }

    /**
     * Creates a successful structured result.
     */
    public static ToolResult multipart(List<ToolResultPart> parts) {
        return ToolResult.builder()
                .success(true)
                .parts(parts != null ? List.copyOf(parts) : List.of())
                .build();
    }

    /**
     * Creates a failed result. The message is what the model sees.
     */
    public static ToolResult failure(ToolFailureKind kind, String message) {
        return ToolResult.builder()
                .success(false)
                .content(message)
                .failureKind(kind)
                .build();
    }

    public ToolResult withDollars(double amount) {
        return toBuilder().dollars(amount).build();
    }

    public boolean isMultipart() {
        return parts != null;
    }

    /**
     * Checks the text-or-parts contract.
     *
     * @throws IllegalArgumentException
     *             if both content and parts are set, or a part is incomplete
     */
    public void validate() {
        if (dollars < 0) {
            throw new IllegalArgumentException("ToolResult dollars must not be negative: " + dollars);
        }
        if (parts == null) {
            return;
        }
        if (content != null && !content.isEmpty()) {
            throw new IllegalArgumentException("ToolResult: use either content or parts, not both");
        }
        for (ToolResultPart part : parts) {
            if (part == null || part.partType() == null || part.partContent() == null) {
                throw new IllegalArgumentException("ToolResult parts must have partType and partContent: " + part);
            }
        }
    }
}
