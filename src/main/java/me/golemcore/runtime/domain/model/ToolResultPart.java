package me.golemcore.runtime.domain.model;

/**
 * One typed part of a structured multi-part tool result, for example
 * {@code ("text", "...")} or {@code ("image/png", "<base64>")}.
 */
public record ToolResultPart(String partType, String partContent) {

    public static ToolResultPart text(String content) {
        return new ToolResultPart("text", content);
    }
}
