package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 工具執行結果，以 {@code toolUseId} 對應先前的 {@link ToolUsePart}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResultPart(
    @JsonProperty("tool_use_id")
    String toolUseId,
    String content,
    @JsonProperty("is_error")
    Boolean isError
) implements ContentPart {

    public ToolResultPart(String toolUseId, String content) {
        this(toolUseId, content, null);
    }
}
