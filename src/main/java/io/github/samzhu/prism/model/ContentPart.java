package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 對話內容區塊
 *
 * <p>序列化格式與 Messages API 的 content block 相同，以 {@code type} 欄位區分：
 * <ul>
 *   <li>{@code text} - {@link TextPart}</li>
 *   <li>{@code image} - {@link ImagePart}</li>
 *   <li>{@code tool_use} - {@link ToolUsePart}</li>
 *   <li>{@code tool_result} - {@link ToolResultPart}</li>
 *   <li>{@code thinking} - {@link ThinkingPart}</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextPart.class, name = "text"),
    @JsonSubTypes.Type(value = ImagePart.class, name = "image"),
    @JsonSubTypes.Type(value = ToolUsePart.class, name = "tool_use"),
    @JsonSubTypes.Type(value = ToolResultPart.class, name = "tool_result"),
    @JsonSubTypes.Type(value = ThinkingPart.class, name = "thinking")
})
public interface ContentPart {
}
