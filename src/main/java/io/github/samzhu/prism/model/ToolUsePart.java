package io.github.samzhu.prism.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 助理發出的工具呼叫
 *
 * @param id 工具呼叫 ID，工具結果以此 ID 對應
 * @param name 工具名稱
 * @param input 工具參數（JSON 物件）
 */
public record ToolUsePart(
    String id,
    String name,
    JsonNode input
) implements ContentPart {
}
