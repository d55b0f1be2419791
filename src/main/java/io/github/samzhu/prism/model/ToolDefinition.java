package io.github.samzhu.prism.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 工具定義
 *
 * @param name 工具名稱
 * @param description 工具描述
 * @param inputSchema 參數 JSON Schema
 */
public record ToolDefinition(
    String name,
    String description,
    JsonNode inputSchema
) {
}
