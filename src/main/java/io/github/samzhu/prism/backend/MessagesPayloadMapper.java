package io.github.samzhu.prism.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.prism.format.ContentBlocks;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.GenerationParams;
import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.model.ToolDefinition;
import io.github.samzhu.prism.model.Turn;

/**
 * 標準化請求 / 回應與後端 Messages 格式之間的對應
 */
public class MessagesPayloadMapper {

    private final ObjectMapper objectMapper;

    public MessagesPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 產生後端請求 JSON
     */
    public ObjectNode write(CanonicalRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.model());

        GenerationParams params = request.params();
        body.put("max_tokens", params.maxTokens());
        if (request.system() != null) {
            body.put("system", request.system());
        }

        ArrayNode messages = body.putArray("messages");
        for (Turn turn : request.turns()) {
            messages.add(objectMapper.valueToTree(turn));
        }

        if (params.temperature() != null) {
            body.put("temperature", params.temperature());
        }
        if (params.topP() != null) {
            body.put("top_p", params.topP());
        }
        if (params.topK() != null) {
            body.put("top_k", params.topK());
        }
        if (!params.stopSequences().isEmpty()) {
            ArrayNode stop = body.putArray("stop_sequences");
            params.stopSequences().forEach(stop::add);
        }

        if (!request.tools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.name());
                if (tool.description() != null) {
                    node.put("description", tool.description());
                }
                if (tool.inputSchema() != null) {
                    node.set("input_schema", tool.inputSchema());
                } else {
                    node.putObject("input_schema").put("type", "object");
                }
            }
        }
        if (request.toolChoice() != null) {
            ObjectNode choice = body.putObject("tool_choice");
            choice.put("type", request.toolChoice().type());
            if (request.toolChoice().name() != null) {
                choice.put("name", request.toolChoice().name());
            }
        }

        body.put("stream", stream);
        return body;
    }

    /**
     * 解析後端非串流回應
     */
    public CanonicalResponse read(JsonNode body) {
        JsonNode usage = body.path("usage");
        return new CanonicalResponse(
            textOrNull(body, "id"),
            textOrNull(body, "model"),
            ContentBlocks.readContent(body.get("content")),
            textOrNull(body, "stop_reason"),
            new TokenUsage(
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0),
                usage.path("cache_read_input_tokens").asInt(0),
                usage.path("cache_creation_input_tokens").asInt(0)));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
