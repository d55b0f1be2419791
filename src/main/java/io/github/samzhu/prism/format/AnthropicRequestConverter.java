package io.github.samzhu.prism.format;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.prism.exception.InvalidRequestException;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.GenerationParams;
import io.github.samzhu.prism.model.Role;
import io.github.samzhu.prism.model.ToolChoice;
import io.github.samzhu.prism.model.ToolDefinition;
import io.github.samzhu.prism.model.Turn;

/**
 * Anthropic Messages 請求轉換器
 *
 * <p>Messages 格式與標準化請求幾乎一一對應：
 * <ul>
 *   <li>{@code system} 可為字串或 text block 陣列，陣列以空行串接</li>
 *   <li>{@code messages[].content} 可為字串或 block 陣列</li>
 *   <li>同角色相鄰訊息依 {@link TurnNormalizer} 合併</li>
 * </ul>
 */
public class AnthropicRequestConverter implements RequestConverter {

    private final ModelMapper modelMapper;

    public AnthropicRequestConverter(ModelMapper modelMapper) {
        this.modelMapper = modelMapper;
    }

    @Override
    public ClientDialect dialect() {
        return ClientDialect.ANTHROPIC;
    }

    @Override
    public CanonicalRequest convert(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        JsonNode messages = body.get("messages");
        if (messages == null || !messages.isArray()) {
            throw new InvalidRequestException("messages: Field required");
        }

        List<Turn> turns = new ArrayList<>();
        for (JsonNode message : messages) {
            String role = message.path("role").asText("");
            Role turnRole = switch (role) {
                case "user" -> Role.USER;
                case "assistant" -> Role.ASSISTANT;
                default -> throw new InvalidRequestException("messages: Unexpected role \"" + role + "\"");
            };
            turns.add(new Turn(turnRole, ContentBlocks.readContent(message.get("content"))));
        }

        List<Turn> normalized = TurnNormalizer.normalize(turns);
        if (normalized.isEmpty()) {
            throw new InvalidRequestException("messages: at least one message is required");
        }

        String requestedModel = ContentBlocks.textOrNull(body, "model");
        String system = ContentBlocks.flattenText(body.get("system"), "\n\n");

        return new CanonicalRequest(
            modelMapper.resolve(requestedModel),
            requestedModel,
            system.isEmpty() ? null : system,
            normalized,
            readParams(body),
            readTools(body.get("tools")),
            readToolChoice(body.get("tool_choice")),
            body.path("stream").asBoolean(false)
        );
    }

    private GenerationParams readParams(JsonNode body) {
        List<String> stopSequences = new ArrayList<>();
        JsonNode stop = body.get("stop_sequences");
        if (stop != null && stop.isArray()) {
            stop.forEach(s -> stopSequences.add(s.asText()));
        }
        JsonNode topK = body.get("top_k");
        return new GenerationParams(
            body.path("max_tokens").asInt(0),
            body.has("temperature") && body.get("temperature").isNumber() ? body.get("temperature").asDouble() : null,
            body.has("top_p") && body.get("top_p").isNumber() ? body.get("top_p").asDouble() : null,
            topK != null && topK.isNumber() ? topK.asInt() : null,
            stopSequences);
    }

    private List<ToolDefinition> readTools(JsonNode tools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        if (tools == null || !tools.isArray()) {
            return definitions;
        }
        for (JsonNode tool : tools) {
            String name = ContentBlocks.textOrNull(tool, "name");
            if (name == null) {
                throw new InvalidRequestException("tools: Tool definition is missing 'name'");
            }
            definitions.add(new ToolDefinition(name, ContentBlocks.textOrNull(tool, "description"), tool.get("input_schema")));
        }
        return definitions;
    }

    private ToolChoice readToolChoice(JsonNode choice) {
        if (choice == null || !choice.isObject()) {
            return null;
        }
        String type = choice.path("type").asText("auto");
        return switch (type) {
            case "none" -> ToolChoice.NONE;
            case "any" -> ToolChoice.ANY;
            case "tool" -> ToolChoice.tool(ContentBlocks.textOrNull(choice, "name"));
            default -> ToolChoice.AUTO;
        };
    }
}
