package io.github.samzhu.prism.format;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.prism.exception.InvalidRequestException;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.ContentPart;
import io.github.samzhu.prism.model.GenerationParams;
import io.github.samzhu.prism.model.ImagePart;
import io.github.samzhu.prism.model.Role;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.ToolChoice;
import io.github.samzhu.prism.model.ToolDefinition;
import io.github.samzhu.prism.model.ToolResultPart;
import io.github.samzhu.prism.model.ToolUsePart;
import io.github.samzhu.prism.model.Turn;

/**
 * OpenAI Chat Completions 請求轉換器
 *
 * <p>轉換規則：
 * <ul>
 *   <li>{@code system} 訊息依序以空行（{@code \n\n}）串接為 system 指示</li>
 *   <li>{@code tool} 角色 → user 回合中的 tool_result（對應 {@code tool_call_id}）；
 *       舊版 {@code function} 角色以 {@code name} 對應</li>
 *   <li>assistant 的 {@code tool_calls} / {@code function_call} → tool_use，
 *       參數不是 JSON 物件時保留為 {@code {"raw": "..."}}</li>
 *   <li>未知角色的訊息略過；非字串也非陣列的 content 保留其 JSON 文字</li>
 *   <li>{@code image_url}：{@code data:} URL 轉為 base64 圖片，http(s) URL 保留為 URL 來源</li>
 *   <li>{@code max_tokens} → {@code max_completion_tokens} → 4096</li>
 *   <li>{@code stop} 字串或陣列 → stop sequences</li>
 *   <li>{@code presence_penalty}、{@code frequency_penalty}、{@code n}、{@code user}、
 *       {@code logit_bias} 接受但忽略</li>
 * </ul>
 *
 * @see TurnNormalizer
 * @see ModelMapper
 */
public class OpenAiRequestConverter implements RequestConverter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRequestConverter.class);

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;]+);base64,(.+)$", Pattern.DOTALL);

    private final ModelMapper modelMapper;
    private final ObjectMapper objectMapper;

    public OpenAiRequestConverter(ModelMapper modelMapper, ObjectMapper objectMapper) {
        this.modelMapper = modelMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClientDialect dialect() {
        return ClientDialect.OPENAI;
    }

    @Override
    public CanonicalRequest convert(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        JsonNode messages = body.get("messages");
        if (messages == null || !messages.isArray()) {
            throw new InvalidRequestException("'messages' must be an array");
        }

        String requestedModel = ContentBlocks.textOrNull(body, "model");
        String model = modelMapper.resolve(requestedModel);
        log.debug("Model mapping: {} -> {}", requestedModel, model);

        List<String> systemTexts = new ArrayList<>();
        List<Turn> turns = new ArrayList<>();
        for (JsonNode message : messages) {
            String role = message.path("role").asText("");
            switch (role) {
                case "system", "developer" -> systemTexts.add(extractText(message.get("content")));
                case "user" -> turns.add(new Turn(Role.USER, convertUserContent(message.get("content"))));
                case "assistant" -> turns.add(new Turn(Role.ASSISTANT, convertAssistant(message)));
                case "tool" -> turns.add(new Turn(Role.USER, List.of(new ToolResultPart(
                    ContentBlocks.textOrNull(message, "tool_call_id"), extractText(message.get("content"))))));
                case "function" -> {
                    String name = ContentBlocks.textOrNull(message, "name");
                    turns.add(new Turn(Role.USER, List.of(new ToolResultPart(
                        name != null ? name : "function", extractText(message.get("content"))))));
                }
                default -> log.debug("Skipping message with unsupported role: '{}'", role);
            }
        }

        List<Turn> normalized = TurnNormalizer.normalize(turns);
        if (normalized.isEmpty()) {
            throw new InvalidRequestException("'messages' must contain at least one non-system message");
        }

        String system = systemTexts.isEmpty() ? null : String.join("\n\n", systemTexts);

        return new CanonicalRequest(
            model,
            requestedModel,
            system != null && !system.isEmpty() ? system : null,
            normalized,
            readParams(body),
            readTools(body),
            readToolChoice(body.get("tool_choice")),
            body.path("stream").asBoolean(false)
        );
    }

    private List<ContentPart> convertUserContent(JsonNode content) {
        List<ContentPart> parts = new ArrayList<>();
        if (content == null || content.isNull()) {
            return parts;
        }
        if (content.isTextual()) {
            if (!content.asText().isEmpty()) {
                parts.add(new TextPart(content.asText()));
            }
            return parts;
        }
        if (!content.isArray()) {
            parts.add(new TextPart(content.toString()));
            return parts;
        }
        for (JsonNode part : content) {
            String type = part.path("type").asText("");
            if ("text".equals(type)) {
                parts.add(new TextPart(part.path("text").asText("")));
            } else if ("image_url".equals(type)) {
                JsonNode imageUrl = part.get("image_url");
                String url = imageUrl == null ? "" : imageUrl.isTextual()
                    ? imageUrl.asText() : imageUrl.path("url").asText("");
                ImagePart image = convertImage(url);
                if (image != null) {
                    parts.add(image);
                }
            }
        }
        return parts;
    }

    private ImagePart convertImage(String url) {
        if (url.startsWith("data:")) {
            Matcher matcher = DATA_URL.matcher(url);
            if (matcher.matches()) {
                return new ImagePart(ImagePart.Source.base64(matcher.group(1), matcher.group(2)));
            }
            log.debug("Skipping malformed data URL image");
            return null;
        }
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return new ImagePart(ImagePart.Source.url(url));
        }
        return null;
    }

    private List<ContentPart> convertAssistant(JsonNode message) {
        List<ContentPart> parts = new ArrayList<>();
        String text = extractText(message.get("content"));
        if (!text.isEmpty()) {
            parts.add(new TextPart(text));
        }

        JsonNode toolCalls = message.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray()) {
            for (JsonNode toolCall : toolCalls) {
                if (!"function".equals(toolCall.path("type").asText("function"))) {
                    continue;
                }
                JsonNode function = toolCall.path("function");
                parts.add(new ToolUsePart(
                    ContentBlocks.textOrNull(toolCall, "id"),
                    ContentBlocks.textOrNull(function, "name"),
                    parseArguments(function.get("arguments"))));
            }
        }

        JsonNode functionCall = message.get("function_call");
        if (functionCall != null && functionCall.isObject()) {
            String name = ContentBlocks.textOrNull(functionCall, "name");
            parts.add(new ToolUsePart(
                name != null ? name : "function",
                name,
                parseArguments(functionCall.get("arguments"))));
        }
        return parts;
    }

    /**
     * 解析工具參數；非 JSON 物件時保留原字串
     */
    private JsonNode parseArguments(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (arguments.isObject()) {
            return arguments;
        }
        if (!arguments.isTextual()) {
            return rawArguments(arguments.toString());
        }
        String raw = arguments.asText();
        if (raw.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(raw);
            if (parsed != null && parsed.isObject()) {
                return parsed;
            }
        } catch (JsonProcessingException e) {
            log.debug("Tool arguments are not valid JSON, keeping raw payload: {}", e.getOriginalMessage());
        }
        return rawArguments(raw);
    }

    private static ObjectNode rawArguments(String raw) {
        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.put("raw", raw);
        return wrapped;
    }

    private GenerationParams readParams(JsonNode body) {
        int maxTokens = body.path("max_tokens").asInt(0);
        if (maxTokens <= 0) {
            maxTokens = body.path("max_completion_tokens").asInt(0);
        }
        List<String> stop = new ArrayList<>();
        JsonNode stopNode = body.get("stop");
        if (stopNode != null && stopNode.isTextual()) {
            stop.add(stopNode.asText());
        } else if (stopNode != null && stopNode.isArray()) {
            stopNode.forEach(s -> stop.add(s.asText()));
        }
        return new GenerationParams(
            maxTokens,
            doubleOrNull(body, "temperature"),
            doubleOrNull(body, "top_p"),
            null,
            stop);
    }

    private List<ToolDefinition> readTools(JsonNode body) {
        List<ToolDefinition> tools = new ArrayList<>();
        JsonNode toolsNode = body.get("tools");
        if (toolsNode != null && toolsNode.isArray()) {
            for (JsonNode tool : toolsNode) {
                if ("function".equals(tool.path("type").asText("function"))) {
                    tools.add(toToolDefinition(tool.path("function")));
                }
            }
        }
        JsonNode functions = body.get("functions");
        if (functions != null && functions.isArray()) {
            functions.forEach(function -> tools.add(toToolDefinition(function)));
        }
        return tools;
    }

    private ToolDefinition toToolDefinition(JsonNode function) {
        String name = ContentBlocks.textOrNull(function, "name");
        if (name == null) {
            throw new InvalidRequestException("Tool definition is missing 'name'");
        }
        JsonNode parameters = function.get("parameters");
        if (parameters == null || parameters.isNull()) {
            ObjectNode empty = JsonNodeFactory.instance.objectNode();
            empty.put("type", "object");
            parameters = empty;
        }
        return new ToolDefinition(name, ContentBlocks.textOrNull(function, "description"), parameters);
    }

    private ToolChoice readToolChoice(JsonNode choice) {
        if (choice == null || choice.isNull()) {
            return null;
        }
        if (choice.isTextual()) {
            switch (choice.asText()) {
                case "none":
                    return ToolChoice.NONE;
                case "required":
                    return ToolChoice.ANY;
                default:
                    return ToolChoice.AUTO;
            }
        }
        String name = ContentBlocks.textOrNull(choice.path("function"), "name");
        return name != null ? ToolChoice.tool(name) : ToolChoice.AUTO;
    }

    /**
     * 取出文字內容：字串原樣返回，陣列取 text 部分以換行串接
     */
    /**
     * 取出文字內容；非字串也非陣列的內容保留其 JSON 文字
     */
    private static String extractText(JsonNode content) {
        if (content != null && !content.isNull() && !content.isTextual() && !content.isArray()) {
            return content.toString();
        }
        return ContentBlocks.flattenText(content, "\n");
    }

    private static Double doubleOrNull(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
