package io.github.samzhu.prism.format;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.github.samzhu.prism.model.ContentPart;
import io.github.samzhu.prism.model.ImagePart;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.ThinkingPart;
import io.github.samzhu.prism.model.ToolResultPart;
import io.github.samzhu.prism.model.ToolUsePart;

/**
 * Messages 格式 content block 的讀取工具
 *
 * <p>Anthropic 客戶端請求與後端回應共用同一套 block 格式。無法辨識的 block
 * （如 {@code redacted_thinking}）會被略過。
 */
public final class ContentBlocks {

    private ContentBlocks() {
    }

    /**
     * 讀取 content：字串視為單一 text block，陣列逐一讀取
     */
    public static List<ContentPart> readContent(JsonNode content) {
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
        if (content.isArray()) {
            for (JsonNode block : content) {
                ContentPart part = readBlock(block);
                if (part != null) {
                    parts.add(part);
                }
            }
        }
        return parts;
    }

    /**
     * 讀取單一 block
     *
     * @return 對應的內容區塊，無法辨識時返回 null
     */
    public static ContentPart readBlock(JsonNode block) {
        if (block == null || !block.isObject()) {
            return null;
        }
        String type = block.path("type").asText("");
        switch (type) {
            case "text":
                return new TextPart(block.path("text").asText(""));
            case "image":
                return readImage(block.path("source"));
            case "tool_use":
                JsonNode input = block.get("input");
                return new ToolUsePart(
                    textOrNull(block, "id"),
                    textOrNull(block, "name"),
                    input != null && !input.isNull() ? input : JsonNodeFactory.instance.objectNode());
            case "tool_result":
                JsonNode isError = block.get("is_error");
                return new ToolResultPart(
                    textOrNull(block, "tool_use_id"),
                    flattenText(block.get("content"), "\n"),
                    isError != null && isError.isBoolean() ? isError.asBoolean() : null);
            case "thinking":
                return new ThinkingPart(block.path("thinking").asText(""), textOrNull(block, "signature"));
            default:
                return null;
        }
    }

    /**
     * 將字串或 text block 陣列攤平成文字
     */
    public static String flattenText(JsonNode content, String separator) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> texts = new ArrayList<>();
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText()) && part.has("text")) {
                    texts.add(part.get("text").asText());
                }
            }
            return String.join(separator, texts);
        }
        return "";
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static ContentPart readImage(JsonNode source) {
        String sourceType = source.path("type").asText("");
        if ("base64".equals(sourceType)) {
            return new ImagePart(ImagePart.Source.base64(
                textOrNull(source, "media_type"), textOrNull(source, "data")));
        }
        if ("url".equals(sourceType)) {
            return new ImagePart(ImagePart.Source.url(textOrNull(source, "url")));
        }
        return null;
    }
}
