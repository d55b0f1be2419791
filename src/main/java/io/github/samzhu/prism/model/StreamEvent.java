package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 後端 SSE 串流事件資料結構
 *
 * <p>後端串流採用 Messages API 的事件格式：
 * <ul>
 *   <li>{@code message_start} - 訊息開始，包含 input_tokens、model、message id</li>
 *   <li>{@code content_block_start} - 內容區塊開始（text / tool_use / thinking）</li>
 *   <li>{@code content_block_delta} - 區塊增量：{@code text_delta}、{@code input_json_delta}、
 *       {@code thinking_delta}</li>
 *   <li>{@code content_block_stop} - 內容區塊結束</li>
 *   <li>{@code message_delta} - 訊息增量，包含 output_tokens、stop_reason</li>
 *   <li>{@code message_stop} - 訊息結束</li>
 *   <li>{@code ping} - 心跳</li>
 *   <li>{@code error} - 錯誤事件</li>
 * </ul>
 *
 * @see io.github.samzhu.prism.util.SseParser
 * @see io.github.samzhu.prism.util.TokenExtractor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamEvent(
    String type,
    Message message,
    Delta delta,
    Usage usage,
    Integer index,
    @JsonProperty("content_block")
    ContentBlock contentBlock,
    ErrorBody error
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(
        String id,
        String type,
        String role,
        String model,
        @JsonProperty("stop_reason")
        String stopReason,
        Usage usage
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Delta(
        String type,
        String text,
        @JsonProperty("partial_json")
        String partialJson,
        String thinking,
        @JsonProperty("stop_reason")
        String stopReason
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
        @JsonProperty("input_tokens")
        Integer inputTokens,
        @JsonProperty("output_tokens")
        Integer outputTokens,
        @JsonProperty("cache_creation_input_tokens")
        Integer cacheCreationInputTokens,
        @JsonProperty("cache_read_input_tokens")
        Integer cacheReadInputTokens
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentBlock(
        String type,
        String text,
        String id,
        String name,
        JsonNode input
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorBody(
        String type,
        String message
    ) {}

    public boolean isMessageStart() {
        return "message_start".equals(type);
    }

    public boolean isMessageDelta() {
        return "message_delta".equals(type);
    }

    public boolean isMessageStop() {
        return "message_stop".equals(type);
    }

    public boolean isError() {
        return "error".equals(type);
    }

    /**
     * 是否為 tool_use 區塊的開始
     */
    public boolean isToolUseStart() {
        return "content_block_start".equals(type)
            && contentBlock != null
            && "tool_use".equals(contentBlock.type());
    }

    /**
     * 從 message_start 事件取得 input_tokens
     */
    public int getInputTokens() {
        if (isMessageStart() && message != null && message.usage() != null) {
            return message.usage().inputTokens() != null ? message.usage().inputTokens() : 0;
        }
        return 0;
    }

    /**
     * 從 message_delta 事件取得 output_tokens
     */
    public int getOutputTokens() {
        if (isMessageDelta() && usage != null) {
            return usage.outputTokens() != null ? usage.outputTokens() : 0;
        }
        return 0;
    }

    public int getCacheCreationTokens() {
        if (isMessageStart() && message != null && message.usage() != null) {
            return message.usage().cacheCreationInputTokens() != null
                ? message.usage().cacheCreationInputTokens() : 0;
        }
        return 0;
    }

    public int getCacheReadTokens() {
        if (isMessageStart() && message != null && message.usage() != null) {
            return message.usage().cacheReadInputTokens() != null
                ? message.usage().cacheReadInputTokens() : 0;
        }
        return 0;
    }

    public String getModel() {
        if (isMessageStart() && message != null) {
            return message.model();
        }
        return null;
    }

    public String getMessageId() {
        if (isMessageStart() && message != null) {
            return message.id();
        }
        return null;
    }

    /**
     * 從 message_delta 事件取得 stop_reason
     */
    public String getStopReason() {
        if (isMessageDelta() && delta != null) {
            return delta.stopReason();
        }
        return null;
    }
}
