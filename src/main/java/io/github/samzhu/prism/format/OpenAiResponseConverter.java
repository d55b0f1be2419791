package io.github.samzhu.prism.format;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.ChatCompletion;
import io.github.samzhu.prism.model.ContentPart;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.model.ToolUsePart;
import io.github.samzhu.prism.util.IdGenerator;

/**
 * 標準化回應 → OpenAI Chat Completion
 *
 * <ul>
 *   <li>text block 串接為 {@code message.content}，沒有文字時為 null</li>
 *   <li>tool_use block → {@code tool_calls}，參數以 JSON 字串表示；缺少 id 時產生 {@code call_} 開頭的 ID</li>
 *   <li>thinking block 不輸出</li>
 *   <li>{@code prompt_tokens = input + cache_read}、{@code completion_tokens = output}</li>
 * </ul>
 *
 * @see StopReasons
 */
public class OpenAiResponseConverter implements ResponseConverter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiResponseConverter.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OpenAiResponseConverter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ClientDialect dialect() {
        return ClientDialect.OPENAI;
    }

    @Override
    public ChatCompletion convert(CanonicalResponse response, String requestedModel) {
        StringBuilder text = new StringBuilder();
        List<ChatCompletion.ToolCall> toolCalls = new ArrayList<>();
        for (ContentPart part : response.content()) {
            if (part instanceof TextPart textPart) {
                text.append(textPart.text());
            } else if (part instanceof ToolUsePart toolUse) {
                toolCalls.add(new ChatCompletion.ToolCall(
                    null,
                    toolUse.id() != null ? toolUse.id() : IdGenerator.withPrefix("call_", 24),
                    "function",
                    new ChatCompletion.FunctionCall(toolUse.name(), writeArguments(toolUse.input()))));
            }
        }

        ChatCompletion.Message message = new ChatCompletion.Message(
            "assistant",
            text.length() > 0 ? text.toString() : null,
            toolCalls.isEmpty() ? null : toolCalls);

        TokenUsage usage = response.usage();
        int promptTokens = usage.inputTokens() + usage.cacheReadTokens();
        int completionTokens = usage.outputTokens();

        return new ChatCompletion(
            IdGenerator.withPrefix("chatcmpl-", 28),
            ChatCompletion.OBJECT,
            clock.instant().getEpochSecond(),
            requestedModel != null ? requestedModel : response.model(),
            List.of(new ChatCompletion.Choice(0, message, null, StopReasons.toFinishReason(response.stopReason()))),
            new ChatCompletion.CompletionUsage(promptTokens, completionTokens, promptTokens + completionTokens),
            null);
    }

    private String writeArguments(JsonNode input) {
        if (input == null || input.isNull()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }
}
