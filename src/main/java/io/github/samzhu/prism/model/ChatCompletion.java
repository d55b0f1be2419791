package io.github.samzhu.prism.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI Chat Completions 非串流回應
 *
 * <p>{@code system_fingerprint}、{@code logprobs} 固定為 null；{@code message.content}
 * 在沒有文字時為 null。
 */
public record ChatCompletion(
    String id,
    String object,
    long created,
    String model,
    List<Choice> choices,
    CompletionUsage usage,
    @JsonProperty("system_fingerprint")
    String systemFingerprint
) {
    public static final String OBJECT = "chat.completion";

    public record Choice(
        int index,
        Message message,
        Object logprobs,
        @JsonProperty("finish_reason")
        String finishReason
    ) {}

    public record Message(
        String role,
        String content,
        @JsonProperty("tool_calls")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<ToolCall> toolCalls
    ) {}

    /**
     * 工具呼叫；串流時 {@code index} 有值，其餘欄位只在第一個 frame 出現
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolCall(
        Integer index,
        String id,
        String type,
        FunctionCall function
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FunctionCall(
        String name,
        String arguments
    ) {}

    public record CompletionUsage(
        @JsonProperty("prompt_tokens")
        int promptTokens,
        @JsonProperty("completion_tokens")
        int completionTokens,
        @JsonProperty("total_tokens")
        int totalTokens
    ) {}
}
