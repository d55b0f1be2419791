package io.github.samzhu.prism.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI Chat Completions 串流 frame
 *
 * @see ChatCompletion
 */
public record ChatCompletionChunk(
    String id,
    String object,
    long created,
    String model,
    @JsonProperty("system_fingerprint")
    String systemFingerprint,
    List<Choice> choices
) {
    public static final String OBJECT = "chat.completion.chunk";

    public record Choice(
        int index,
        Delta delta,
        Object logprobs,
        @JsonProperty("finish_reason")
        String finishReason
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(
        String role,
        String content,
        @JsonProperty("tool_calls")
        List<ChatCompletion.ToolCall> toolCalls
    ) {
        public static Delta role(String role) {
            return new Delta(role, null, null);
        }

        public static Delta content(String content) {
            return new Delta(null, content, null);
        }

        public static Delta toolCall(ChatCompletion.ToolCall toolCall) {
            return new Delta(null, null, List.of(toolCall));
        }

        public static Delta empty() {
            return new Delta(null, null, null);
        }
    }
}
