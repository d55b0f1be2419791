package io.github.samzhu.prism.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Anthropic Messages API 非串流回應
 */
public record MessagesResponse(
    String id,
    String type,
    String role,
    String model,
    List<ContentPart> content,
    @JsonProperty("stop_reason")
    String stopReason,
    @JsonProperty("stop_sequence")
    String stopSequence,
    Usage usage
) {
    public record Usage(
        @JsonProperty("input_tokens")
        int inputTokens,
        @JsonProperty("output_tokens")
        int outputTokens,
        @JsonProperty("cache_read_input_tokens")
        int cacheReadInputTokens,
        @JsonProperty("cache_creation_input_tokens")
        int cacheCreationInputTokens
    ) {}
}
