package io.github.samzhu.prism.model;

/**
 * 後端回報的 Token 用量
 */
public record TokenUsage(
    int inputTokens,
    int outputTokens,
    int cacheReadTokens,
    int cacheCreationTokens
) {
    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0, 0);
}
