package io.github.samzhu.prism.format;

/**
 * 客戶端使用的 API 協定
 */
public enum ClientDialect {
    /** OpenAI Chat Completions（{@code POST /v1/chat/completions}） */
    OPENAI,
    /** Anthropic Messages（{@code POST /v1/messages}） */
    ANTHROPIC
}
