package io.github.samzhu.prism.format;

import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.MessagesResponse;
import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.util.IdGenerator;

/**
 * 標準化回應 → Anthropic Messages 回應
 *
 * <p>content block（含 thinking）原樣輸出，stop_reason 直接傳遞。
 */
public class AnthropicResponseConverter implements ResponseConverter {

    @Override
    public ClientDialect dialect() {
        return ClientDialect.ANTHROPIC;
    }

    @Override
    public MessagesResponse convert(CanonicalResponse response, String requestedModel) {
        TokenUsage usage = response.usage();
        return new MessagesResponse(
            response.id() != null ? response.id() : IdGenerator.withPrefix("msg_", 24),
            "message",
            "assistant",
            requestedModel != null ? requestedModel : response.model(),
            response.content(),
            response.stopReason(),
            null,
            new MessagesResponse.Usage(
                usage.inputTokens(),
                usage.outputTokens(),
                usage.cacheReadTokens(),
                usage.cacheCreationTokens()));
    }
}
