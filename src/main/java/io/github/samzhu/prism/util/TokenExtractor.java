package io.github.samzhu.prism.util;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.github.samzhu.prism.model.StreamEvent;
import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.model.UsageEventData;

/**
 * 從後端串流事件累計 Token 用量
 *
 * <p>提取邏輯：
 * <ul>
 *   <li>{@code message_start} - input_tokens、cache tokens、model、message_id</li>
 *   <li>{@code message_delta} - 最終 output_tokens、stop_reason</li>
 *   <li>{@code error} - 錯誤類型</li>
 * </ul>
 *
 * <p>每個串流請求使用一個實例；串流可能在其他執行緒讀取，因此欄位使用 atomic 型別。
 *
 * @see StreamEvent
 * @see UsageEventData
 */
public class TokenExtractor {

    private final AtomicInteger inputTokens = new AtomicInteger(0);
    private final AtomicInteger outputTokens = new AtomicInteger(0);
    private final AtomicInteger cacheCreationTokens = new AtomicInteger(0);
    private final AtomicInteger cacheReadTokens = new AtomicInteger(0);
    private final AtomicReference<String> model = new AtomicReference<>();
    private final AtomicReference<String> messageId = new AtomicReference<>();
    private final AtomicReference<String> stopReason = new AtomicReference<>();
    private final AtomicReference<String> errorType = new AtomicReference<>();

    /**
     * 處理串流事件
     *
     * @param event 串流事件（可為 null）
     */
    public void processEvent(StreamEvent event) {
        if (event == null) {
            return;
        }

        if (event.isMessageStart()) {
            inputTokens.set(event.getInputTokens());
            cacheCreationTokens.set(event.getCacheCreationTokens());
            cacheReadTokens.set(event.getCacheReadTokens());
            if (event.getModel() != null) {
                model.set(event.getModel());
            }
            if (event.getMessageId() != null) {
                messageId.set(event.getMessageId());
            }
        } else if (event.isMessageDelta()) {
            int tokens = event.getOutputTokens();
            if (tokens > 0) {
                outputTokens.set(tokens);
            }
            if (event.getStopReason() != null) {
                stopReason.set(event.getStopReason());
            }
        } else if (event.isError()) {
            errorType.set(event.error() != null && event.error().type() != null
                ? event.error().type() : "api_error");
        }
    }

    public TokenUsage toUsage() {
        return new TokenUsage(inputTokens.get(), outputTokens.get(), cacheReadTokens.get(), cacheCreationTokens.get());
    }

    /**
     * 將累計結果填入用量事件；後端未回報模型時保留原值
     */
    public UsageEventData.Builder applyTo(UsageEventData.Builder builder) {
        if (model.get() != null) {
            builder.model(model.get());
        }
        return builder
            .inputTokens(inputTokens.get())
            .outputTokens(outputTokens.get())
            .cacheCreationTokens(cacheCreationTokens.get())
            .cacheReadTokens(cacheReadTokens.get())
            .messageId(messageId.get())
            .stopReason(stopReason.get());
    }

    public int getInputTokens() {
        return inputTokens.get();
    }

    public int getOutputTokens() {
        return outputTokens.get();
    }

    public String getModel() {
        return model.get();
    }

    public String getMessageId() {
        return messageId.get();
    }

    public String getStopReason() {
        return stopReason.get();
    }

    /**
     * 串流中出現的錯誤類型；未出現錯誤時為 null
     */
    public String getErrorType() {
        return errorType.get();
    }
}
