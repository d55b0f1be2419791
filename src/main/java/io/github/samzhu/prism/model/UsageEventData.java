package io.github.samzhu.prism.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 請求紀錄事件（CloudEvents data payload）
 *
 * <p>每次 chat 請求結束後發送一筆，內容為後端回報的原始數據，不做任何計費換算。
 *
 * <p>欄位說明：
 * <ul>
 *   <li><b>呼叫者</b>：{@code apiKeyId}、{@code clientIp}、{@code userAgent}</li>
 *   <li><b>路由</b>：{@code requestedModel}（客戶端指定）、{@code model}（後端實際使用）、
 *       {@code accountEmail}（選中的後端帳號）</li>
 *   <li><b>用量</b>：input / output / cache tokens、{@code latencyMs}、{@code stopReason}</li>
 *   <li><b>狀態</b>：{@code status}（success / error / rate_limited / client_disconnected）、
 *       {@code errorType}、{@code httpStatus}</li>
 *   <li><b>運維</b>：{@code traceId}（OpenTelemetry Trace ID）</li>
 * </ul>
 *
 * @see io.github.samzhu.prism.service.UsageEventPublisher
 */
public record UsageEventData(
    @JsonProperty("api_key_id")
    String apiKeyId,

    @JsonProperty("requested_model")
    String requestedModel,

    String model,

    @JsonProperty("account_email")
    String accountEmail,

    @JsonProperty("input_tokens")
    int inputTokens,

    @JsonProperty("output_tokens")
    int outputTokens,

    @JsonProperty("cache_creation_tokens")
    int cacheCreationTokens,

    @JsonProperty("cache_read_tokens")
    int cacheReadTokens,

    @JsonProperty("message_id")
    String messageId,

    @JsonProperty("latency_ms")
    long latencyMs,

    boolean stream,

    @JsonProperty("stop_reason")
    String stopReason,

    String status,

    @JsonProperty("error_type")
    String errorType,

    @JsonProperty("http_status")
    int httpStatus,

    @JsonProperty("client_ip")
    String clientIp,

    @JsonProperty("user_agent")
    String userAgent,

    @JsonProperty("trace_id")
    String traceId,

    @JsonProperty("event_time")
    Instant eventTime
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKeyId;
        private String requestedModel;
        private String model;
        private String accountEmail;
        private int inputTokens;
        private int outputTokens;
        private int cacheCreationTokens;
        private int cacheReadTokens;
        private String messageId;
        private long latencyMs;
        private boolean stream;
        private String stopReason;
        private String status = "success";
        private String errorType;
        private int httpStatus = 200;
        private String clientIp;
        private String userAgent;
        private String traceId;
        private Instant eventTime;

        public Builder apiKeyId(String apiKeyId) {
            this.apiKeyId = apiKeyId;
            return this;
        }

        public Builder requestedModel(String requestedModel) {
            this.requestedModel = requestedModel;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder accountEmail(String accountEmail) {
            this.accountEmail = accountEmail;
            return this;
        }

        public Builder inputTokens(int inputTokens) {
            this.inputTokens = inputTokens;
            return this;
        }

        public Builder outputTokens(int outputTokens) {
            this.outputTokens = outputTokens;
            return this;
        }

        public Builder cacheCreationTokens(int cacheCreationTokens) {
            this.cacheCreationTokens = cacheCreationTokens;
            return this;
        }

        public Builder cacheReadTokens(int cacheReadTokens) {
            this.cacheReadTokens = cacheReadTokens;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder stopReason(String stopReason) {
            this.stopReason = stopReason;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder errorType(String errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder httpStatus(int httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder eventTime(Instant eventTime) {
            this.eventTime = eventTime;
            return this;
        }

        public UsageEventData build() {
            return new UsageEventData(
                apiKeyId, requestedModel, model, accountEmail,
                inputTokens, outputTokens, cacheCreationTokens, cacheReadTokens,
                messageId, latencyMs, stream, stopReason,
                status, errorType, httpStatus,
                clientIp, userAgent, traceId, eventTime
            );
        }
    }
}
