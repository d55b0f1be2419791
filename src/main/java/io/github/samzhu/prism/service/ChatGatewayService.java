package io.github.samzhu.prism.service;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.apikey.ApiKeyRecord;
import io.github.samzhu.prism.apikey.ApiKeyService;
import io.github.samzhu.prism.apikey.ApiKeyValidator;
import io.github.samzhu.prism.backend.BackendEventStream;
import io.github.samzhu.prism.backend.BackendException;
import io.github.samzhu.prism.backend.BackendTransport;
import io.github.samzhu.prism.exception.GatewayException;
import io.github.samzhu.prism.exception.InvalidRequestException;
import io.github.samzhu.prism.format.ClientDialect;
import io.github.samzhu.prism.format.ConverterFactory;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.UsageEventData;
import io.github.samzhu.prism.pool.AccountIdentity;
import io.github.samzhu.prism.pool.AccountPool;
import io.github.samzhu.prism.pool.Outcome;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

/**
 * Chat 請求協調器
 *
 * <p>處理流程：
 * <ol>
 *   <li>驗證 API Key（存在、啟用、未過期、IP）；尚未設定任何 Key 時略過</li>
 *   <li>解析 JSON 並轉為標準化請求（模型別名已解析）</li>
 *   <li>檢查 Key 的模型允許清單與速率限制</li>
 *   <li>從帳號池選出帳號呼叫後端；429、憑證被拒、5xx 與連線錯誤時換下一個帳號重試</li>
 *   <li>將後端回應轉回客戶端協定，或建立 {@link ChatStream} 逐一轉譯串流事件</li>
 *   <li>發送請求紀錄事件</li>
 * </ol>
 *
 * <p>串流請求在第一個 frame 之前的錯誤以 {@link GatewayException} 拋出，之後的錯誤以串流內錯誤 frame 表示。
 *
 * @see ConverterFactory
 * @see AccountPool
 * @see ApiKeyValidator
 */
public class ChatGatewayService {

    private static final Logger log = LoggerFactory.getLogger(ChatGatewayService.class);

    private final ConverterFactory converterFactory;
    private final ApiKeyValidator apiKeyValidator;
    private final ApiKeyService apiKeyService;
    private final AccountPool accountPool;
    private final BackendTransport backendTransport;
    private final UsageEventPublisher usageEventPublisher;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;
    private final Clock clock;
    private final int maxAttempts;

    public ChatGatewayService(ConverterFactory converterFactory,
                              ApiKeyValidator apiKeyValidator,
                              ApiKeyService apiKeyService,
                              AccountPool accountPool,
                              BackendTransport backendTransport,
                              UsageEventPublisher usageEventPublisher,
                              ObjectMapper objectMapper,
                              Tracer tracer,
                              Clock clock,
                              int maxAttempts) {
        this.converterFactory = converterFactory;
        this.apiKeyValidator = apiKeyValidator;
        this.apiKeyService = apiKeyService;
        this.accountPool = accountPool;
        this.backendTransport = backendTransport;
        this.usageEventPublisher = usageEventPublisher;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * 處理非串流請求
     *
     * @param dialect 客戶端協定
     * @param rawBody 原始請求內容
     * @param headers 請求 headers（名稱小寫）
     * @param clientIp 客戶端 IP（可為 null）
     * @return 客戶端協定格式的回應
     * @throws GatewayException 驗證、選帳號或後端呼叫失敗
     */
    public GatewayReply handleChatRequest(ClientDialect dialect, String rawBody,
                                          Map<String, String> headers, String clientIp) {
        long startMillis = clock.millis();
        UsageEventData.Builder usage = newUsage(headers, clientIp, false);
        try {
            CanonicalRequest request = prepare(dialect, rawBody, headers, clientIp, usage);
            Attempt<CanonicalResponse> attempt = execute(request,
                identity -> backendTransport.invoke(request, identity));
            accountPool.recordOutcome(attempt.identity(), Outcome.SUCCESS);

            CanonicalResponse response = attempt.result();
            Object body = converterFactory.getResponseConverter(dialect).convert(response, request.requestedModel());

            usage.accountEmail(attempt.identity().getEmail())
                .inputTokens(response.usage().inputTokens())
                .outputTokens(response.usage().outputTokens())
                .cacheReadTokens(response.usage().cacheReadTokens())
                .cacheCreationTokens(response.usage().cacheCreationTokens())
                .messageId(response.id())
                .stopReason(response.stopReason());
            if (response.model() != null) {
                usage.model(response.model());
            }
            publish(usage, startMillis, "success", null, 200);
            return GatewayReply.ok(body);
        } catch (GatewayException e) {
            publish(usage, startMillis, statusOf(e), e.getErrorType(), e.getStatus());
            throw e;
        }
    }

    /**
     * 處理串流請求
     *
     * <p>回傳前會先讀取第一個後端事件，連線或第一個事件失敗時仍可換帳號重試。
     *
     * @return 客戶端 frame 序列；呼叫端負責在結束或斷線時 {@link ChatStream#close()}
     * @throws GatewayException 第一個 frame 之前的錯誤
     */
    public ChatStream handleChatStream(ClientDialect dialect, String rawBody,
                                       Map<String, String> headers, String clientIp) {
        long startMillis = clock.millis();
        UsageEventData.Builder usage = newUsage(headers, clientIp, true);
        try {
            CanonicalRequest request = prepare(dialect, rawBody, headers, clientIp, usage);
            Attempt<BackendEventStream> attempt = execute(request, identity -> {
                BackendEventStream events = backendTransport.openStream(request, identity);
                try {
                    events.hasNext();
                } catch (BackendException e) {
                    events.close();
                    throw e;
                }
                return events;
            });
            usage.accountEmail(attempt.identity().getEmail());
            return new ChatStream(
                attempt.result(),
                converterFactory.newStreamTranscoder(dialect, request.requestedModel()),
                accountPool,
                attempt.identity(),
                usage,
                usageEventPublisher,
                clock,
                startMillis);
        } catch (GatewayException e) {
            publish(usage, startMillis, statusOf(e), e.getErrorType(), e.getStatus());
            throw e;
        }
    }

    /**
     * 判斷請求是否要求串流（{@code "stream": true}）
     *
     * @throws InvalidRequestException JSON 格式錯誤
     */
    public boolean isStreamRequested(String rawBody) {
        return parse(rawBody).path("stream").asBoolean(false);
    }

    private CanonicalRequest prepare(ClientDialect dialect, String rawBody, Map<String, String> headers,
                                     String clientIp, UsageEventData.Builder usage) {
        ApiKeyRecord key = null;
        if (apiKeyService.hasApiKeys()) {
            key = apiKeyValidator.authenticate(ApiKeyValidator.extractApiKey(headers), clientIp);
            usage.apiKeyId(key.id());
        }

        JsonNode body = parse(rawBody);
        CanonicalRequest request = converterFactory.getRequestConverter(dialect).convert(body);
        usage.requestedModel(request.requestedModel()).model(request.model());

        if (key != null) {
            apiKeyValidator.authorize(key, request.requestedModel(), request.model());
            apiKeyService.recordUsage(key.id());
        }
        log.debug("Chat request: dialect={}, model={} -> {}, turns={}, tools={}, stream={}",
            dialect, request.requestedModel(), request.model(), request.turns().size(),
            request.tools().size(), request.stream());
        return request;
    }

    private JsonNode parse(String rawBody) {
        if (StringUtils.isBlank(rawBody)) {
            throw new InvalidRequestException("Request body is required");
        }
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            if (node == null || !node.isObject()) {
                throw new InvalidRequestException("Request body must be a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new InvalidRequestException("Malformed JSON request body", e);
        }
    }

    /**
     * 以帳號池中的帳號執行後端呼叫，可重試的錯誤換帳號再試
     */
    private <T> Attempt<T> execute(CanonicalRequest request, BackendCall<T> call) {
        Set<String> excluded = new HashSet<>();
        BackendException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AccountIdentity identity = accountPool.selectAccount(excluded);
            try {
                return new Attempt<>(identity, call.apply(identity));
            } catch (BackendException e) {
                if (e.isCredentialRejected()) {
                    accountPool.markInvalid(identity, "Backend returned HTTP " + e.getBackendStatus());
                } else {
                    accountPool.recordOutcome(identity, e.outcome(), e.cooldownHint());
                }
                if (!e.isRetryable()) {
                    throw e;
                }
                excluded.add(identity.getEmail());
                lastFailure = e;
                log.warn("Backend attempt {}/{} failed: account={}, model={}, kind={}, status={}",
                    attempt, maxAttempts, identity.getEmail(), request.model(), e.getKind(), e.getStatus());
            }
        }
        throw lastFailure;
    }

    private UsageEventData.Builder newUsage(Map<String, String> headers, String clientIp, boolean stream) {
        return UsageEventData.builder()
            .stream(stream)
            .clientIp(clientIp)
            .userAgent(headers != null ? headers.get("user-agent") : null)
            .traceId(getCurrentTraceId());
    }

    private void publish(UsageEventData.Builder usage, long startMillis, String status, String errorType,
                         int httpStatus) {
        UsageEventData data = usage
            .status(status)
            .errorType(errorType)
            .httpStatus(httpStatus)
            .latencyMs(clock.millis() - startMillis)
            .eventTime(clock.instant())
            .build();
        if (httpStatus == 200) {
            log.info("Token usage: apiKeyId={}, account={}, inputTokens={}, outputTokens={}, model={}, latencyMs={}",
                data.apiKeyId(), data.accountEmail(), data.inputTokens(), data.outputTokens(), data.model(),
                data.latencyMs());
        }
        usageEventPublisher.publish(data);
    }

    private static String statusOf(GatewayException e) {
        return e.getStatus() == 429 ? "rate_limited" : "error";
    }

    /**
     * 取得當前 OpenTelemetry Trace ID
     */
    private String getCurrentTraceId() {
        try {
            Span currentSpan = tracer.currentSpan();
            if (currentSpan != null && currentSpan.context() != null) {
                return currentSpan.context().traceId();
            }
        } catch (Exception e) {
            log.debug("Failed to get trace ID: {}", e.getMessage());
        }
        return null;
    }

    @FunctionalInterface
    private interface BackendCall<T> {
        T apply(AccountIdentity identity);
    }

    private record Attempt<T>(AccountIdentity identity, T result) {}
}
