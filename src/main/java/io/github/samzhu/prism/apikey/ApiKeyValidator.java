package io.github.samzhu.prism.apikey;

import java.time.Clock;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.prism.exception.ApiKeyAuthenticationException;
import io.github.samzhu.prism.exception.PermissionDeniedException;
import io.github.samzhu.prism.exception.RateLimitExceededException;
import io.github.samzhu.prism.util.GlobPattern;

/**
 * API Key 驗證器
 *
 * <p>依序檢查，第一個失敗的檢查決定錯誤：
 * <ol>
 *   <li>是否提供 Key（401）</li>
 *   <li>以 SHA-256 雜湊查詢紀錄（401）</li>
 *   <li>是否啟用（403）</li>
 *   <li>是否過期（403）</li>
 *   <li>來源 IP 是否在白名單（403，僅在有 IP 時檢查）</li>
 *   <li>模型是否在允許清單（403，僅在有指定模型時檢查）</li>
 *   <li>每分鐘 / 每小時請求上限（429）</li>
 * </ol>
 *
 * <p>全部通過時佔用一個限流額度，之後後端呼叫失敗也不退還。
 *
 * @see SlidingWindowRateLimiter
 * @see GlobPattern
 */
public class ApiKeyValidator {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyValidator.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiKeyStore store;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Clock clock;

    public ApiKeyValidator(ApiKeyStore store, SlidingWindowRateLimiter rateLimiter, Clock clock) {
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * 驗證 API Key 並檢查所有限制
     *
     * @param secret 客戶端提供的明文 Key
     * @param model 客戶端指定的模型（可為 null）
     * @param resolvedModel 解析別名後的模型（可為 null）
     * @param clientIp 客戶端 IP（可為 null）
     * @return 通過驗證的紀錄
     * @throws ApiKeyAuthenticationException Key 缺少或無效
     * @throws PermissionDeniedException Key 停用、過期或不允許此 IP / 模型
     * @throws RateLimitExceededException 超過請求上限
     */
    public ApiKeyRecord validate(String secret, String model, String resolvedModel, String clientIp) {
        ApiKeyRecord record = authenticate(secret, clientIp);
        authorize(record, model, resolvedModel);
        return record;
    }

    /**
     * 不需要請求內容的檢查：Key 是否存在、有效、啟用、未過期，以及來源 IP
     *
     * <p>在解析請求內容之前呼叫，未通過驗證的客戶端不會得到任何與內容相關的錯誤訊息。
     */
    public ApiKeyRecord authenticate(String secret, String clientIp) {
        if (StringUtils.isBlank(secret)) {
            throw new ApiKeyAuthenticationException("API key is required");
        }

        ApiKeyRecord record = store.findByHash(ApiKeyService.hash(secret))
            .orElseThrow(() -> {
                log.warn("Rejected unknown API key: fingerprint={}, ip={}", ApiKeyService.fingerprint(secret), clientIp);
                return new ApiKeyAuthenticationException("Invalid API key");
            });

        if (!record.enabled()) {
            log.warn("Rejected disabled API key: id={}", record.id());
            throw new PermissionDeniedException("API key is disabled");
        }

        if (record.isExpired(clock.instant())) {
            log.warn("Rejected expired API key: id={}, expiresAt={}", record.id(), record.expiresAt());
            throw new PermissionDeniedException("API key has expired");
        }

        if (StringUtils.isNotBlank(clientIp) && !GlobPattern.ipAllowed(record.ipWhitelist(), clientIp)) {
            log.warn("Rejected API key from disallowed IP: id={}, ip={}", record.id(), clientIp);
            throw new PermissionDeniedException("IP address " + clientIp + " is not allowed for this API key");
        }
        return record;
    }

    /**
     * 依請求的模型檢查允許清單，通過後佔用一個限流額度
     */
    public void authorize(ApiKeyRecord record, String model, String resolvedModel) {
        if (StringUtils.isNotBlank(model) && !isModelAllowed(record, model, resolvedModel)) {
            log.warn("Rejected API key for disallowed model: id={}, model={}", record.id(), model);
            throw new PermissionDeniedException("Model " + model + " is not allowed for this API key");
        }

        RateLimitDecision decision = rateLimiter.acquire(record.id(), record.rateLimitRpm(), record.rateLimitRph());
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded: id={}, period={}, current={}, limit={}, retryAfter={}s",
                record.id(), decision.period(), decision.current(), decision.limit(), decision.retryAfterSeconds());
            throw new RateLimitExceededException(decision.message(), decision.retryAfterSeconds());
        }
    }

    /**
     * 從請求 header 取出 API Key
     *
     * <p>優先使用 {@code Authorization: Bearer <key>}，其次為 {@code x-api-key}。
     *
     * @param headers header 名稱為小寫的 header map
     * @return 明文 Key，找不到時為 null
     */
    public static String extractApiKey(Map<String, String> headers) {
        if (headers == null) {
            return null;
        }
        String authorization = headers.get("authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return StringUtils.trimToNull(authorization.substring(BEARER_PREFIX.length()));
        }
        return StringUtils.trimToNull(headers.get("x-api-key"));
    }

    private static boolean isModelAllowed(ApiKeyRecord record, String model, String resolvedModel) {
        if (GlobPattern.matchesAny(record.allowedModels(), model)) {
            return true;
        }
        return resolvedModel != null && GlobPattern.matchesAny(record.allowedModels(), resolvedModel);
    }
}
