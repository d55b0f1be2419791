package io.github.samzhu.prism.backend;

import java.time.Duration;

import io.github.samzhu.prism.exception.GatewayException;
import io.github.samzhu.prism.pool.Outcome;

/**
 * 後端呼叫失敗
 *
 * <p>依後端狀態碼分類，決定帳號結果與是否換帳號重試：
 * <ul>
 *   <li>429 → {@link Kind#RATE_LIMITED}：帳號冷卻（優先採用 {@code Retry-After}），重試</li>
 *   <li>401 / 403 → {@link Kind#CREDENTIAL_REJECTED}：帳號標記失效，重試；回應客戶端 502</li>
 *   <li>5xx → {@link Kind#SERVER_ERROR}：帳號扣分，重試</li>
 *   <li>連線或讀取錯誤 → {@link Kind#IO_ERROR}：帳號扣分，重試；回應客戶端 502</li>
 *   <li>其他 4xx → {@link Kind#CLIENT_ERROR}：請求本身有誤，不重試，帳號視為成功</li>
 * </ul>
 */
public class BackendException extends GatewayException {

    public enum Kind {
        RATE_LIMITED,
        CREDENTIAL_REJECTED,
        SERVER_ERROR,
        IO_ERROR,
        CLIENT_ERROR
    }

    private final Kind kind;
    private final int backendStatus;

    private BackendException(int status, String errorType, String message, Long retryAfterSeconds,
                             Kind kind, int backendStatus) {
        super(status, errorType, message, retryAfterSeconds);
        this.kind = kind;
        this.backendStatus = backendStatus;
    }

    private BackendException(String message, Throwable cause) {
        super(502, "api_error", message, cause);
        this.kind = Kind.IO_ERROR;
        this.backendStatus = 0;
    }

    /**
     * 依後端回應建立
     *
     * @param backendStatus 後端 HTTP 狀態碼
     * @param errorType 後端錯誤類型（可為 null）
     * @param message 後端錯誤訊息（可為 null）
     * @param retryAfterSeconds 後端 {@code Retry-After}（可為 null）
     */
    public static BackendException fromResponse(int backendStatus, String errorType, String message,
                                                Long retryAfterSeconds) {
        String detail = message != null ? message : "Backend returned HTTP " + backendStatus;
        if (backendStatus == 429) {
            return new BackendException(429, "rate_limit_error", detail, retryAfterSeconds,
                Kind.RATE_LIMITED, backendStatus);
        }
        if (backendStatus == 401 || backendStatus == 403) {
            return new BackendException(502, "api_error", "Backend rejected the account credentials",
                null, Kind.CREDENTIAL_REJECTED, backendStatus);
        }
        if (backendStatus >= 500) {
            return new BackendException(backendStatus, errorType != null ? errorType : "api_error", detail,
                retryAfterSeconds, Kind.SERVER_ERROR, backendStatus);
        }
        return new BackendException(backendStatus, errorType != null ? errorType : "invalid_request_error", detail,
            null, Kind.CLIENT_ERROR, backendStatus);
    }

    public static BackendException ioFailure(String message, Throwable cause) {
        return new BackendException(message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public int getBackendStatus() {
        return backendStatus;
    }

    /**
     * 是否應換帳號重試
     */
    public boolean isRetryable() {
        return kind != Kind.CLIENT_ERROR;
    }

    public boolean isCredentialRejected() {
        return kind == Kind.CREDENTIAL_REJECTED;
    }

    /**
     * 對帳號的結果
     */
    public Outcome outcome() {
        return switch (kind) {
            case RATE_LIMITED -> Outcome.RATE_LIMITED;
            case CLIENT_ERROR -> Outcome.SUCCESS;
            default -> Outcome.FAILURE;
        };
    }

    /**
     * 帳號冷卻時間提示
     */
    public Duration cooldownHint() {
        Long retryAfter = getRetryAfterSeconds();
        return kind == Kind.RATE_LIMITED && retryAfter != null && retryAfter > 0
            ? Duration.ofSeconds(retryAfter) : null;
    }
}
