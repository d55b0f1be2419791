package io.github.samzhu.prism.exception;

/**
 * 閘道異常基底類別
 *
 * <p>所有可回應給客戶端的錯誤都繼承此類別，攜帶：
 * <ul>
 *   <li>{@code status} - HTTP 狀態碼</li>
 *   <li>{@code errorType} - 錯誤類型（如 {@code rate_limit_error}）</li>
 *   <li>{@code retryAfterSeconds} - 建議的重試秒數（可為 null）</li>
 * </ul>
 *
 * <p>錯誤訊息會直接回傳給客戶端，不得包含明文金鑰或雜湊值。
 *
 * @see GlobalExceptionHandler
 */
public class GatewayException extends RuntimeException {

    private final int status;
    private final String errorType;
    private final Long retryAfterSeconds;

    public GatewayException(int status, String errorType, String message) {
        this(status, errorType, message, (Long) null);
    }

    public GatewayException(int status, String errorType, String message, Long retryAfterSeconds) {
        super(message);
        this.status = status;
        this.errorType = errorType;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public GatewayException(int status, String errorType, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorType = errorType;
        this.retryAfterSeconds = null;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorType() {
        return errorType;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
