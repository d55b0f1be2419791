package io.github.samzhu.prism.exception;

/**
 * API Key 超過每分鐘或每小時請求上限（429）
 */
public class RateLimitExceededException extends GatewayException {

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(429, "rate_limit_error", message, retryAfterSeconds);
    }
}
