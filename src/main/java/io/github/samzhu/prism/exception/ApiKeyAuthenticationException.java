package io.github.samzhu.prism.exception;

/**
 * API Key 缺少或無法辨識（401）
 */
public class ApiKeyAuthenticationException extends GatewayException {

    public ApiKeyAuthenticationException(String message) {
        super(401, "authentication_error", message);
    }
}
