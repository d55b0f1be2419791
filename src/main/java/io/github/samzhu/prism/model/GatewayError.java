package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Anthropic 格式的錯誤回應
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "type": "error",
 *   "error": {
 *     "type": "authentication_error|permission_error|rate_limit_error|...",
 *     "message": "錯誤描述"
 *   }
 * }
 * }</pre>
 *
 * @see OpenAiError
 * @see io.github.samzhu.prism.exception.GlobalExceptionHandler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    String type,
    Error error
) {
    public record Error(
        String type,
        String message
    ) {}

    public static GatewayError of(String errorType, String message) {
        return new GatewayError("error", new Error(errorType, message));
    }

    public static GatewayError apiError(String message) {
        return of("api_error", message);
    }
}
