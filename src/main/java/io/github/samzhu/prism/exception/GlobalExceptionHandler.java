package io.github.samzhu.prism.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.prism.format.ClientDialect;
import io.github.samzhu.prism.model.GatewayError;
import io.github.samzhu.prism.model.OpenAiError;

/**
 * 全域異常處理器
 *
 * <p>註冊為路由的 {@code onError}，依請求路徑以客戶端的協定格式回應錯誤：
 * <ul>
 *   <li>{@code /v1/chat/completions} → OpenAI 格式 {@code {"error":{"message","type","code"}}}</li>
 *   <li>其他路徑 → Anthropic 格式 {@code {"type":"error","error":{"type","message"}}}</li>
 * </ul>
 *
 * <p>處理的異常類型：
 * <ul>
 *   <li>{@link GatewayException} - 使用其狀態碼與錯誤類型；有 {@code retryAfterSeconds} 時加上 {@code Retry-After}</li>
 *   <li>其他異常 - 500 {@code api_error}，訊息不含內部細節</li>
 * </ul>
 *
 * @see GatewayError
 * @see OpenAiError
 */
@Component
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String OPENAI_PATH = "/v1/chat/completions";

    /**
     * 將異常轉為錯誤回應
     */
    public ServerResponse handle(Throwable error, ServerRequest request) {
        ClientDialect dialect = dialectOf(request.path());

        if (error instanceof GatewayException gatewayException) {
            logGatewayException(gatewayException, request);
            ServerResponse.BodyBuilder builder = ServerResponse.status(gatewayException.getStatus())
                .contentType(MediaType.APPLICATION_JSON);
            if (gatewayException.getRetryAfterSeconds() != null) {
                builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(gatewayException.getRetryAfterSeconds()));
            }
            return builder.body(render(dialect, gatewayException.getErrorType(), gatewayException.getMessage()));
        }

        log.error("Unexpected error: path={}, error={}", request.path(), error.getMessage(), error);
        return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(MediaType.APPLICATION_JSON)
            .body(render(dialect, "api_error", "Internal server error"));
    }

    /**
     * 依協定產生錯誤內容
     */
    public static Object render(ClientDialect dialect, String errorType, String message) {
        return dialect == ClientDialect.OPENAI
            ? OpenAiError.of(errorType, message)
            : GatewayError.of(errorType, message);
    }

    static ClientDialect dialectOf(String path) {
        return path != null && path.startsWith(OPENAI_PATH) ? ClientDialect.OPENAI : ClientDialect.ANTHROPIC;
    }

    private void logGatewayException(GatewayException e, ServerRequest request) {
        if (e.getStatus() >= 500) {
            log.error("Request failed: path={}, status={}, type={}, message={}",
                request.path(), e.getStatus(), e.getErrorType(), e.getMessage());
        } else {
            log.warn("Request rejected: path={}, status={}, type={}, message={}",
                request.path(), e.getStatus(), e.getErrorType(), e.getMessage());
        }
    }
}
