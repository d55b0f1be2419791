package io.github.samzhu.prism.exception;

/**
 * 請求內容無法解析或不符合格式（400）
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(400, "invalid_request_error", message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(400, "invalid_request_error", message, cause);
    }
}
