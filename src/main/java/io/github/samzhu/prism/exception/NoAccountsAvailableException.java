package io.github.samzhu.prism.exception;

/**
 * 帳號池中沒有可選用的後端帳號（503）
 *
 * <p>所有帳號皆停用、失效、冷卻中，或在本次請求的重試中都已嘗試過。
 */
public class NoAccountsAvailableException extends GatewayException {

    public NoAccountsAvailableException(String message) {
        super(503, "overloaded_error", message);
    }
}
