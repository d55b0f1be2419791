package io.github.samzhu.prism.exception;

/**
 * API Key 有效但不允許此次請求（403）
 *
 * <p>適用情境：Key 已停用、已過期、來源 IP 不在白名單、模型不在允許清單。
 */
public class PermissionDeniedException extends GatewayException {

    public PermissionDeniedException(String message) {
        super(403, "permission_error", message);
    }
}
