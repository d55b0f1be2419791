package io.github.samzhu.prism.service;

/**
 * 非串流請求的結果
 *
 * @param status HTTP 狀態碼
 * @param body 可由 Jackson 序列化的回應內容（客戶端協定格式）
 */
public record GatewayReply(
    int status,
    Object body
) {
    public static GatewayReply ok(Object body) {
        return new GatewayReply(200, body);
    }
}
