package io.github.samzhu.prism.model;

/**
 * 從後端串流讀出的單一 SSE 事件
 *
 * @param eventType {@code event:} 行的類型（可為 null）
 * @param data {@code data:} 行的原始 JSON
 * @param payload 解析後的事件；無法解析時為 null
 */
public record BackendEvent(
    String eventType,
    String data,
    StreamEvent payload
) {
    /**
     * 事件類型，以 payload 中的 {@code type} 為準
     */
    public String type() {
        if (payload != null && payload.type() != null) {
            return payload.type();
        }
        return eventType;
    }
}
