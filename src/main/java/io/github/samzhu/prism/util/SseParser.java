package io.github.samzhu.prism.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.model.StreamEvent;

/**
 * SSE（Server-Sent Events）事件解析工具
 *
 * <p>解析後端串流回應中的 SSE 格式資料：
 * <ul>
 *   <li>提取 {@code data:} 行內容</li>
 *   <li>提取 {@code event:} 行類型</li>
 *   <li>將 JSON data 解析為 {@link StreamEvent} 物件</li>
 * </ul>
 *
 * <p>SSE 格式範例：
 * <pre>{@code
 * event: message_start
 * data: {"type":"message_start","message":{"id":"msg_xxx",...}}
 *
 * event: content_block_delta
 * data: {"type":"content_block_delta","delta":{"type":"text_delta","text":"Hello"}}
 * }</pre>
 *
 * @see StreamEvent
 * @see io.github.samzhu.prism.backend.SseEventStream
 * @see <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html">SSE Specification</a>
 */
public class SseParser {

    private static final Logger log = LoggerFactory.getLogger(SseParser.class);

    private final ObjectMapper objectMapper;

    public SseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析 SSE data 內容為 StreamEvent
     *
     * @param data SSE data 內容（不含 "data:" 前綴）
     * @return StreamEvent，解析失敗或為 {@code [DONE]} 時返回 null
     */
    public StreamEvent parse(String data) {
        if (data == null || data.isBlank() || "[DONE]".equals(data.trim())) {
            return null;
        }

        try {
            return objectMapper.readValue(data, StreamEvent.class);
        } catch (Exception e) {
            log.debug("Failed to parse SSE data: {}", data, e);
            return null;
        }
    }

    /**
     * 組合成 {@link BackendEvent}
     */
    public BackendEvent toEvent(String eventType, String data) {
        return new BackendEvent(eventType, data, parse(data));
    }

    /**
     * 從 SSE 行提取 data 內容
     *
     * @param line SSE 行
     * @return data 內容，非 data 行返回 null
     */
    public String extractData(String line) {
        return extractField(line, "data:");
    }

    /**
     * 從 SSE 行提取 event 類型
     *
     * @param line SSE 行
     * @return event 類型，非 event 行返回 null
     */
    public String extractEventType(String line) {
        String value = extractField(line, "event:");
        return value != null ? value.trim() : null;
    }

    private String extractField(String line, String field) {
        if (line == null || !line.startsWith(field)) {
            return null;
        }
        String value = line.substring(field.length());
        // 規範允許冒號後接一個可選空白
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
