package io.github.samzhu.prism.backend;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.util.SseParser;

/**
 * 從 HTTP 回應串流逐一讀出 SSE 事件
 *
 * <p>以空行分隔事件；多個 {@code data:} 行以換行串接；{@code :} 開頭的註解行略過。
 * 串流結束時若還有未送出的事件一併送出。
 */
public class SseEventStream implements BackendEventStream {

    private static final Logger log = LoggerFactory.getLogger(SseEventStream.class);

    private final BufferedReader reader;
    private final Closeable resource;
    private final SseParser sseParser;

    private BackendEvent pending;
    private boolean exhausted;
    private boolean closed;

    /**
     * @param body 回應內容
     * @param resource 關閉串流時一併關閉的資源（通常是 HTTP 回應）
     * @param sseParser SSE 解析器
     */
    public SseEventStream(InputStream body, Closeable resource, SseParser sseParser) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.resource = resource;
        this.sseParser = sseParser;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted || closed) {
            return false;
        }
        pending = readEvent();
        if (pending == null) {
            exhausted = true;
        }
        return pending != null;
    }

    @Override
    public BackendEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Backend stream has no more events");
        }
        BackendEvent event = pending;
        pending = null;
        return event;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Error closing backend stream reader: {}", e.getMessage());
        }
        try {
            resource.close();
        } catch (IOException e) {
            log.debug("Error closing backend response: {}", e.getMessage());
        }
    }

    private BackendEvent readEvent() {
        String eventType = null;
        StringBuilder data = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    // 空行表示事件結束
                    if (data != null) {
                        return sseParser.toEvent(eventType, data.toString());
                    }
                    eventType = null;
                    continue;
                }
                if (line.startsWith(":")) {
                    continue;
                }
                String type = sseParser.extractEventType(line);
                if (type != null) {
                    eventType = type;
                    continue;
                }
                String dataLine = sseParser.extractData(line);
                if (dataLine != null) {
                    if (data == null) {
                        data = new StringBuilder(dataLine);
                    } else {
                        data.append('\n').append(dataLine);
                    }
                }
            }
        } catch (IOException e) {
            if (closed) {
                return null;
            }
            throw BackendException.ioFailure("Backend stream read failed: " + e.getMessage(), e);
        }
        return data != null ? sseParser.toEvent(eventType, data.toString()) : null;
    }
}
