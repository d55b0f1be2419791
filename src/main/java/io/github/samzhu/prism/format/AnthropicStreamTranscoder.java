package io.github.samzhu.prism.format;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.model.GatewayError;

/**
 * 後端 SSE 事件 → Anthropic Messages 串流
 *
 * <p>後端事件已是 Messages 格式，以 {@code event: <type>\ndata: <json>\n\n} 原樣轉發。
 * {@code message_stop} 或 {@code error} 之後串流結束。
 */
public class AnthropicStreamTranscoder implements StreamTranscoder {

    private final ObjectMapper objectMapper;
    private boolean finished;

    public AnthropicStreamTranscoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> onEvent(BackendEvent event) {
        if (finished || event == null || event.data() == null) {
            return List.of();
        }
        String type = event.type();
        if (type == null) {
            return List.of();
        }
        if ("message_stop".equals(type) || "error".equals(type)) {
            finished = true;
        }
        return List.of("event: " + type + "\ndata: " + event.data() + "\n\n");
    }

    @Override
    public List<String> onFailure(String message) {
        if (finished) {
            return List.of();
        }
        finished = true;
        try {
            String data = objectMapper.writeValueAsString(GatewayError.apiError(message));
            return List.of("event: error\ndata: " + data + "\n\n");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream error", e);
        }
    }

    @Override
    public boolean isFinished() {
        return finished;
    }
}
