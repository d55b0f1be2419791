package io.github.samzhu.prism.format;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.model.ChatCompletion;
import io.github.samzhu.prism.model.ChatCompletionChunk;
import io.github.samzhu.prism.model.OpenAiError;
import io.github.samzhu.prism.model.StreamEvent;
import io.github.samzhu.prism.util.IdGenerator;

/**
 * 後端 SSE 事件 → OpenAI {@code chat.completion.chunk} 串流
 *
 * <p>事件對應：
 * <ul>
 *   <li>{@code message_start} → 只輸出一次的 role frame</li>
 *   <li>{@code content_block_start}（tool_use）→ 配置下一個 tool index，記錄 block index 對應，
 *       輸出含 id、name、空參數的 tool_calls frame</li>
 *   <li>{@code text_delta} → content frame</li>
 *   <li>{@code input_json_delta} → 對應 tool index 的參數 frame；沒有對應的 block 略過</li>
 *   <li>{@code thinking_delta}、{@code content_block_stop}、{@code ping} → 不輸出</li>
 *   <li>{@code message_delta}（含 stop_reason）→ finish frame</li>
 *   <li>{@code message_stop} → {@code data: [DONE]}，串流結束</li>
 *   <li>{@code error} → 單一錯誤 frame，串流結束，不輸出 {@code [DONE]}</li>
 * </ul>
 *
 * <p>同一串流的所有 frame 共用同一個 completion id 與 created 時間。
 */
public class OpenAiStreamTranscoder implements StreamTranscoder {

    private static final Logger log = LoggerFactory.getLogger(OpenAiStreamTranscoder.class);

    static final String DONE_FRAME = "data: [DONE]\n\n";

    private final ObjectMapper objectMapper;
    private final String completionId;
    private final long created;
    private final String model;

    private boolean roleEmitted;
    private final Map<Integer, Integer> toolIndexByBlock = new HashMap<>();
    private int nextToolIndex;
    private boolean finished;

    public OpenAiStreamTranscoder(ObjectMapper objectMapper, String completionId, long created, String model) {
        this.objectMapper = objectMapper;
        this.completionId = completionId;
        this.created = created;
        this.model = model;
    }

    @Override
    public List<String> onEvent(BackendEvent event) {
        if (finished || event == null || event.payload() == null) {
            return List.of();
        }
        StreamEvent payload = event.payload();
        String type = event.type();
        if (type == null) {
            return List.of();
        }

        switch (type) {
            case "message_start":
                if (roleEmitted) {
                    return List.of();
                }
                roleEmitted = true;
                return frame(ChatCompletionChunk.Delta.role("assistant"), null);

            case "content_block_start":
                if (!payload.isToolUseStart()) {
                    return List.of();
                }
                int toolIndex = nextToolIndex++;
                if (payload.index() != null) {
                    toolIndexByBlock.put(payload.index(), toolIndex);
                }
                StreamEvent.ContentBlock block = payload.contentBlock();
                return frame(ChatCompletionChunk.Delta.toolCall(new ChatCompletion.ToolCall(
                    toolIndex,
                    block.id() != null ? block.id() : IdGenerator.withPrefix("call_", 24),
                    "function",
                    new ChatCompletion.FunctionCall(block.name(), ""))), null);

            case "content_block_delta":
                return onDelta(payload);

            case "message_delta":
                String stopReason = payload.getStopReason();
                if (stopReason == null) {
                    return List.of();
                }
                return frame(ChatCompletionChunk.Delta.empty(), StopReasons.toFinishReason(stopReason));

            case "message_stop":
                finished = true;
                return List.of(DONE_FRAME);

            case "error":
                finished = true;
                StreamEvent.ErrorBody error = payload.error();
                String errorType = error != null && error.type() != null ? error.type() : "server_error";
                String message = error != null && error.message() != null ? error.message() : "Unknown error";
                log.warn("Backend stream error: type={}, message={}", errorType, message);
                return List.of(toFrame(OpenAiError.of(errorType, message)));

            default:
                return List.of();
        }
    }

    @Override
    public List<String> onFailure(String message) {
        if (finished) {
            return List.of();
        }
        finished = true;
        return List.of(toFrame(OpenAiError.of("server_error", message)));
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    private List<String> onDelta(StreamEvent payload) {
        StreamEvent.Delta delta = payload.delta();
        if (delta == null || delta.type() == null) {
            return List.of();
        }
        switch (delta.type()) {
            case "text_delta":
                if (delta.text() == null) {
                    return List.of();
                }
                return frame(ChatCompletionChunk.Delta.content(delta.text()), null);
            case "input_json_delta":
                Integer toolIndex = payload.index() != null ? toolIndexByBlock.get(payload.index()) : null;
                if (toolIndex == null) {
                    return List.of();
                }
                return frame(ChatCompletionChunk.Delta.toolCall(new ChatCompletion.ToolCall(
                    toolIndex, null, null,
                    new ChatCompletion.FunctionCall(null, delta.partialJson() != null ? delta.partialJson() : ""))),
                    null);
            default:
                return List.of();
        }
    }

    private List<String> frame(ChatCompletionChunk.Delta delta, String finishReason) {
        ChatCompletionChunk chunk = new ChatCompletionChunk(
            completionId,
            ChatCompletionChunk.OBJECT,
            created,
            model,
            null,
            List.of(new ChatCompletionChunk.Choice(0, delta, null, finishReason)));
        return List.of(toFrame(chunk));
    }

    private String toFrame(Object body) {
        try {
            return "data: " + objectMapper.writeValueAsString(body) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream frame", e);
        }
    }
}
