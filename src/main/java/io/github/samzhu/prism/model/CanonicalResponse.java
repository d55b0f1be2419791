package io.github.samzhu.prism.model;

import java.util.List;

/**
 * 標準化的非串流回應
 *
 * @param id 後端訊息 ID
 * @param model 後端實際使用的模型
 * @param content 回應內容（text / tool_use / thinking）
 * @param stopReason 結束原因（end_turn、max_tokens、tool_use、stop_sequence）
 * @param usage Token 用量
 */
public record CanonicalResponse(
    String id,
    String model,
    List<ContentPart> content,
    String stopReason,
    TokenUsage usage
) {
    public CanonicalResponse {
        content = content == null ? List.of() : List.copyOf(content);
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }
}
