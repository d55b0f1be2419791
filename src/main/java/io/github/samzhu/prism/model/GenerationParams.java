package io.github.samzhu.prism.model;

import java.util.List;

/**
 * 生成參數
 *
 * <p>{@code maxTokens} 必定有值（預設 4096），其餘欄位為 null 時不送往後端。
 */
public record GenerationParams(
    int maxTokens,
    Double temperature,
    Double topP,
    Integer topK,
    List<String> stopSequences
) {
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public GenerationParams {
        if (maxTokens <= 0) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
    }
}
