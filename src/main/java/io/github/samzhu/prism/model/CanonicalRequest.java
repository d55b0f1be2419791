package io.github.samzhu.prism.model;

import java.util.List;

/**
 * 與客戶端協定無關的標準化請求
 *
 * <p>由 {@code RequestConverter} 從 OpenAI 或 Anthropic 格式轉換而來，再由後端傳輸層
 * 轉為 Messages API 格式送出。
 *
 * <p>不變條件：
 * <ul>
 *   <li>system 訊息已抽出為 {@code system} 字串</li>
 *   <li>{@code turns} 僅包含 user / assistant，且相鄰回合角色不同</li>
 *   <li>{@code model} 為解析別名後的後端模型名稱</li>
 * </ul>
 *
 * @param model 後端模型名稱
 * @param requestedModel 客戶端原始指定的模型名稱
 * @param system system 指示（可為 null）
 * @param turns 對話回合
 * @param params 生成參數
 * @param tools 工具定義
 * @param toolChoice 工具選擇策略（可為 null）
 * @param stream 是否為串流請求
 */
public record CanonicalRequest(
    String model,
    String requestedModel,
    String system,
    List<Turn> turns,
    GenerationParams params,
    List<ToolDefinition> tools,
    ToolChoice toolChoice,
    boolean stream
) {
    public CanonicalRequest {
        turns = turns == null ? List.of() : List.copyOf(turns);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
