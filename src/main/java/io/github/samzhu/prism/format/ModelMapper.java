package io.github.samzhu.prism.format;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import io.github.samzhu.prism.model.ModelList;

/**
 * 模型別名解析
 *
 * <p>將客戶端常用的模型名稱對應到後端模型：
 * <ul>
 *   <li>先查設定檔 {@code prism.models.mapping}，再查內建對照表，比對時不分大小寫</li>
 *   <li>查無對應時原樣傳遞</li>
 *   <li>未指定模型時使用 {@code prism.models.default-model}</li>
 * </ul>
 */
public class ModelMapper {

    public static final String DEFAULT_MODEL = "gemini-3-flash";

    private static final String OWNED_BY = "prism";

    private static final Map<String, String> BUILT_IN_ALIASES = Map.ofEntries(
        // GPT-4 系列
        Map.entry("gpt-4", "claude-opus-4-5-thinking"),
        Map.entry("gpt-4-turbo", "claude-opus-4-5-thinking"),
        Map.entry("gpt-4-turbo-preview", "claude-opus-4-5-thinking"),
        Map.entry("gpt-4-0125-preview", "claude-opus-4-5-thinking"),
        Map.entry("gpt-4-1106-preview", "claude-opus-4-5-thinking"),
        // GPT-4o 系列
        Map.entry("gpt-4o", "gemini-3-pro-high"),
        Map.entry("gpt-4o-mini", "gemini-3-flash"),
        // GPT-3.5 系列
        Map.entry("gpt-3.5-turbo", "gemini-3-flash"),
        Map.entry("gpt-3.5-turbo-0125", "gemini-3-flash"),
        Map.entry("gpt-3.5-turbo-1106", "gemini-3-flash"),
        Map.entry("gpt-3.5-turbo-instruct", "gemini-3-flash"),
        // o1 推理模型
        Map.entry("o1", "claude-opus-4-5-thinking"),
        Map.entry("o1-preview", "claude-opus-4-5-thinking"),
        Map.entry("o1-mini", "claude-sonnet-4-5-thinking"),
        // 舊版 Claude 名稱
        Map.entry("claude-3-opus", "claude-opus-4-5-thinking"),
        Map.entry("claude-3-sonnet", "claude-sonnet-4-5-thinking"),
        Map.entry("claude-3-haiku", "gemini-3-flash"),
        // Gemini 簡稱
        Map.entry("gemini-pro", "gemini-3-pro-high"),
        Map.entry("gemini-flash", "gemini-3-flash")
    );

    private static final List<String> LISTED_MODELS = List.of(
        "gpt-4", "gpt-4-turbo", "gpt-4o", "gpt-4o-mini", "gpt-3.5-turbo", "o1", "o1-mini",
        "claude-opus-4-5-thinking", "claude-sonnet-4-5-thinking", "gemini-3-pro-high", "gemini-3-flash"
    );

    private final Map<String, String> overrides;
    private final String defaultModel;
    private final Clock clock;

    public ModelMapper(Map<String, String> overrides, String defaultModel, Clock clock) {
        this.overrides = new LinkedHashMap<>();
        if (overrides != null) {
            overrides.forEach((alias, target) -> this.overrides.put(alias.toLowerCase(Locale.ROOT), target));
        }
        this.defaultModel = StringUtils.isNotBlank(defaultModel) ? defaultModel : DEFAULT_MODEL;
        this.clock = clock;
    }

    /**
     * 解析模型名稱
     *
     * @param requested 客戶端指定的模型（可為 null）
     * @return 後端模型名稱
     */
    public String resolve(String requested) {
        if (StringUtils.isBlank(requested)) {
            return defaultModel;
        }
        String key = requested.toLowerCase(Locale.ROOT);
        String override = overrides.get(key);
        if (override != null) {
            return override;
        }
        return BUILT_IN_ALIASES.getOrDefault(key, requested);
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * {@code GET /v1/models} 的模型清單：常用別名、後端模型與設定檔中的別名
     */
    public ModelList listModels() {
        long created = clock.instant().getEpochSecond();
        Set<String> ids = new LinkedHashSet<>(LISTED_MODELS);
        ids.addAll(overrides.keySet());
        return ModelList.of(ids.stream()
            .map(id -> new ModelList.Entry(id, "model", created, OWNED_BY))
            .toList());
    }
}
