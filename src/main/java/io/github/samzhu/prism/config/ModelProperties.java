package io.github.samzhu.prism.config;

import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.prism.format.ModelMapper;

/**
 * 模型名稱對應配置
 *
 * <p>{@code mapping} 會覆蓋內建的別名表，比對時忽略大小寫。
 *
 * @param defaultModel 未指定模型時使用的後端模型
 * @param mapping 客戶端模型名稱 → 後端模型名稱
 */
@ConfigurationProperties(prefix = "prism.models")
public record ModelProperties(
    String defaultModel,
    Map<String, String> mapping
) {
    public ModelProperties {
        if (defaultModel == null || defaultModel.isBlank()) {
            defaultModel = ModelMapper.DEFAULT_MODEL;
        }
        if (mapping == null) {
            mapping = Map.of();
        }
    }
}
