package io.github.samzhu.prism.config;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.prism.apikey.ApiKeySettings;

/**
 * 客戶端 API Key 配置屬性
 *
 * <p>從 application.yaml 中的 {@code prism.api-keys} 前綴載入配置。{@code keys} 中的 Key
 * 會在啟動時匯入（以雜湊判斷，重複啟動不會重複建立）。
 *
 * <p>配置範例：
 * <pre>
 * prism:
 *   api-keys:
 *     cleanup-interval: PT5M
 *     keys:
 *       - name: "ci"
 *         value: ${PRISM_CI_KEY}
 *         allowed-models: ["gemini-*"]
 *         rate-limit-rpm: 60
 *         ip-whitelist: ["10.0.*"]
 * </pre>
 *
 * @param keys 啟動時匯入的 Key
 * @param cleanupInterval 閒置速率視窗的清理間隔
 * @see io.github.samzhu.prism.apikey.ApiKeyService#importKey
 */
@ConfigurationProperties(prefix = "prism.api-keys")
public record ApiKeyProperties(
    List<KeyConfig> keys,
    Duration cleanupInterval
) {
    public ApiKeyProperties {
        if (keys == null) {
            keys = List.of();
        }
        if (cleanupInterval == null) {
            cleanupInterval = Duration.ofMinutes(5);
        }
    }

    /**
     * 單一 Key 配置
     *
     * @param name 名稱（必填，用於日誌追蹤）
     * @param value Key 明文（必填）
     */
    public record KeyConfig(
        String name,
        String value,
        List<String> allowedModels,
        Integer rateLimitRpm,
        Integer rateLimitRph,
        List<String> ipWhitelist,
        Instant expiresAt,
        String notes
    ) {
        public KeyConfig {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("API key name cannot be blank");
            }
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("API key value cannot be blank");
            }
        }

        public ApiKeySettings toSettings() {
            return new ApiKeySettings(name, allowedModels, rateLimitRpm, rateLimitRph, ipWhitelist,
                expiresAt, Boolean.TRUE, notes);
        }
    }
}
