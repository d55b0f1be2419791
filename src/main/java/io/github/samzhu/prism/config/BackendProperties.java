package io.github.samzhu.prism.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 後端 Messages API 配置屬性
 *
 * <p>從 application.yaml 中的 {@code prism.backend} 前綴載入配置：
 * <ul>
 *   <li>{@code baseUrl} - 後端基礎 URL（預設: https://api.anthropic.com）</li>
 *   <li>{@code anthropicVersion} - {@code anthropic-version} header（預設: 2023-06-01）</li>
 *   <li>{@code maxRetries} - 單一請求最多嘗試幾個帳號（預設: 5）</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * prism:
 *   backend:
 *     base-url: https://api.anthropic.com
 *     max-retries: 3
 * </pre>
 *
 * @param baseUrl 後端基礎 URL
 * @param anthropicVersion API 版本 header
 * @param maxRetries 最大嘗試次數
 * @see io.github.samzhu.prism.backend.RestClientBackendTransport
 */
@ConfigurationProperties(prefix = "prism.backend")
public record BackendProperties(
    String baseUrl,
    String anthropicVersion,
    Integer maxRetries
) {
    public BackendProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.anthropic.com";
        }
        if (anthropicVersion == null || anthropicVersion.isBlank()) {
            anthropicVersion = "2023-06-01";
        }
        if (maxRetries == null || maxRetries < 1) {
            maxRetries = 5;
        }
    }
}
