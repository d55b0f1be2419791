package io.github.samzhu.prism.apikey;

import java.time.Instant;
import java.util.List;

/**
 * 建立或更新 API Key 時可設定的欄位
 *
 * <p>更新時，值為 null 的欄位維持原設定。
 */
public record ApiKeySettings(
    String name,
    List<String> allowedModels,
    Integer rateLimitRpm,
    Integer rateLimitRph,
    List<String> ipWhitelist,
    Instant expiresAt,
    Boolean enabled,
    String notes
) {
    public static ApiKeySettings named(String name) {
        return new ApiKeySettings(name, null, null, null, null, null, null, null);
    }
}
