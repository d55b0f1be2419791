package io.github.samzhu.prism.apikey;

import java.time.Instant;
import java.util.List;

/**
 * 客戶端 API Key 紀錄
 *
 * <p>明文 Key 只在建立或重新產生時回傳一次，紀錄中僅保存：
 * <ul>
 *   <li>{@code keyHash} - SHA-256 十六進位雜湊，唯一對應一筆紀錄</li>
 *   <li>{@code keyPrefix} - 顯示用遮罩字串，如 {@code sk-prism-a****9f3c}</li>
 * </ul>
 *
 * <p>限制設定：
 * <ul>
 *   <li>{@code allowedModels} - 模型萬用字元樣式，空清單代表不限制</li>
 *   <li>{@code rateLimitRpm} / {@code rateLimitRph} - 每分鐘 / 每小時請求上限，null 或 0 代表不限制</li>
 *   <li>{@code ipWhitelist} - IP 萬用字元樣式，空清單代表不限制</li>
 *   <li>{@code expiresAt} - 到期時間，null 代表永不過期</li>
 * </ul>
 *
 * @see ApiKeyService
 * @see ApiKeyValidator
 */
public record ApiKeyRecord(
    String id,
    String keyHash,
    String keyPrefix,
    String name,
    List<String> allowedModels,
    Integer rateLimitRpm,
    Integer rateLimitRph,
    List<String> ipWhitelist,
    Instant expiresAt,
    boolean enabled,
    Instant createdAt,
    Instant lastUsedAt,
    long requestCount,
    String notes
) {
    public ApiKeyRecord {
        allowedModels = allowedModels == null ? List.of() : List.copyOf(allowedModels);
        ipWhitelist = ipWhitelist == null ? List.of() : List.copyOf(ipWhitelist);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * 記錄一次使用，回傳新紀錄
     */
    public ApiKeyRecord withUsage(Instant usedAt) {
        return toBuilder()
            .lastUsedAt(usedAt)
            .requestCount(requestCount + 1)
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .keyHash(keyHash)
            .keyPrefix(keyPrefix)
            .name(name)
            .allowedModels(allowedModels)
            .rateLimitRpm(rateLimitRpm)
            .rateLimitRph(rateLimitRph)
            .ipWhitelist(ipWhitelist)
            .expiresAt(expiresAt)
            .enabled(enabled)
            .createdAt(createdAt)
            .lastUsedAt(lastUsedAt)
            .requestCount(requestCount)
            .notes(notes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String keyHash;
        private String keyPrefix;
        private String name;
        private List<String> allowedModels;
        private Integer rateLimitRpm;
        private Integer rateLimitRph;
        private List<String> ipWhitelist;
        private Instant expiresAt;
        private boolean enabled = true;
        private Instant createdAt;
        private Instant lastUsedAt;
        private long requestCount;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder keyHash(String keyHash) {
            this.keyHash = keyHash;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder allowedModels(List<String> allowedModels) {
            this.allowedModels = allowedModels;
            return this;
        }

        public Builder rateLimitRpm(Integer rateLimitRpm) {
            this.rateLimitRpm = rateLimitRpm;
            return this;
        }

        public Builder rateLimitRph(Integer rateLimitRph) {
            this.rateLimitRph = rateLimitRph;
            return this;
        }

        public Builder ipWhitelist(List<String> ipWhitelist) {
            this.ipWhitelist = ipWhitelist;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastUsedAt(Instant lastUsedAt) {
            this.lastUsedAt = lastUsedAt;
            return this;
        }

        public Builder requestCount(long requestCount) {
            this.requestCount = requestCount;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ApiKeyRecord build() {
            return new ApiKeyRecord(
                id, keyHash, keyPrefix, name,
                allowedModels, rateLimitRpm, rateLimitRph, ipWhitelist,
                expiresAt, enabled, createdAt, lastUsedAt, requestCount, notes
            );
        }
    }
}
