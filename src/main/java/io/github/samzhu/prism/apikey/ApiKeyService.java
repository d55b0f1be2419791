package io.github.samzhu.prism.apikey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.prism.util.IdGenerator;

/**
 * API Key 管理服務
 *
 * <p>提供 Key 的建立、查詢、更新、刪除與重新產生。明文格式為
 * {@code sk-prism-} 加上 32 位十六進位字元，儲存時只保留 SHA-256 雜湊與遮罩前綴。
 *
 * <p>使用紀錄（{@link #recordUsage}）在背景執行，不阻塞請求。
 *
 * @see ApiKeyStore
 * @see ApiKeyValidator
 */
public class ApiKeyService {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

    public static final String KEY_PREFIX = "sk-prism-";
    private static final int KEY_RANDOM_LENGTH = 32;

    private final ApiKeyStore store;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Executor usageExecutor;
    private final Clock clock;

    public ApiKeyService(ApiKeyStore store, SlidingWindowRateLimiter rateLimiter, Executor usageExecutor, Clock clock) {
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.usageExecutor = usageExecutor;
        this.clock = clock;
    }

    /**
     * 建立新的 API Key
     *
     * @param settings Key 設定，{@code name} 必填
     * @return 紀錄與明文（明文之後無法再取得）
     */
    public IssuedApiKey create(ApiKeySettings settings) {
        if (settings == null || settings.name() == null || settings.name().isBlank()) {
            throw new IllegalArgumentException("API key name cannot be blank");
        }
        return register(generateKey(), settings);
    }

    /**
     * 匯入既有的明文 Key（用於設定檔預先配置）
     *
     * <p>相同雜湊已存在時不重複建立。
     */
    public ApiKeyRecord importKey(String plaintext, ApiKeySettings settings) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("API key value cannot be blank");
        }
        Optional<ApiKeyRecord> existing = store.findByHash(hash(plaintext));
        if (existing.isPresent()) {
            return existing.get();
        }
        return register(plaintext, settings).record();
    }

    public List<ApiKeyRecord> list() {
        return store.findAll();
    }

    public Optional<ApiKeyRecord> get(String id) {
        return store.findById(id);
    }

    /**
     * 更新 Key 設定；null 欄位維持原值
     */
    public Optional<ApiKeyRecord> update(String id, ApiKeySettings settings) {
        Optional<ApiKeyRecord> updated = store.update(id, current -> {
            ApiKeyRecord.Builder builder = current.toBuilder();
            if (settings.name() != null) {
                builder.name(settings.name());
            }
            if (settings.allowedModels() != null) {
                builder.allowedModels(settings.allowedModels());
            }
            if (settings.rateLimitRpm() != null) {
                builder.rateLimitRpm(settings.rateLimitRpm());
            }
            if (settings.rateLimitRph() != null) {
                builder.rateLimitRph(settings.rateLimitRph());
            }
            if (settings.ipWhitelist() != null) {
                builder.ipWhitelist(settings.ipWhitelist());
            }
            if (settings.expiresAt() != null) {
                builder.expiresAt(settings.expiresAt());
            }
            if (settings.enabled() != null) {
                builder.enabled(settings.enabled());
            }
            if (settings.notes() != null) {
                builder.notes(settings.notes());
            }
            return builder.build();
        });
        updated.ifPresent(record -> log.info("API key updated: id={}, name={}", record.id(), record.name()));
        return updated;
    }

    public boolean delete(String id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            rateLimiter.reset(id);
            log.info("API key deleted: id={}", id);
        }
        return deleted;
    }

    /**
     * 重新產生明文 Key，保留所有設定，重置使用次數與最後使用時間
     */
    public Optional<IssuedApiKey> regenerate(String id) {
        String plaintext = generateKey();
        return store.update(id, current -> current.toBuilder()
                .keyHash(hash(plaintext))
                .keyPrefix(maskKey(plaintext))
                .lastUsedAt(null)
                .requestCount(0)
                .build())
            .map(regenerated -> {
                rateLimiter.reset(id);
                log.info("API key regenerated: id={}", id);
                return new IssuedApiKey(regenerated, plaintext);
            });
    }

    /**
     * 非同步記錄使用，失敗只記錄日誌
     */
    public void recordUsage(String id) {
        var usedAt = clock.instant();
        try {
            usageExecutor.execute(() -> {
                try {
                    store.recordUsage(id, usedAt);
                } catch (RuntimeException e) {
                    log.warn("Failed to record API key usage: id={}, error={}", id, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("API key usage recording rejected: id={}", id);
        }
    }

    public boolean hasApiKeys() {
        return !store.isEmpty();
    }

    /**
     * 計算 Key 的 SHA-256 十六進位雜湊
     */
    public static String hash(String plaintext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 日誌用指紋：雜湊的前 8 個十六進位字元，不含任何明文
     */
    public static String fingerprint(String plaintext) {
        return hash(plaintext).substring(0, 8);
    }

    /**
     * 顯示用遮罩：前 10 碼 + {@code ****} + 後 4 碼
     */
    public static String maskKey(String plaintext) {
        if (plaintext == null || plaintext.length() <= 14) {
            return "****";
        }
        return plaintext.substring(0, 10) + "****" + plaintext.substring(plaintext.length() - 4);
    }

    private static String generateKey() {
        return KEY_PREFIX + IdGenerator.secureHex(KEY_RANDOM_LENGTH);
    }

    private IssuedApiKey register(String plaintext, ApiKeySettings settings) {
        ApiKeyRecord record = ApiKeyRecord.builder()
            .id(UUID.randomUUID().toString())
            .keyHash(hash(plaintext))
            .keyPrefix(maskKey(plaintext))
            .name(settings.name())
            .allowedModels(settings.allowedModels())
            .rateLimitRpm(settings.rateLimitRpm())
            .rateLimitRph(settings.rateLimitRph())
            .ipWhitelist(settings.ipWhitelist())
            .expiresAt(settings.expiresAt())
            .enabled(settings.enabled() == null || settings.enabled())
            .createdAt(clock.instant())
            .notes(settings.notes())
            .build();
        store.save(record);
        log.info("API key created: id={}, name={}", record.id(), record.name());
        return new IssuedApiKey(record, plaintext);
    }
}
