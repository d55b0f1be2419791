package io.github.samzhu.prism.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.prism.pool.HealthScorePolicy;
import io.github.samzhu.prism.pool.RoundRobinStrategy;
import io.github.samzhu.prism.pool.TokenBucketPolicy;

/**
 * 帳號池配置屬性
 *
 * <p>從 application.yaml 中的 {@code prism.accounts} 前綴載入配置：
 * <ul>
 *   <li>{@code storeFile} - 帳號 JSON 檔案路徑；未設定時僅存於記憶體</li>
 *   <li>{@code strategy} - 選擇策略：{@code round-robin}（預設）或 {@code hybrid}</li>
 *   <li>{@code defaultCooldown} - 後端 429 未提供 Retry-After 時的冷卻時間（預設: 10s）</li>
 *   <li>{@code healthScore} / {@code tokenBucket} - hybrid 策略參數</li>
 *   <li>{@code seed} - 啟動時加入的帳號</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * prism:
 *   accounts:
 *     store-file: ./data/accounts.json
 *     strategy: hybrid
 *     seed:
 *       - email: ops@example.com
 *         access-token: ${BACKEND_TOKEN}
 *         subscription-tier: pro
 * </pre>
 *
 * @see io.github.samzhu.prism.pool.AccountPool
 */
@ConfigurationProperties(prefix = "prism.accounts")
public record AccountProperties(
    String storeFile,
    String strategy,
    Duration defaultCooldown,
    HealthScorePolicy healthScore,
    TokenBucketPolicy tokenBucket,
    List<Seed> seed
) {
    public AccountProperties {
        if (strategy == null || strategy.isBlank()) {
            strategy = RoundRobinStrategy.NAME;
        }
        if (defaultCooldown == null || defaultCooldown.isNegative() || defaultCooldown.isZero()) {
            defaultCooldown = Duration.ofSeconds(10);
        }
        if (healthScore == null) {
            healthScore = HealthScorePolicy.defaults();
        }
        if (tokenBucket == null) {
            tokenBucket = TokenBucketPolicy.defaults();
        }
        if (seed == null) {
            seed = List.of();
        }
    }

    /**
     * 啟動時載入的帳號
     *
     * @param email 帳號識別
     * @param accessToken 後端憑證（必填）
     * @param subscriptionTier 訂閱等級（可為 null）
     */
    public record Seed(
        String email,
        String accessToken,
        String subscriptionTier
    ) {
        public Seed {
            if (email == null || email.isBlank()) {
                throw new IllegalArgumentException("Account email cannot be blank");
            }
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("Account access token cannot be blank");
            }
        }
    }
}
