package io.github.samzhu.prism.pool;

import java.time.Duration;
import java.time.Instant;

/**
 * 後端帳號
 *
 * <p>由外部 OAuth 流程（或設定檔）建立，帳號池在每次選用與回報結果時更新其狀態，
 * 不會自動刪除。
 *
 * <p>狀態欄位：
 * <ul>
 *   <li>{@code healthScore} - 0 到上限之間的健康分數，成功加分、失敗扣分、隨時間被動回復</li>
 *   <li>{@code tokens} / {@code lastRefillAt} - token bucket，依經過時間被動補充</li>
 *   <li>{@code cooldownUntil} - 被限流後的冷卻截止時間</li>
 *   <li>{@code enabled} / {@code invalid} - 手動停用與憑證失效</li>
 * </ul>
 *
 * <p>執行緒安全：所有讀寫都在此物件的 monitor 內完成，不同帳號之間可並行操作。
 *
 * @see AccountPool
 */
public class AccountIdentity {

    private final String email;
    private final String subscriptionTier;
    private String accessToken;
    private double healthScore;
    private double tokens;
    private Instant lastRefillAt;
    private Instant scoreUpdatedAt;
    private Instant cooldownUntil;
    private boolean enabled;
    private boolean invalid;
    private String invalidReason;
    private Instant lastUsedAt;

    private AccountIdentity(AccountSnapshot snapshot) {
        this.email = snapshot.email();
        this.subscriptionTier = snapshot.subscriptionTier();
        this.accessToken = snapshot.accessToken();
        this.healthScore = snapshot.healthScore();
        this.tokens = snapshot.tokens();
        this.lastRefillAt = snapshot.lastRefillAt();
        this.scoreUpdatedAt = snapshot.scoreUpdatedAt();
        this.cooldownUntil = snapshot.cooldownUntil();
        this.enabled = snapshot.enabled();
        this.invalid = snapshot.invalid();
        this.invalidReason = snapshot.invalidReason();
        this.lastUsedAt = snapshot.lastUsedAt();
    }

    /**
     * 建立新帳號，分數與 token 使用初始值
     */
    public static AccountIdentity create(String email, String accessToken, String subscriptionTier,
                                         HealthScorePolicy scorePolicy, TokenBucketPolicy bucketPolicy,
                                         Instant now) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Account email cannot be blank");
        }
        return new AccountIdentity(new AccountSnapshot(
            email, accessToken, subscriptionTier,
            scorePolicy.initial(), bucketPolicy.initialTokens(), now, now,
            null, true, false, null, null));
    }

    public static AccountIdentity fromSnapshot(AccountSnapshot snapshot) {
        return new AccountIdentity(snapshot);
    }

    public String getEmail() {
        return email;
    }

    public String getSubscriptionTier() {
        return subscriptionTier;
    }

    public synchronized String getAccessToken() {
        return accessToken;
    }

    public synchronized double getHealthScore() {
        return healthScore;
    }

    public synchronized double getTokens() {
        return tokens;
    }

    public synchronized Instant getCooldownUntil() {
        return cooldownUntil;
    }

    public synchronized Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized boolean isInvalid() {
        return invalid;
    }

    /**
     * 是否可被選用：啟用、未失效且不在冷卻中
     */
    public synchronized boolean isSelectable(Instant now) {
        return enabled && !invalid && !isCoolingDown(now);
    }

    synchronized boolean isCoolingDown(Instant now) {
        return cooldownUntil != null && cooldownUntil.isAfter(now);
    }

    /**
     * 依經過時間補回健康分數與 token
     */
    synchronized void refresh(Instant now, HealthScorePolicy scorePolicy, TokenBucketPolicy bucketPolicy) {
        if (scoreUpdatedAt == null) {
            scoreUpdatedAt = now;
        } else if (now.isAfter(scoreUpdatedAt)) {
            double hours = Duration.between(scoreUpdatedAt, now).toMillis() / 3_600_000.0;
            healthScore = scorePolicy.clamp(healthScore + hours * scorePolicy.recoveryPerHour());
            scoreUpdatedAt = now;
        }

        if (lastRefillAt == null) {
            lastRefillAt = now;
        } else if (now.isAfter(lastRefillAt)) {
            double minutes = Duration.between(lastRefillAt, now).toMillis() / 60_000.0;
            tokens = Math.min(bucketPolicy.maxTokens(), tokens + minutes * bucketPolicy.tokensPerMinute());
            lastRefillAt = now;
        }
    }

    /**
     * 在分數足夠且有 token 時扣除一個 token
     *
     * @return 是否成功扣除
     */
    synchronized boolean tryConsumeToken(Instant now, int minUsable) {
        if (!isSelectable(now) || healthScore < minUsable || tokens < 1) {
            return false;
        }
        tokens -= 1;
        return true;
    }

    synchronized void markUsed(Instant now) {
        lastUsedAt = now;
    }

    synchronized void adjustScore(double delta, HealthScorePolicy scorePolicy) {
        healthScore = scorePolicy.clamp(healthScore + delta);
    }

    synchronized void coolDownUntil(Instant until) {
        if (cooldownUntil == null || until.isAfter(cooldownUntil)) {
            cooldownUntil = until;
        }
    }

    synchronized void clearCooldown() {
        cooldownUntil = null;
    }

    synchronized void markInvalid(String reason) {
        invalid = true;
        invalidReason = reason;
    }

    synchronized void revalidate() {
        invalid = false;
        invalidReason = null;
    }

    synchronized void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * 更新憑證並解除失效狀態
     */
    synchronized void updateAccessToken(String accessToken) {
        this.accessToken = accessToken;
        revalidate();
    }

    public synchronized AccountSnapshot snapshot() {
        return new AccountSnapshot(
            email, accessToken, subscriptionTier,
            healthScore, tokens, lastRefillAt, scoreUpdatedAt,
            cooldownUntil, enabled, invalid, invalidReason, lastUsedAt);
    }

    public synchronized AccountStatus status(Instant now) {
        boolean coolingDown = isCoolingDown(now);
        return new AccountStatus(
            email, subscriptionTier, healthScore, tokens,
            coolingDown ? cooldownUntil : null,
            enabled, invalid, invalidReason, lastUsedAt,
            enabled && !invalid && !coolingDown,
            coolingDown);
    }

    @Override
    public String toString() {
        return "AccountIdentity[" + email + "]";
    }
}
