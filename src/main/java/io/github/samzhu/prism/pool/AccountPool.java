package io.github.samzhu.prism.pool;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.prism.exception.NoAccountsAvailableException;

/**
 * 後端帳號池
 *
 * <p>負責選用帳號並追蹤其健康狀態：
 * <ul>
 *   <li>{@link #selectAccount} - 排除停用、失效、冷卻中與已嘗試過的帳號後，交由
 *       {@link AccountSelectionStrategy} 選出一個</li>
 *   <li>{@link #recordOutcome} - 依呼叫結果調整分數；被限流時進入冷卻</li>
 *   <li>{@link #markInvalid} - 後端拒絕憑證時標記失效，直到重新啟用</li>
 * </ul>
 *
 * <p>分數回復與 token 補充皆在讀取帳號時依經過時間計算，沒有背景計時器。
 *
 * <p>所有狀態變更都會以非同步方式寫入 {@link AccountStore}，連續的變更只排入一次寫入。
 *
 * @see RoundRobinStrategy
 * @see HybridStrategy
 */
public class AccountPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AccountPool.class);

    private final List<AccountIdentity> identities = new CopyOnWriteArrayList<>();
    private final AccountStore store;
    private final AccountSelectionStrategy strategy;
    private final HealthScorePolicy scorePolicy;
    private final TokenBucketPolicy bucketPolicy;
    private final Duration defaultCooldown;
    private final Clock clock;
    private final Executor persistenceExecutor;
    private final AtomicBoolean persistPending = new AtomicBoolean(false);

    public AccountPool(AccountStore store,
                       AccountSelectionStrategy strategy,
                       HealthScorePolicy scorePolicy,
                       TokenBucketPolicy bucketPolicy,
                       Duration defaultCooldown,
                       Clock clock,
                       Executor persistenceExecutor) {
        this.store = store;
        this.strategy = strategy;
        this.scorePolicy = scorePolicy;
        this.bucketPolicy = bucketPolicy;
        this.defaultCooldown = defaultCooldown;
        this.clock = clock;
        this.persistenceExecutor = persistenceExecutor;
    }

    /**
     * 從儲存載入帳號，已存在的 email 以儲存內容為準
     */
    public void load() throws IOException {
        List<AccountSnapshot> snapshots = store.load();
        for (AccountSnapshot snapshot : snapshots) {
            findIdentity(snapshot.email()).ifPresent(identities::remove);
            identities.add(AccountIdentity.fromSnapshot(snapshot));
        }
        log.info("Loaded {} account(s) from store, strategy={}", snapshots.size(), strategy.name());
    }

    /**
     * 選出一個可用帳號
     *
     * @param excludedEmails 本次請求已嘗試過的帳號
     * @return 選中的帳號
     * @throws NoAccountsAvailableException 沒有任何候選帳號
     */
    public AccountIdentity selectAccount(Set<String> excludedEmails) {
        Instant now = clock.instant();
        List<AccountIdentity> candidates = identities.stream()
            .filter(identity -> excludedEmails == null || !excludedEmails.contains(identity.getEmail()))
            .filter(identity -> identity.isSelectable(now))
            .toList();

        if (candidates.isEmpty()) {
            log.warn("No accounts available: total={}, excluded={}", identities.size(),
                excludedEmails == null ? 0 : excludedEmails.size());
            throw new NoAccountsAvailableException("No accounts available. All accounts are rate-limited, "
                + "disabled or invalid. Please retry later.");
        }

        AccountIdentity selected = strategy.select(candidates, now);
        if (selected == null) {
            log.warn("Strategy {} found no usable account among {} candidate(s)", strategy.name(), candidates.size());
            throw new NoAccountsAvailableException("No accounts available. All accounts are rate-limited, "
                + "disabled or invalid. Please retry later.");
        }

        selected.markUsed(now);
        log.debug("Selected account: email={}, strategy={}, candidates={}",
            selected.getEmail(), strategy.name(), candidates.size());
        schedulePersist();
        return selected;
    }

    public void recordOutcome(AccountIdentity identity, Outcome outcome) {
        recordOutcome(identity, outcome, null);
    }

    /**
     * 回報呼叫結果
     *
     * @param identity 帳號
     * @param outcome 結果
     * @param cooldownHint 後端建議的冷卻時間（可為 null，使用預設值）
     */
    public void recordOutcome(AccountIdentity identity, Outcome outcome, Duration cooldownHint) {
        Instant now = clock.instant();
        identity.refresh(now, scorePolicy, bucketPolicy);
        switch (outcome) {
            case SUCCESS -> identity.adjustScore(scorePolicy.successReward(), scorePolicy);
            case RATE_LIMITED -> {
                Duration cooldown = cooldownHint != null && !cooldownHint.isNegative() && !cooldownHint.isZero()
                    ? cooldownHint : defaultCooldown;
                identity.adjustScore(scorePolicy.rateLimitPenalty(), scorePolicy);
                identity.coolDownUntil(now.plus(cooldown));
                log.warn("Account rate limited: email={}, cooldown={}s, score={}",
                    identity.getEmail(), cooldown.toSeconds(), identity.getHealthScore());
            }
            case FAILURE -> {
                identity.adjustScore(scorePolicy.failurePenalty(), scorePolicy);
                log.warn("Account call failed: email={}, score={}", identity.getEmail(), identity.getHealthScore());
            }
        }
        schedulePersist();
    }

    /**
     * 標記帳號憑證失效，直到 {@link #revalidate} 或更新憑證為止不會再被選用
     */
    public void markInvalid(AccountIdentity identity, String reason) {
        identity.markInvalid(reason);
        log.warn("Account marked invalid: email={}, reason={}", identity.getEmail(), reason);
        schedulePersist();
    }

    /**
     * 加入帳號；email 已存在時更新憑證並解除失效
     */
    public AccountIdentity addAccount(String email, String accessToken, String subscriptionTier) {
        Optional<AccountIdentity> existing = findIdentity(email);
        if (existing.isPresent()) {
            existing.get().updateAccessToken(accessToken);
            log.info("Account credential updated: email={}", email);
            schedulePersist();
            return existing.get();
        }
        AccountIdentity identity = AccountIdentity.create(email, accessToken, subscriptionTier,
            scorePolicy, bucketPolicy, clock.instant());
        identities.add(identity);
        log.info("Account added: email={}, tier={}", email, subscriptionTier);
        schedulePersist();
        return identity;
    }

    public boolean removeAccount(String email) {
        Optional<AccountIdentity> existing = findIdentity(email);
        existing.ifPresent(identity -> {
            identities.remove(identity);
            log.info("Account removed: email={}", email);
            schedulePersist();
        });
        return existing.isPresent();
    }

    public boolean setEnabled(String email, boolean enabled) {
        return mutate(email, identity -> identity.setEnabled(enabled));
    }

    public boolean clearCooldown(String email) {
        return mutate(email, AccountIdentity::clearCooldown);
    }

    public boolean revalidate(String email) {
        return mutate(email, AccountIdentity::revalidate);
    }

    public Optional<AccountIdentity> findIdentity(String email) {
        return identities.stream()
            .filter(identity -> identity.getEmail().equalsIgnoreCase(email))
            .findFirst();
    }

    public List<AccountStatus> statuses() {
        Instant now = clock.instant();
        return identities.stream()
            .map(identity -> {
                identity.refresh(now, scorePolicy, bucketPolicy);
                return identity.status(now);
            })
            .toList();
    }

    public int availableCount() {
        Instant now = clock.instant();
        return (int) identities.stream().filter(identity -> identity.isSelectable(now)).count();
    }

    public int size() {
        return identities.size();
    }

    public String strategyName() {
        return strategy.name();
    }

    /**
     * 立即同步寫入目前狀態
     */
    public void flush() {
        persistNow();
    }

    @Override
    public void close() {
        flush();
        log.info("Account pool closed: accounts={}", identities.size());
    }

    private boolean mutate(String email, Consumer<AccountIdentity> change) {
        Optional<AccountIdentity> existing = findIdentity(email);
        existing.ifPresent(identity -> {
            change.accept(identity);
            schedulePersist();
        });
        return existing.isPresent();
    }

    private void schedulePersist() {
        if (!persistPending.compareAndSet(false, true)) {
            return;
        }
        try {
            persistenceExecutor.execute(() -> {
                persistPending.set(false);
                persistNow();
            });
        } catch (RejectedExecutionException e) {
            persistPending.set(false);
            log.warn("Account persistence rejected: {}", e.getMessage());
        }
    }

    private void persistNow() {
        List<AccountSnapshot> snapshots = identities.stream().map(AccountIdentity::snapshot).toList();
        try {
            store.save(snapshots);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to persist accounts: count={}, error={}", snapshots.size(), e.getMessage(), e);
        }
    }
}
