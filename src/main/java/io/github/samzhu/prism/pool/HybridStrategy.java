package io.github.samzhu.prism.pool;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 健康分數 + token bucket 混合策略
 *
 * <p>選擇流程：
 * <ol>
 *   <li>依經過時間補回每個候選帳號的分數與 token</li>
 *   <li>保留分數 ≥ {@code minUsable} 且至少有一個 token 的帳號</li>
 *   <li>分數最高者優先；同分時最久未使用者優先（從未使用者最先）</li>
 *   <li>扣除選中帳號的一個 token</li>
 * </ol>
 *
 * <p>扣除 token 時會在帳號的 monitor 內重新檢查，若已被其他請求搶先用完則改選下一位。
 */
public class HybridStrategy implements AccountSelectionStrategy {

    public static final String NAME = "hybrid";

    private static final Comparator<Ranked> PREFERENCE = Comparator
        .comparingDouble(Ranked::score).reversed()
        .thenComparing(Ranked::lastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final HealthScorePolicy scorePolicy;
    private final TokenBucketPolicy bucketPolicy;

    public HybridStrategy(HealthScorePolicy scorePolicy, TokenBucketPolicy bucketPolicy) {
        this.scorePolicy = scorePolicy;
        this.bucketPolicy = bucketPolicy;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AccountIdentity select(List<AccountIdentity> candidates, Instant now) {
        List<Ranked> eligible = new ArrayList<>();
        for (AccountIdentity candidate : candidates) {
            candidate.refresh(now, scorePolicy, bucketPolicy);
            AccountStatus status = candidate.status(now);
            if (status.healthScore() >= scorePolicy.minUsable() && status.tokens() >= 1) {
                eligible.add(new Ranked(candidate, status.healthScore(), status.lastUsedAt()));
            }
        }
        eligible.sort(PREFERENCE);

        for (Ranked ranked : eligible) {
            if (ranked.identity().tryConsumeToken(now, scorePolicy.minUsable())) {
                return ranked.identity();
            }
        }
        return null;
    }

    private record Ranked(AccountIdentity identity, double score, Instant lastUsedAt) {}
}
