package io.github.samzhu.prism.pool;

import java.time.Instant;

/**
 * 帳號的持久化形式
 *
 * @see AccountStore
 */
public record AccountSnapshot(
    String email,
    String accessToken,
    String subscriptionTier,
    double healthScore,
    double tokens,
    Instant lastRefillAt,
    Instant scoreUpdatedAt,
    Instant cooldownUntil,
    boolean enabled,
    boolean invalid,
    String invalidReason,
    Instant lastUsedAt
) {
    @Override
    public String toString() {
        return "AccountSnapshot[email=" + email + ", tier=" + subscriptionTier
            + ", score=" + healthScore + ", enabled=" + enabled + ", invalid=" + invalid + "]";
    }
}
