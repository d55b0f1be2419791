package io.github.samzhu.prism.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

class HybridStrategyTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final HealthScorePolicy scorePolicy = HealthScorePolicy.defaults();
    private final TokenBucketPolicy bucketPolicy = TokenBucketPolicy.defaults();
    private final HybridStrategy strategy = new HybridStrategy(scorePolicy, bucketPolicy);

    private AccountIdentity account(String email) {
        return AccountIdentity.create(email, "token", null, scorePolicy, bucketPolicy, NOW);
    }

    @Test
    void shouldPickHighestScore() {
        AccountIdentity a = account("a@example.com");
        AccountIdentity b = account("b@example.com");
        b.adjustScore(5, scorePolicy);

        assertSame(b, strategy.select(List.of(a, b), NOW));
    }

    @Test
    void shouldPreferNeverUsedThenLeastRecentlyUsedOnTie() {
        AccountIdentity a = account("a@example.com");
        AccountIdentity b = account("b@example.com");
        AccountIdentity c = account("c@example.com");
        a.markUsed(NOW.minusSeconds(10));
        b.markUsed(NOW.minusSeconds(60));

        assertSame(c, strategy.select(List.of(a, b, c), NOW));
        c.markUsed(NOW);
        assertSame(b, strategy.select(List.of(a, b, c), NOW));
    }

    @Test
    void shouldSkipAccountsBelowMinimumScore() {
        AccountIdentity a = account("a@example.com");
        a.adjustScore(-21, scorePolicy);

        assertNull(strategy.select(List.of(a), NOW));
    }

    @Test
    void shouldConsumeTokensAndRefillOverTime() {
        TokenBucketPolicy small = new TokenBucketPolicy(2, 6.0, 1);
        HybridStrategy limited = new HybridStrategy(scorePolicy, small);
        AccountIdentity a = AccountIdentity.create("a@example.com", "token", null, scorePolicy, small, NOW);

        assertSame(a, limited.select(List.of(a), NOW));
        assertNull(limited.select(List.of(a), NOW));

        Instant later = NOW.plus(Duration.ofSeconds(30));
        assertSame(a, limited.select(List.of(a), later));
        assertEquals(1.0, a.getTokens(), 0.001);
    }
}
