package io.github.samzhu.prism.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.prism.exception.NoAccountsAvailableException;
import io.github.samzhu.prism.support.MutableClock;

class AccountPoolTest {

    private MutableClock clock;
    private InMemoryAccountStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        store = new InMemoryAccountStore();
    }

    private AccountPool newPool(AccountSelectionStrategy strategy) {
        return new AccountPool(store, strategy, HealthScorePolicy.defaults(), TokenBucketPolicy.defaults(),
            Duration.ofSeconds(10), clock, Runnable::run);
    }

    @Test
    void shouldRotateRoundRobin() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        pool.addAccount("a@example.com", "token-a", "pro");
        pool.addAccount("b@example.com", "token-b", "pro");
        pool.addAccount("c@example.com", "token-c", "pro");

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            picks.add(pool.selectAccount(Set.of()).getEmail());
        }

        assertEquals(List.of("a@example.com", "b@example.com", "c@example.com", "a@example.com", "b@example.com"),
            picks);
    }

    @Test
    void shouldSkipExcludedAccounts() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        pool.addAccount("a@example.com", "token-a", null);
        pool.addAccount("b@example.com", "token-b", null);

        for (int i = 0; i < 3; i++) {
            assertEquals("b@example.com", pool.selectAccount(Set.of("a@example.com")).getEmail());
        }
    }

    @Test
    void shouldFailWhenEveryAccountIsExcluded() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        pool.addAccount("a@example.com", "token-a", null);

        NoAccountsAvailableException e = assertThrows(NoAccountsAvailableException.class,
            () -> pool.selectAccount(Set.of("a@example.com")));

        assertEquals(503, e.getStatus());
        assertEquals("overloaded_error", e.getErrorType());
    }

    @Test
    void shouldExcludeCoolingAccountEvenWithBestScore() {
        AccountPool pool = newPool(new HybridStrategy(HealthScorePolicy.defaults(), TokenBucketPolicy.defaults()));
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);
        AccountIdentity b = pool.addAccount("b@example.com", "token-b", null);
        pool.recordOutcome(b, Outcome.FAILURE);
        pool.recordOutcome(a, Outcome.RATE_LIMITED);
        assertTrue(a.getHealthScore() > b.getHealthScore());

        assertEquals("b@example.com", pool.selectAccount(Set.of()).getEmail());

        clock.advanceSeconds(10);
        assertEquals("a@example.com", pool.selectAccount(Set.of()).getEmail());
    }

    @Test
    void shouldUseCooldownHintWhenGiven() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);

        pool.recordOutcome(a, Outcome.RATE_LIMITED, Duration.ofSeconds(30));
        clock.advanceSeconds(29);
        assertEquals(0, pool.availableCount());

        clock.advanceSeconds(1);
        assertEquals(1, pool.availableCount());
    }

    @Test
    void shouldAdjustScoreByOutcome() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);

        pool.recordOutcome(a, Outcome.SUCCESS);
        assertEquals(71.0, a.getHealthScore(), 0.001);
        pool.recordOutcome(a, Outcome.FAILURE);
        assertEquals(51.0, a.getHealthScore(), 0.001);
        assertTrue(a.isSelectable(clock.instant()));
    }

    @Test
    void shouldRecoverScoreLazily() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);
        pool.recordOutcome(a, Outcome.FAILURE);

        clock.advance(Duration.ofHours(5));

        assertEquals(60.0, pool.statuses().get(0).healthScore(), 0.001);
    }

    @Test
    void shouldKeepInvalidAccountOutUntilRevalidated() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);

        pool.markInvalid(a, "Backend returned HTTP 401");
        assertThrows(NoAccountsAvailableException.class, () -> pool.selectAccount(Set.of()));
        assertEquals("Backend returned HTTP 401", pool.statuses().get(0).invalidReason());

        assertTrue(pool.revalidate("A@example.com"));
        assertEquals("a@example.com", pool.selectAccount(Set.of()).getEmail());
    }

    @Test
    void shouldRevalidateWhenCredentialIsReplaced() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);
        pool.markInvalid(a, "expired");

        AccountIdentity updated = pool.addAccount("a@example.com", "token-new", null);

        assertEquals(1, pool.size());
        assertEquals("token-new", updated.getAccessToken());
        assertFalse(updated.isInvalid());
    }

    @Test
    void shouldHonourManagementOperations() {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);
        pool.addAccount("b@example.com", "token-b", null);

        pool.setEnabled("b@example.com", false);
        pool.recordOutcome(a, Outcome.RATE_LIMITED);
        assertEquals(0, pool.availableCount());

        pool.clearCooldown("a@example.com");
        assertEquals(1, pool.availableCount());

        assertTrue(pool.removeAccount("b@example.com"));
        assertFalse(pool.removeAccount("b@example.com"));
        assertEquals(1, pool.size());
    }

    @Test
    void shouldPersistMutationsAndReload() throws IOException {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", "pro");
        pool.recordOutcome(a, Outcome.RATE_LIMITED);
        pool.close();

        AccountPool reloaded = newPool(new RoundRobinStrategy());
        reloaded.load();

        assertEquals(1, reloaded.size());
        AccountStatus status = reloaded.statuses().get(0);
        assertEquals("pro", status.subscriptionTier());
        assertTrue(status.coolingDown());
        assertEquals(60.0, status.healthScore(), 0.001);
    }

    @Test
    void shouldNotLoseConcurrentScoreUpdates() throws Exception {
        AccountPool pool = newPool(new RoundRobinStrategy());
        AccountIdentity identity = pool.addAccount("a@example.com", "token-a", null);
        double initial = identity.getHealthScore();
        int successes = 25;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < successes; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    pool.recordOutcome(identity, Outcome.SUCCESS);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(Math.min(100.0, initial + successes), identity.getHealthScore(), 0.0001);
    }
}
