package io.github.samzhu.prism.health;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import io.github.samzhu.prism.pool.AccountIdentity;
import io.github.samzhu.prism.pool.AccountPool;
import io.github.samzhu.prism.pool.HealthScorePolicy;
import io.github.samzhu.prism.pool.InMemoryAccountStore;
import io.github.samzhu.prism.pool.Outcome;
import io.github.samzhu.prism.pool.RoundRobinStrategy;
import io.github.samzhu.prism.pool.TokenBucketPolicy;
import io.github.samzhu.prism.support.MutableClock;

class AccountPoolHealthIndicatorTest {

    private AccountPool pool;
    private AccountPoolHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        pool = new AccountPool(new InMemoryAccountStore(), new RoundRobinStrategy(), HealthScorePolicy.defaults(),
            TokenBucketPolicy.defaults(), Duration.ofSeconds(10), MutableClock.atEpoch(), Runnable::run);
        indicator = new AccountPoolHealthIndicator(pool);
    }

    @Test
    void shouldBeDownWithoutAccounts() {
        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(0, health.getDetails().get("total"));
        assertEquals("No accounts configured", health.getDetails().get("message"));
    }

    @Test
    void shouldReportAccountStates() {
        pool.addAccount("a@example.com", "token-a", null);
        AccountIdentity b = pool.addAccount("b@example.com", "token-b", null);
        AccountIdentity c = pool.addAccount("c@example.com", "token-c", null);
        pool.addAccount("d@example.com", "token-d", null);
        pool.recordOutcome(b, Outcome.RATE_LIMITED);
        pool.markInvalid(c, "Backend returned HTTP 401");
        pool.setEnabled("d@example.com", false);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(4, health.getDetails().get("total"));
        assertEquals(1L, health.getDetails().get("available"));
        assertEquals(1L, health.getDetails().get("coolingDown"));
        assertEquals(1L, health.getDetails().get("invalid"));
        assertEquals(1L, health.getDetails().get("disabled"));
        assertEquals(RoundRobinStrategy.NAME, health.getDetails().get("strategy"));
    }

    @Test
    void shouldBeDownWhenEveryAccountIsCoolingDown() {
        AccountIdentity a = pool.addAccount("a@example.com", "token-a", null);
        pool.recordOutcome(a, Outcome.RATE_LIMITED);

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("No accounts available", health.getDetails().get("message"));
        assertEquals(1L, health.getDetails().get("coolingDown"));
    }
}
