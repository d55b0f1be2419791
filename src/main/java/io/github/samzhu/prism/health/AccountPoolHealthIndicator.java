package io.github.samzhu.prism.health;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.prism.pool.AccountPool;
import io.github.samzhu.prism.pool.AccountStatus;

/**
 * 後端帳號池健康指標
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 至少有一個帳號可被選用</li>
 *   <li>DOWN - 沒有帳號，或所有帳號都停用、失效或冷卻中</li>
 * </ul>
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例：
 * <pre>{@code
 * {
 *   "components": {
 *     "accountPool": {
 *       "status": "UP",
 *       "details": { "total": 3, "available": 2, "coolingDown": 1, "invalid": 0, "disabled": 0, "strategy": "round-robin" }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see AccountPool
 */
@Component
public class AccountPoolHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(AccountPoolHealthIndicator.class);

    private final AccountPool accountPool;

    public AccountPoolHealthIndicator(AccountPool accountPool) {
        this.accountPool = accountPool;
    }

    @Override
    public Health health() {
        List<AccountStatus> statuses = accountPool.statuses();
        long available = statuses.stream().filter(AccountStatus::available).count();
        long coolingDown = statuses.stream().filter(AccountStatus::coolingDown).count();
        long invalid = statuses.stream().filter(AccountStatus::invalid).count();
        long disabled = statuses.stream().filter(status -> !status.enabled()).count();

        Health.Builder builder = available > 0 ? Health.up() : Health.down();
        builder.withDetail("total", statuses.size())
            .withDetail("available", available)
            .withDetail("coolingDown", coolingDown)
            .withDetail("invalid", invalid)
            .withDetail("disabled", disabled)
            .withDetail("strategy", accountPool.strategyName());

        if (available == 0) {
            log.warn("Account pool health check failed: total={}, coolingDown={}, invalid={}, disabled={}",
                statuses.size(), coolingDown, invalid, disabled);
            builder.withDetail("message", statuses.isEmpty() ? "No accounts configured" : "No accounts available");
        } else {
            log.debug("Account pool health check passed: {} of {} account(s) available", available, statuses.size());
        }
        return builder.build();
    }
}
