package io.github.samzhu.prism.pool;

import java.time.Instant;

/**
 * 帳號狀態（不含憑證），供健康檢查與日誌使用
 *
 * @param available 目前是否可被選用（啟用、未失效、不在冷卻中）
 * @param coolingDown 是否仍在冷卻中
 */
public record AccountStatus(
    String email,
    String subscriptionTier,
    double healthScore,
    double tokens,
    Instant cooldownUntil,
    boolean enabled,
    boolean invalid,
    String invalidReason,
    Instant lastUsedAt,
    boolean available,
    boolean coolingDown
) {
}
