package io.github.samzhu.prism.pool;

/**
 * 健康分數參數
 *
 * @param initial 新帳號的初始分數
 * @param successReward 成功時加分
 * @param rateLimitPenalty 被限流時扣分（負值）
 * @param failurePenalty 失敗時扣分（負值）
 * @param recoveryPerHour 每小時被動回復分數
 * @param minUsable 可被 hybrid 策略選用的最低分數
 * @param maxScore 分數上限
 */
public record HealthScorePolicy(
    Integer initial,
    Integer successReward,
    Integer rateLimitPenalty,
    Integer failurePenalty,
    Double recoveryPerHour,
    Integer minUsable,
    Integer maxScore
) {
    public HealthScorePolicy {
        if (initial == null) {
            initial = 70;
        }
        if (successReward == null) {
            successReward = 1;
        }
        if (rateLimitPenalty == null) {
            rateLimitPenalty = -10;
        }
        if (failurePenalty == null) {
            failurePenalty = -20;
        }
        if (recoveryPerHour == null) {
            recoveryPerHour = 2.0;
        }
        if (minUsable == null) {
            minUsable = 50;
        }
        if (maxScore == null) {
            maxScore = 100;
        }
    }

    public static HealthScorePolicy defaults() {
        return new HealthScorePolicy(null, null, null, null, null, null, null);
    }

    double clamp(double score) {
        return Math.max(0, Math.min(maxScore, score));
    }
}
