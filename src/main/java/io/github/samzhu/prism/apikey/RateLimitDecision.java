package io.github.samzhu.prism.apikey;

/**
 * 限流判斷結果
 *
 * @param allowed 是否允許
 * @param period 超限的窗口（{@code minute} / {@code hour}），允許時為 null
 * @param current 窗口內目前的請求數
 * @param limit 窗口上限
 * @param retryAfterSeconds 建議重試秒數，允許時為 0
 */
public record RateLimitDecision(
    boolean allowed,
    String period,
    int current,
    int limit,
    long retryAfterSeconds
) {
    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null, 0, 0, 0);

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision reject(String period, int current, int limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, period, current, limit, retryAfterSeconds);
    }

    /**
     * 回傳給客戶端的錯誤訊息，如 {@code Rate limit exceeded: 3/3 requests per minute}
     */
    public String message() {
        if (allowed) {
            return null;
        }
        return "Rate limit exceeded: " + current + "/" + limit + " requests per " + period;
    }
}
