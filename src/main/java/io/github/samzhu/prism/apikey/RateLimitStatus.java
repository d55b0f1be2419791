package io.github.samzhu.prism.apikey;

/**
 * 單一 API Key 目前的限流狀態
 *
 * <p>{@code limit} 為 null 代表不限制，此時 {@code remaining} 亦為 null。
 */
public record RateLimitStatus(
    Window minute,
    Window hour
) {
    public record Window(
        int used,
        Integer limit,
        Integer remaining
    ) {
        static Window of(int used, Integer limit) {
            if (limit == null || limit <= 0) {
                return new Window(used, null, null);
            }
            return new Window(used, limit, Math.max(0, limit - used));
        }
    }
}
