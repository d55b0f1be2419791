package io.github.samzhu.prism.apikey;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基於記憶體的滑動窗口限流器
 *
 * <p>每個 API Key 維護兩條時間戳佇列（1 分鐘、1 小時），判斷時先清除窗口外的紀錄再計數：
 * <ul>
 *   <li>先檢查每分鐘上限，再檢查每小時上限</li>
 *   <li>上限為 null 或 0 代表不限制</li>
 *   <li>超限時 {@code retryAfter = max(1, ceil((最舊時間戳 + 窗口長度 - now) / 1 秒))}</li>
 * </ul>
 *
 * <p>{@link #check} 不會佔用額度；{@link #record} 佔用一個額度；{@link #acquire} 在同一把鎖內
 * 完成判斷與佔用，避免併發請求同時通過判斷。
 *
 * <p>閒置的窗口由 {@link RateLimitWindowJanitor} 定期呼叫 {@link #purgeIdle()} 移除。
 *
 * @see ApiKeyValidator
 */
public class SlidingWindowRateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    static final long MINUTE_MS = Duration.ofMinutes(1).toMillis();
    static final long HOUR_MS = Duration.ofHours(1).toMillis();

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * 判斷是否仍有額度，不佔用額度
     */
    public RateLimitDecision check(String keyId, Integer rpm, Integer rph) {
        Window window = windows.get(keyId);
        if (window == null) {
            return RateLimitDecision.allow();
        }
        return window.evaluate(clock.millis(), rpm, rph);
    }

    /**
     * 佔用一個額度
     */
    public void record(String keyId) {
        long now = clock.millis();
        windows.compute(keyId, (id, window) -> {
            Window target = window != null ? window : new Window();
            target.add(now);
            return target;
        });
    }

    /**
     * 判斷並佔用額度；被拒絕時不佔用
     */
    public RateLimitDecision acquire(String keyId, Integer rpm, Integer rph) {
        long now = clock.millis();
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.compute(keyId, (id, window) -> {
            Window target = window != null ? window : new Window();
            decision[0] = target.evaluate(now, rpm, rph);
            if (decision[0].allowed()) {
                target.add(now);
            }
            return target;
        });
        return decision[0];
    }

    public RateLimitStatus status(String keyId, Integer rpm, Integer rph) {
        Window window = windows.get(keyId);
        if (window == null) {
            return new RateLimitStatus(RateLimitStatus.Window.of(0, rpm), RateLimitStatus.Window.of(0, rph));
        }
        int[] counts = window.counts(clock.millis());
        return new RateLimitStatus(RateLimitStatus.Window.of(counts[0], rpm), RateLimitStatus.Window.of(counts[1], rph));
    }

    public void reset(String keyId) {
        windows.remove(keyId);
    }

    /**
     * 移除一小時內沒有任何請求的窗口
     *
     * @return 移除的窗口數量
     */
    public int purgeIdle() {
        long now = clock.millis();
        int[] purged = {0};
        for (String keyId : windows.keySet()) {
            windows.computeIfPresent(keyId, (id, window) -> {
                if (window.isIdle(now)) {
                    purged[0]++;
                    return null;
                }
                return window;
            });
        }
        if (purged[0] > 0) {
            log.debug("Purged {} idle rate limit window(s), {} remaining", purged[0], windows.size());
        }
        return purged[0];
    }

    public int trackedKeys() {
        return windows.size();
    }

    @Override
    public void close() {
        windows.clear();
    }

    /**
     * 單一 Key 的時間戳佇列；每分鐘佇列中的時間戳必定也在每小時佇列中
     */
    private static final class Window {

        private final Deque<Long> minute = new ArrayDeque<>();
        private final Deque<Long> hour = new ArrayDeque<>();

        synchronized void add(long now) {
            prune(now);
            minute.addLast(now);
            hour.addLast(now);
        }

        synchronized RateLimitDecision evaluate(long now, Integer rpm, Integer rph) {
            prune(now);
            if (isLimited(rpm) && minute.size() >= rpm) {
                return RateLimitDecision.reject("minute", minute.size(), rpm, retryAfter(minute, MINUTE_MS, now));
            }
            if (isLimited(rph) && hour.size() >= rph) {
                return RateLimitDecision.reject("hour", hour.size(), rph, retryAfter(hour, HOUR_MS, now));
            }
            return RateLimitDecision.allow();
        }

        synchronized int[] counts(long now) {
            prune(now);
            return new int[] {minute.size(), hour.size()};
        }

        synchronized boolean isIdle(long now) {
            prune(now);
            return hour.isEmpty();
        }

        private void prune(long now) {
            evictOlderThan(minute, now - MINUTE_MS);
            evictOlderThan(hour, now - HOUR_MS);
        }

        private static void evictOlderThan(Deque<Long> timestamps, long threshold) {
            // 窗口內的定義為 ts > now - window
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= threshold) {
                timestamps.pollFirst();
            }
        }

        private static boolean isLimited(Integer limit) {
            return limit != null && limit > 0;
        }

        private static long retryAfter(Deque<Long> timestamps, long windowMs, long now) {
            long oldest = timestamps.peekFirst();
            long waitMs = oldest + windowMs - now;
            return Math.max(1, (waitMs + 999) / 1000);
        }
    }
}
