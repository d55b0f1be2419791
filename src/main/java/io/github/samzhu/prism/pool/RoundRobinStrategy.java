package io.github.samzhu.prism.pool;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round Robin（循環輪換）策略
 *
 * <p>以共用的原子游標在候選清單上循環；候選清單改變時游標不重置，只取餘數。
 *
 * <p>執行緒安全：使用 {@link AtomicInteger} 確保並發存取時的正確性。
 */
public class RoundRobinStrategy implements AccountSelectionStrategy {

    public static final String NAME = "round-robin";

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AccountIdentity select(List<AccountIdentity> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return null;
        }
        int index = Math.abs(counter.getAndIncrement() % candidates.size());
        return candidates.get(index);
    }
}
