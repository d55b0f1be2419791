package io.github.samzhu.prism.pool;

import java.time.Instant;
import java.util.List;

/**
 * 帳號選擇策略
 *
 * <p>帳號池先排除停用、失效、冷卻中與本次請求已嘗試過的帳號，再把剩下的候選帳號
 * （依加入順序排列）交給策略決定。
 *
 * @see RoundRobinStrategy
 * @see HybridStrategy
 */
public interface AccountSelectionStrategy {

    /**
     * 策略名稱，對應設定值 {@code prism.accounts.strategy}
     */
    String name();

    /**
     * 從候選帳號中選出一個
     *
     * @param candidates 非空的候選帳號
     * @param now 目前時間
     * @return 選中的帳號；沒有符合條件者時返回 null
     */
    AccountIdentity select(List<AccountIdentity> candidates, Instant now);
}
