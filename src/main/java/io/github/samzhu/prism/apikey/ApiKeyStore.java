package io.github.samzhu.prism.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * API Key 儲存介面
 *
 * @see InMemoryApiKeyStore
 */
public interface ApiKeyStore {

    Optional<ApiKeyRecord> findByHash(String keyHash);

    Optional<ApiKeyRecord> findById(String id);

    List<ApiKeyRecord> findAll();

    /**
     * 新增或覆寫（以 id 為準）；雜湊變更時舊雜湊不再可查
     */
    ApiKeyRecord save(ApiKeyRecord record);

    /**
     * 以目前紀錄為基礎原子地更新，與 {@link #recordUsage} 互斥，不會遺失使用次數
     *
     * @return 更新後的紀錄；id 不存在時為空
     */
    Optional<ApiKeyRecord> update(String id, UnaryOperator<ApiKeyRecord> change);

    boolean delete(String id);

    /**
     * 累加使用次數並更新最後使用時間
     */
    void recordUsage(String id, Instant usedAt);

    default boolean isEmpty() {
        return findAll().isEmpty();
    }
}
