package io.github.samzhu.prism.apikey;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 以記憶體保存的 API Key 儲存
 *
 * <p>以 id 為主索引，另維護 hash → id 的查詢索引。程序重啟後資料消失，
 * 啟動時由 {@code prism.api-keys.keys} 設定重新匯入。
 */
public class InMemoryApiKeyStore implements ApiKeyStore {

    private final Map<String, ApiKeyRecord> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByHash = new ConcurrentHashMap<>();

    @Override
    public Optional<ApiKeyRecord> findByHash(String keyHash) {
        if (keyHash == null) {
            return Optional.empty();
        }
        String id = idByHash.get(keyHash);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<ApiKeyRecord> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<ApiKeyRecord> findAll() {
        return byId.values().stream()
            .sorted(Comparator.comparing(ApiKeyRecord::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    @Override
    public synchronized ApiKeyRecord save(ApiKeyRecord record) {
        ApiKeyRecord previous = byId.put(record.id(), record);
        if (previous != null && !previous.keyHash().equals(record.keyHash())) {
            idByHash.remove(previous.keyHash());
        }
        idByHash.put(record.keyHash(), record.id());
        return record;
    }

    @Override
    public synchronized Optional<ApiKeyRecord> update(String id, UnaryOperator<ApiKeyRecord> change) {
        if (id == null) {
            return Optional.empty();
        }
        ApiKeyRecord previous = byId.get(id);
        ApiKeyRecord updated = byId.computeIfPresent(id, (k, current) -> change.apply(current));
        if (updated == null) {
            return Optional.empty();
        }
        if (previous != null && !previous.keyHash().equals(updated.keyHash())) {
            idByHash.remove(previous.keyHash());
        }
        idByHash.put(updated.keyHash(), id);
        return Optional.of(updated);
    }

    @Override
    public synchronized boolean delete(String id) {
        ApiKeyRecord removed = byId.remove(id);
        if (removed == null) {
            return false;
        }
        idByHash.remove(removed.keyHash());
        return true;
    }

    @Override
    public void recordUsage(String id, Instant usedAt) {
        byId.computeIfPresent(id, (k, record) -> record.withUsage(usedAt));
    }
}
