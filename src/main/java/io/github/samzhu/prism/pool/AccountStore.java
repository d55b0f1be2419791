package io.github.samzhu.prism.pool;

import java.io.IOException;
import java.util.List;

/**
 * 帳號持久化介面
 *
 * <p>帳號池以非同步方式寫入，儲存內容與記憶體狀態之間為最終一致。
 *
 * @see JsonFileAccountStore
 * @see InMemoryAccountStore
 */
public interface AccountStore {

    List<AccountSnapshot> load() throws IOException;

    void save(List<AccountSnapshot> snapshots) throws IOException;
}
