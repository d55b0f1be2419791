package io.github.samzhu.prism.pool;

import java.util.List;

/**
 * 不落地的帳號儲存，用於未設定 {@code prism.accounts.store-file} 的情況
 */
public class InMemoryAccountStore implements AccountStore {

    private volatile List<AccountSnapshot> snapshots = List.of();

    @Override
    public List<AccountSnapshot> load() {
        return snapshots;
    }

    @Override
    public void save(List<AccountSnapshot> snapshots) {
        this.snapshots = List.copyOf(snapshots);
    }
}
