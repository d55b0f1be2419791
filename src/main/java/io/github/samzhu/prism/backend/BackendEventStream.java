package io.github.samzhu.prism.backend;

import java.util.Iterator;

import io.github.samzhu.prism.model.BackendEvent;

/**
 * 以拉取方式讀取的後端事件串流
 *
 * <p>{@link #hasNext()} 與 {@link #next()} 在讀取失敗時拋出 {@link BackendException}。
 * 無論是否讀完都必須呼叫 {@link #close()} 釋放連線。
 */
public interface BackendEventStream extends Iterator<BackendEvent>, AutoCloseable {

    @Override
    void close();
}
