package io.github.samzhu.prism.backend;

import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.pool.AccountIdentity;

/**
 * 後端傳輸介面
 *
 * @see RestClientBackendTransport
 */
public interface BackendTransport {

    /**
     * 非串流呼叫
     *
     * @throws BackendException 後端回應錯誤或連線失敗
     */
    CanonicalResponse invoke(CanonicalRequest request, AccountIdentity identity);

    /**
     * 開啟串流呼叫；回應標頭為錯誤狀態時直接拋出，不會回傳串流
     *
     * @throws BackendException 後端回應錯誤或連線失敗
     */
    BackendEventStream openStream(CanonicalRequest request, AccountIdentity identity);
}
