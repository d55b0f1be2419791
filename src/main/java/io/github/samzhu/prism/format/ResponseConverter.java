package io.github.samzhu.prism.format;

import io.github.samzhu.prism.model.CanonicalResponse;

/**
 * 標準化回應 → 客戶端回應
 *
 * @see ConverterFactory
 */
public interface ResponseConverter {

    ClientDialect dialect();

    /**
     * 轉換回應
     *
     * @param response 後端回應
     * @param requestedModel 客戶端原始指定的模型名稱
     * @return 可由 Jackson 序列化的回應物件
     */
    Object convert(CanonicalResponse response, String requestedModel);
}
