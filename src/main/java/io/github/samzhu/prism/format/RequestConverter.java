package io.github.samzhu.prism.format;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.prism.model.CanonicalRequest;

/**
 * 客戶端請求 → 標準化請求
 *
 * @see ConverterFactory
 */
public interface RequestConverter {

    ClientDialect dialect();

    /**
     * 轉換請求
     *
     * @param body 客戶端請求 JSON
     * @return 標準化請求，模型名稱已解析
     * @throws io.github.samzhu.prism.exception.InvalidRequestException 請求格式錯誤
     */
    CanonicalRequest convert(JsonNode body);
}
