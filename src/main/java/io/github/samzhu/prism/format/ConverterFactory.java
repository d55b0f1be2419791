package io.github.samzhu.prism.format;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.util.IdGenerator;

/**
 * 轉換器工廠
 *
 * <p>依客戶端協定提供請求、回應轉換器；串流轉譯器有狀態，每次呼叫建立新實例。
 */
public class ConverterFactory {

    private final Map<ClientDialect, RequestConverter> requestConverters = new EnumMap<>(ClientDialect.class);
    private final Map<ClientDialect, ResponseConverter> responseConverters = new EnumMap<>(ClientDialect.class);
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConverterFactory(List<RequestConverter> requestConverters,
                            List<ResponseConverter> responseConverters,
                            ObjectMapper objectMapper,
                            Clock clock) {
        requestConverters.forEach(converter -> this.requestConverters.put(converter.dialect(), converter));
        responseConverters.forEach(converter -> this.responseConverters.put(converter.dialect(), converter));
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public RequestConverter getRequestConverter(ClientDialect dialect) {
        RequestConverter converter = requestConverters.get(dialect);
        if (converter == null) {
            throw new IllegalStateException("No request converter found for dialect: " + dialect);
        }
        return converter;
    }

    public ResponseConverter getResponseConverter(ClientDialect dialect) {
        ResponseConverter converter = responseConverters.get(dialect);
        if (converter == null) {
            throw new IllegalStateException("No response converter found for dialect: " + dialect);
        }
        return converter;
    }

    /**
     * 建立新的串流轉譯器
     *
     * @param dialect 客戶端協定
     * @param requestedModel 客戶端原始指定的模型名稱，寫入每個 frame
     */
    public StreamTranscoder newStreamTranscoder(ClientDialect dialect, String requestedModel) {
        return switch (dialect) {
            case OPENAI -> new OpenAiStreamTranscoder(
                objectMapper,
                IdGenerator.withPrefix("chatcmpl-", 28),
                clock.instant().getEpochSecond(),
                requestedModel);
            case ANTHROPIC -> new AnthropicStreamTranscoder(objectMapper);
        };
    }
}
