package io.github.samzhu.prism.backend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.config.BackendProperties;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.pool.AccountIdentity;
import io.github.samzhu.prism.util.SseParser;

/**
 * 以 {@link RestClient} 呼叫後端 {@code POST /v1/messages}
 *
 * <p>每次呼叫使用選中帳號的憑證（{@code Authorization: Bearer}），並帶上 {@code anthropic-version}。
 * 非 2xx 回應讀取錯誤內容的 {@code error.type} / {@code error.message} 與 {@code Retry-After}，
 * 轉為 {@link BackendException}。
 *
 * <p>使用 Spring 自動配置的 {@code RestClient.Builder}，Trace Context 會自動傳播到後端並建立子 Span。
 *
 * @see MessagesPayloadMapper
 * @see SseEventStream
 */
public class RestClientBackendTransport implements BackendTransport {

    private static final Logger log = LoggerFactory.getLogger(RestClientBackendTransport.class);

    private static final String MESSAGES_PATH = "/v1/messages";

    private final RestClient restClient;
    private final BackendProperties properties;
    private final ObjectMapper objectMapper;
    private final MessagesPayloadMapper payloadMapper;
    private final SseParser sseParser;

    public RestClientBackendTransport(RestClient.Builder restClientBuilder,
                                      BackendProperties properties,
                                      ObjectMapper objectMapper,
                                      SseParser sseParser) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.payloadMapper = new MessagesPayloadMapper(objectMapper);
        this.sseParser = sseParser;
        this.restClient = restClientBuilder
            .baseUrl(properties.baseUrl())
            .build();
    }

    @Override
    public CanonicalResponse invoke(CanonicalRequest request, AccountIdentity identity) {
        String body = serialize(request, false);
        try {
            // exchange() 會自動傳播 Trace Context 並建立子 Span
            return requestSpec(identity, MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((req, response) -> {
                    HttpStatusCode statusCode = response.getStatusCode();
                    if (!statusCode.is2xxSuccessful()) {
                        throw toBackendException(response, identity);
                    }
                    try (InputStream in = response.getBody()) {
                        JsonNode json = objectMapper.readTree(in);
                        return payloadMapper.read(json);
                    }
                });
        } catch (BackendException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Backend call failed: account={}, error={}", identity.getEmail(), e.getMessage());
            throw BackendException.ioFailure("Backend request failed: " + rootMessage(e), e);
        }
    }

    @Override
    public BackendEventStream openStream(CanonicalRequest request, AccountIdentity identity) {
        String body = serialize(request, true);
        try {
            // 不自動關閉回應，由 SseEventStream 於串流結束時關閉
            return requestSpec(identity, MediaType.TEXT_EVENT_STREAM)
                .body(body)
                .exchange((req, response) -> {
                    HttpStatusCode statusCode = response.getStatusCode();
                    if (!statusCode.is2xxSuccessful()) {
                        try {
                            throw toBackendException(response, identity);
                        } finally {
                            response.close();
                        }
                    }
                    return new SseEventStream(response.getBody(), response, sseParser);
                }, false);
        } catch (BackendException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Backend stream failed to open: account={}, error={}", identity.getEmail(), e.getMessage());
            throw BackendException.ioFailure("Backend request failed: " + rootMessage(e), e);
        }
    }

    private RestClient.RequestBodySpec requestSpec(AccountIdentity identity, MediaType accept) {
        return restClient.post()
            .uri(MESSAGES_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(accept)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + identity.getAccessToken())
            .header("anthropic-version", properties.anthropicVersion());
    }

    private String serialize(CanonicalRequest request, boolean stream) {
        try {
            return objectMapper.writeValueAsString(payloadMapper.write(request, stream));
        } catch (IOException e) {
            throw BackendException.ioFailure("Failed to serialize backend request", e);
        }
    }

    private BackendException toBackendException(ClientHttpResponse response, AccountIdentity identity)
            throws IOException {
        int status = response.getStatusCode().value();
        Long retryAfter = parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        String errorType = null;
        String message = null;
        String raw;
        try (InputStream in = response.getBody()) {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        if (StringUtils.isNotBlank(raw)) {
            try {
                JsonNode error = objectMapper.readTree(raw).path("error");
                errorType = error.hasNonNull("type") ? error.get("type").asText() : null;
                message = error.hasNonNull("message") ? error.get("message").asText() : null;
            } catch (IOException e) {
                message = StringUtils.abbreviate(raw, 200);
            }
        }
        log.error("Backend error: status={}, type={}, account={}, retryAfter={}",
            status, errorType, identity.getEmail(), retryAfter);
        return BackendException.fromResponse(status, errorType, message, retryAfter);
    }

    /**
     * 解析 {@code Retry-After}（僅支援秒數格式）
     */
    static Long parseRetryAfter(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
