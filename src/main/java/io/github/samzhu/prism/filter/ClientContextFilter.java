package io.github.samzhu.prism.filter;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;

import io.github.samzhu.prism.config.ClientProperties;
import io.github.samzhu.prism.util.GlobPattern;

/**
 * 請求前置過濾器
 *
 * <p>在路由處理前整理請求資訊並存入請求屬性：
 * <ul>
 *   <li>{@code prism.requestId} - 請求唯一識別碼（UUID）</li>
 *   <li>{@code prism.clientIp} - 客戶端 IP，預設為連線的 socket 位址</li>
 *   <li>{@code prism.headers} - 名稱轉小寫的 headers（同名只取第一個值）</li>
 * </ul>
 *
 * <p>直接連線端符合 {@code prism.client.trusted-proxies} 時，從 {@code X-Forwarded-For}
 * 由右往左略過受信任的代理，取第一個非代理位址。其他來源的該 header 一律忽略。
 *
 * @see io.github.samzhu.prism.config.GatewayConfig
 */
@Component
public class ClientContextFilter implements Function<ServerRequest, ServerRequest> {

    private static final Logger log = LoggerFactory.getLogger(ClientContextFilter.class);

    public static final String REQUEST_ID_ATTRIBUTE = "prism.requestId";
    public static final String CLIENT_IP_ATTRIBUTE = "prism.clientIp";
    public static final String HEADERS_ATTRIBUTE = "prism.headers";

    private static final String FORWARDED_FOR_HEADER = "x-forwarded-for";

    private final List<String> trustedProxies;

    public ClientContextFilter(ClientProperties clientProperties) {
        this.trustedProxies = clientProperties.trustedProxies();
    }

    @Override
    public ServerRequest apply(ServerRequest request) {
        Map<String, String> headers = lowercaseHeaders(request.headers().asHttpHeaders());
        String clientIp = resolveClientIp(headers.get(FORWARDED_FOR_HEADER),
            request.servletRequest().getRemoteAddr());
        String requestId = UUID.randomUUID().toString();

        log.debug("Processing request: path={}, requestId={}, clientIp={}", request.path(), requestId, clientIp);

        request.attributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        request.attributes().put(CLIENT_IP_ATTRIBUTE, clientIp);
        request.attributes().put(HEADERS_ATTRIBUTE, headers);
        return request;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, String> headers(ServerRequest request) {
        return request.attribute(HEADERS_ATTRIBUTE)
            .map(value -> (Map<String, String>) value)
            .orElseGet(() -> lowercaseHeaders(request.headers().asHttpHeaders()));
    }

    public static String clientIp(ServerRequest request) {
        return request.attribute(CLIENT_IP_ATTRIBUTE).map(Object::toString).orElse(null);
    }

    static Map<String, String> lowercaseHeaders(HttpHeaders httpHeaders) {
        Map<String, String> headers = new HashMap<>();
        for (String name : httpHeaders.keySet()) {
            String value = httpHeaders.getFirst(name);
            if (value != null) {
                headers.putIfAbsent(name.toLowerCase(Locale.ROOT), value);
            }
        }
        return headers;
    }

    String resolveClientIp(String forwardedFor, String remoteAddress) {
        if (StringUtils.isBlank(forwardedFor) || !isTrustedProxy(remoteAddress)) {
            return remoteAddress;
        }
        String[] hops = StringUtils.split(forwardedFor, ',');
        String client = remoteAddress;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (hop.isEmpty()) {
                continue;
            }
            client = hop;
            if (!isTrustedProxy(hop)) {
                break;
            }
        }
        return client;
    }

    private boolean isTrustedProxy(String address) {
        return address != null && !trustedProxies.isEmpty() && GlobPattern.ipAllowed(trustedProxies, address);
    }
}
