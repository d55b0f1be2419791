package io.github.samzhu.prism.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.function.ServerRequest;

import io.github.samzhu.prism.config.ClientProperties;

class ClientContextFilterTest {

    private final ClientContextFilter filter = new ClientContextFilter(new ClientProperties(List.of()));
    private final ClientContextFilter behindProxy =
        new ClientContextFilter(new ClientProperties(List.of("10.0.0.*")));

    @Test
    void shouldIgnoreForwardedForWithoutTrustedProxies() {
        assertEquals("203.0.113.9", filter.resolveClientIp("10.0.0.5", "203.0.113.9"));
        assertNull(filter.resolveClientIp(null, null));
    }

    @Test
    void shouldIgnoreForwardedForFromUntrustedPeer() {
        assertEquals("203.0.113.9", behindProxy.resolveClientIp("10.0.0.5", "203.0.113.9"));
    }

    @Test
    void shouldSkipTrustedHopsFromTheRight() {
        assertEquals("198.51.100.4", behindProxy.resolveClientIp("7.7.7.7, 198.51.100.4, 10.0.0.2", "10.0.0.1"));
        assertEquals("10.0.0.1", behindProxy.resolveClientIp(" ", "10.0.0.1"));
        assertEquals("10.0.0.3", behindProxy.resolveClientIp("10.0.0.3, , 10.0.0.2", "10.0.0.1"));
    }

    @Test
    void shouldLowercaseHeaderNames() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Authorization", "Bearer sk-prism-1");
        headers.add("X-Api-Key", "sk-prism-2");

        Map<String, String> lowercase = ClientContextFilter.lowercaseHeaders(headers);

        assertEquals("Bearer sk-prism-1", lowercase.get("authorization"));
        assertEquals("sk-prism-2", lowercase.get("x-api-key"));
    }

    @Test
    void shouldStoreClientContextOnRequest() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("POST", "/v1/messages");
        servletRequest.setRemoteAddr("192.168.1.20");
        servletRequest.addHeader("User-Agent", "curl/8.0");
        ServerRequest request = ServerRequest.create(servletRequest, List.of());

        ServerRequest filtered = filter.apply(request);

        assertEquals("192.168.1.20", ClientContextFilter.clientIp(filtered));
        assertEquals("curl/8.0", ClientContextFilter.headers(filtered).get("user-agent"));
        assertNotNull(filtered.attribute(ClientContextFilter.REQUEST_ID_ATTRIBUTE).orElse(null));
    }

    @Test
    void shouldNotTrustForgedForwardedForHeader() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("POST", "/v1/chat/completions");
        servletRequest.setRemoteAddr("203.0.113.9");
        servletRequest.addHeader("X-Forwarded-For", "10.0.0.5");

        ServerRequest filtered = behindProxy.apply(ServerRequest.create(servletRequest, List.of()));

        assertEquals("203.0.113.9", ClientContextFilter.clientIp(filtered));
    }

    @Test
    void shouldUseForwardedForBehindTrustedProxy() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("POST", "/v1/chat/completions");
        servletRequest.setRemoteAddr("10.0.0.1");
        servletRequest.addHeader("X-Forwarded-For", "198.51.100.4, 10.0.0.2");

        ServerRequest filtered = behindProxy.apply(ServerRequest.create(servletRequest, List.of()));

        assertEquals("198.51.100.4", ClientContextFilter.clientIp(filtered));
    }
}
