package io.github.samzhu.prism.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.config.BackendProperties;
import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.GenerationParams;
import io.github.samzhu.prism.model.Role;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.Turn;
import io.github.samzhu.prism.pool.AccountIdentity;
import io.github.samzhu.prism.pool.HealthScorePolicy;
import io.github.samzhu.prism.pool.TokenBucketPolicy;
import io.github.samzhu.prism.util.SseParser;

class RestClientBackendTransportTest {

    private static final String URL = "https://backend.test/v1/messages";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AccountIdentity account = AccountIdentity.create("a@example.com", "token-a", null,
        HealthScorePolicy.defaults(), TokenBucketPolicy.defaults(), Instant.parse("2025-01-01T00:00:00Z"));
    private final CanonicalRequest request = new CanonicalRequest("gemini-3-flash", "gpt-4o-mini", null,
        List.of(Turn.text(Role.USER, "Hi")), new GenerationParams(100, null, null, null, null), null, null, false);

    private MockRestServiceServer server;
    private RestClientBackendTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new RestClientBackendTransport(builder,
            new BackendProperties("https://backend.test", null, null), objectMapper, new SseParser(objectMapper));
    }

    @Test
    void shouldInvokeWithAccountCredentials() {
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-a"))
            .andExpect(header("anthropic-version", "2023-06-01"))
            .andExpect(jsonPath("$.model").value("gemini-3-flash"))
            .andExpect(jsonPath("$.max_tokens").value(100))
            .andExpect(jsonPath("$.stream").value(false))
            .andRespond(withSuccess("""
                {"id":"msg_1","model":"gemini-3-flash","content":[{"type":"text","text":"Hello"}],
                 "stop_reason":"end_turn","usage":{"input_tokens":3,"output_tokens":1}}""",
                MediaType.APPLICATION_JSON));

        CanonicalResponse response = transport.invoke(request, account);

        assertEquals(new TextPart("Hello"), response.content().get(0));
        assertEquals("end_turn", response.stopReason());
        assertEquals(3, response.usage().inputTokens());
        server.verify();
    }

    @Test
    void shouldMapRateLimitWithRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "30");
        server.expect(requestTo(URL))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"Too many\"}}"));

        BackendException e = assertThrows(BackendException.class, () -> transport.invoke(request, account));

        assertEquals(BackendException.Kind.RATE_LIMITED, e.getKind());
        assertEquals("Too many", e.getMessage());
        assertEquals(30L, e.getRetryAfterSeconds());
    }

    @Test
    void shouldMapCredentialRejection() {
        server.expect(requestTo(URL))
            .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("unauthorized"));

        BackendException e = assertThrows(BackendException.class, () -> transport.invoke(request, account));

        assertTrue(e.isCredentialRejected());
        assertEquals(502, e.getStatus());
    }

    @Test
    void shouldKeepRawBodyWhenErrorIsNotJson() {
        server.expect(requestTo(URL))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("plain failure"));

        BackendException e = assertThrows(BackendException.class, () -> transport.invoke(request, account));

        assertFalse(e.isRetryable());
        assertEquals("plain failure", e.getMessage());
    }

    @Test
    void shouldOpenEventStream() {
        server.expect(requestTo(URL))
            .andExpect(header(HttpHeaders.ACCEPT, MediaType.TEXT_EVENT_STREAM_VALUE))
            .andExpect(jsonPath("$.stream").value(true))
            .andRespond(withSuccess("""
                event: message_start
                data: {"type":"message_start","message":{"id":"msg_1","usage":{"input_tokens":4}}}

                event: message_stop
                data: {"type":"message_stop"}

                """, MediaType.TEXT_EVENT_STREAM));

        try (BackendEventStream events = transport.openStream(request, account)) {
            assertEquals(4, events.next().payload().getInputTokens());
            assertEquals("message_stop", events.next().type());
            assertFalse(events.hasNext());
        }
    }

    @Test
    void shouldFailStreamOnErrorStatus() {
        server.expect(requestTo(URL))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE)
                .body("{\"error\":{\"type\":\"overloaded_error\",\"message\":\"Busy\"}}"));

        BackendException e = assertThrows(BackendException.class, () -> transport.openStream(request, account));

        assertEquals(BackendException.Kind.SERVER_ERROR, e.getKind());
        assertEquals("overloaded_error", e.getErrorType());
    }

    @Test
    void shouldParseRetryAfterSeconds() {
        assertEquals(12L, RestClientBackendTransport.parseRetryAfter(" 12 "));
        assertNull(RestClientBackendTransport.parseRetryAfter("0"));
        assertNull(RestClientBackendTransport.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(RestClientBackendTransport.parseRetryAfter(null));
    }
}
