package io.github.samzhu.prism.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.model.UsageEventData;

class TokenExtractorTest {

    private final SseParser parser = new SseParser(new ObjectMapper());
    private final TokenExtractor extractor = new TokenExtractor();

    @Test
    void shouldAccumulateUsageAcrossEvents() {
        extractor.processEvent(parser.parse("""
            {"type":"message_start","message":{"id":"msg_9","model":"gemini-3-flash",
             "usage":{"input_tokens":20,"cache_creation_input_tokens":4,"cache_read_input_tokens":6}}}"""));
        extractor.processEvent(parser.parse("""
            {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":15}}"""));

        assertEquals(new TokenUsage(20, 15, 6, 4), extractor.toUsage());
        assertEquals("msg_9", extractor.getMessageId());
        assertEquals("end_turn", extractor.getStopReason());
        assertNull(extractor.getErrorType());
    }

    @Test
    void shouldKeepResolvedModelWhenBackendOmitsIt() {
        extractor.processEvent(parser.parse("{\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":1}}}"));

        UsageEventData data = extractor.applyTo(UsageEventData.builder().model("gemini-3-flash")).build();

        assertEquals("gemini-3-flash", data.model());
        assertEquals(1, data.inputTokens());
    }

    @Test
    void shouldRecordErrorType() {
        extractor.processEvent(parser.parse("{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}"));
        assertEquals("overloaded_error", extractor.getErrorType());

        TokenExtractor untyped = new TokenExtractor();
        untyped.processEvent(parser.parse("{\"type\":\"error\"}"));
        assertEquals("api_error", untyped.getErrorType());
    }
}
