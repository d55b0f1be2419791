package io.github.samzhu.prism.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.util.SseParser;

class AnthropicStreamTranscoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SseParser parser = new SseParser(objectMapper);
    private final AnthropicStreamTranscoder transcoder = new AnthropicStreamTranscoder(objectMapper);

    @Test
    void shouldForwardEventsVerbatim() {
        String data = "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}";

        List<String> frames = transcoder.onEvent(parser.toEvent("content_block_delta", data));

        assertEquals(List.of("event: content_block_delta\ndata: " + data + "\n\n"), frames);
        assertFalse(transcoder.isFinished());
    }

    @Test
    void shouldFinishAfterMessageStop() {
        transcoder.onEvent(parser.toEvent("message_stop", "{\"type\":\"message_stop\"}"));

        assertTrue(transcoder.isFinished());
        assertTrue(transcoder.onEvent(parser.toEvent("ping", "{\"type\":\"ping\"}")).isEmpty());
        assertTrue(transcoder.onFailure("late").isEmpty());
    }

    @Test
    void shouldEmitApiErrorOnFailure() throws Exception {
        List<String> frames = transcoder.onFailure("Backend stream ended unexpectedly");

        String frame = frames.get(0);
        assertTrue(frame.startsWith("event: error\ndata: "));
        JsonNode body = objectMapper.readTree(frame.substring(frame.indexOf("data: ") + 6).trim());
        assertEquals("error", body.get("type").asText());
        assertEquals("api_error", body.at("/error/type").asText());
        assertEquals("Backend stream ended unexpectedly", body.at("/error/message").asText());
        assertTrue(transcoder.isFinished());
    }
}
