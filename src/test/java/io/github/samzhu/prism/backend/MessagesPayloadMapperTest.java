package io.github.samzhu.prism.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.prism.model.CanonicalRequest;
import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.GenerationParams;
import io.github.samzhu.prism.model.ImagePart;
import io.github.samzhu.prism.model.Role;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.ToolChoice;
import io.github.samzhu.prism.model.ToolDefinition;
import io.github.samzhu.prism.model.ToolResultPart;
import io.github.samzhu.prism.model.ToolUsePart;
import io.github.samzhu.prism.model.Turn;

class MessagesPayloadMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MessagesPayloadMapper mapper = new MessagesPayloadMapper(objectMapper);

    @Test
    void shouldWriteFullRequest() {
        ObjectNode input = JsonNodeFactory.instance.objectNode().put("city", "Taipei");
        CanonicalRequest request = new CanonicalRequest(
            "gemini-3-flash", "gpt-4o-mini", "Be brief.",
            List.of(
                new Turn(Role.USER, List.of(new TextPart("Hi"),
                    new ImagePart(ImagePart.Source.base64("image/png", "AAAA")))),
                new Turn(Role.ASSISTANT, List.of(new ToolUsePart("toolu_1", "weather", input))),
                new Turn(Role.USER, List.of(new ToolResultPart("toolu_1", "Sunny")))),
            new GenerationParams(256, 0.5, null, 20, List.of("END")),
            List.of(new ToolDefinition("weather", "Get weather", null)),
            ToolChoice.tool("weather"),
            true);

        JsonNode body = mapper.write(request, true);

        assertEquals("gemini-3-flash", body.get("model").asText());
        assertEquals(256, body.get("max_tokens").asInt());
        assertEquals("Be brief.", body.get("system").asText());
        assertEquals(0.5, body.get("temperature").asDouble());
        assertFalse(body.has("top_p"));
        assertEquals(20, body.get("top_k").asInt());
        assertEquals("END", body.at("/stop_sequences/0").asText());
        assertTrue(body.get("stream").asBoolean());

        assertEquals("user", body.at("/messages/0/role").asText());
        assertEquals("text", body.at("/messages/0/content/0/type").asText());
        assertEquals("image", body.at("/messages/0/content/1/type").asText());
        assertEquals("image/png", body.at("/messages/0/content/1/source/media_type").asText());
        assertEquals("tool_use", body.at("/messages/1/content/0/type").asText());
        assertEquals("Taipei", body.at("/messages/1/content/0/input/city").asText());
        assertEquals("toolu_1", body.at("/messages/2/content/0/tool_use_id").asText());
        assertFalse(body.at("/messages/2/content/0").has("is_error"));

        assertEquals("object", body.at("/tools/0/input_schema/type").asText());
        assertEquals("tool", body.at("/tool_choice/type").asText());
        assertEquals("weather", body.at("/tool_choice/name").asText());
    }

    @Test
    void shouldOmitOptionalFields() {
        CanonicalRequest request = new CanonicalRequest("gemini-3-flash", null, null,
            List.of(Turn.text(Role.USER, "Hi")), new GenerationParams(0, null, null, null, null),
            null, null, false);

        JsonNode body = mapper.write(request, false);

        assertEquals(GenerationParams.DEFAULT_MAX_TOKENS, body.get("max_tokens").asInt());
        assertFalse(body.has("system"));
        assertFalse(body.has("tools"));
        assertFalse(body.has("tool_choice"));
        assertFalse(body.has("stop_sequences"));
        assertFalse(body.get("stream").asBoolean());
    }

    @Test
    void shouldReadResponse() throws Exception {
        CanonicalResponse response = mapper.read(objectMapper.readTree("""
            {"id":"msg_1","type":"message","role":"assistant","model":"gemini-3-flash",
             "content":[{"type":"text","text":"Hello"},{"type":"redacted_thinking","data":"x"},
                        {"type":"tool_use","id":"toolu_1","name":"weather","input":{"city":"Taipei"}}],
             "stop_reason":"tool_use",
             "usage":{"input_tokens":11,"output_tokens":7,"cache_read_input_tokens":2}}"""));

        assertEquals("msg_1", response.id());
        assertEquals(2, response.content().size());
        assertEquals(new TextPart("Hello"), response.content().get(0));
        assertInstanceOf(ToolUsePart.class, response.content().get(1));
        assertEquals("tool_use", response.stopReason());
        assertEquals(11, response.usage().inputTokens());
        assertEquals(7, response.usage().outputTokens());
        assertEquals(2, response.usage().cacheReadTokens());
        assertEquals(0, response.usage().cacheCreationTokens());
    }
}
