package io.github.samzhu.prism.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.github.samzhu.prism.model.CanonicalResponse;
import io.github.samzhu.prism.model.ChatCompletion;
import io.github.samzhu.prism.model.MessagesResponse;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.ThinkingPart;
import io.github.samzhu.prism.model.TokenUsage;
import io.github.samzhu.prism.model.ToolUsePart;
import io.github.samzhu.prism.support.MutableClock;

class ResponseConverterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldBuildChatCompletionFromText() throws Exception {
        CanonicalResponse response = new CanonicalResponse("msg_1", "gemini-3-pro-high",
            List.of(new ThinkingPart("hidden", null), new TextPart("Hello "), new TextPart("world")),
            "end_turn", new TokenUsage(10, 4, 6, 0));

        ChatCompletion completion = new OpenAiResponseConverter(objectMapper, MutableClock.atEpoch())
            .convert(response, "gpt-4o");

        assertTrue(completion.id().startsWith("chatcmpl-"));
        assertEquals("chat.completion", completion.object());
        assertEquals(MutableClock.atEpoch().instant().getEpochSecond(), completion.created());
        assertEquals("gpt-4o", completion.model());
        ChatCompletion.Choice choice = completion.choices().get(0);
        assertEquals("assistant", choice.message().role());
        assertEquals("Hello world", choice.message().content());
        assertNull(choice.message().toolCalls());
        assertEquals("stop", choice.finishReason());
        assertEquals(16, completion.usage().promptTokens());
        assertEquals(4, completion.usage().completionTokens());
        assertEquals(20, completion.usage().totalTokens());

        JsonNode json = objectMapper.valueToTree(completion);
        assertTrue(json.at("/choices/0/message").has("content"));
        assertTrue(!json.at("/choices/0/message").has("tool_calls"));
    }

    @Test
    void shouldBuildToolCalls() {
        JsonNode input = JsonNodeFactory.instance.objectNode().put("city", "Taipei");
        CanonicalResponse response = new CanonicalResponse("msg_2", "gemini-3-flash",
            List.of(new ToolUsePart("toolu_1", "weather", input), new ToolUsePart(null, "clock", null)),
            "tool_use", TokenUsage.EMPTY);

        ChatCompletion completion = new OpenAiResponseConverter(objectMapper, MutableClock.atEpoch())
            .convert(response, null);

        assertEquals("gemini-3-flash", completion.model());
        ChatCompletion.Message message = completion.choices().get(0).message();
        assertNull(message.content());
        assertEquals(2, message.toolCalls().size());
        assertEquals("toolu_1", message.toolCalls().get(0).id());
        assertEquals("{\"city\":\"Taipei\"}", message.toolCalls().get(0).function().arguments());
        assertTrue(message.toolCalls().get(1).id().startsWith("call_"));
        assertEquals("{}", message.toolCalls().get(1).function().arguments());
        assertEquals("tool_calls", completion.choices().get(0).finishReason());
    }

    @Test
    void shouldConvertDeterministicallyApartFromId() {
        CanonicalResponse response = new CanonicalResponse("msg_1", "gemini-3-flash",
            List.of(new TextPart("same")), "end_turn", new TokenUsage(1, 1, 0, 0));
        OpenAiResponseConverter converter = new OpenAiResponseConverter(objectMapper, MutableClock.atEpoch());

        ChatCompletion first = converter.convert(response, "gpt-4o-mini");
        ChatCompletion second = converter.convert(response, "gpt-4o-mini");

        assertEquals(first.choices(), second.choices());
        assertEquals(first.usage(), second.usage());
        assertEquals(first.created(), second.created());
        assertEquals(first.model(), second.model());
    }

    @Test
    void shouldBuildMessagesResponse() {
        CanonicalResponse response = new CanonicalResponse(null, "claude-sonnet-4-5-thinking",
            List.of(new ThinkingPart("plan", "sig"), new TextPart("Done")),
            "max_tokens", new TokenUsage(7, 3, 2, 1));

        MessagesResponse message = new AnthropicResponseConverter().convert(response, "claude-3-sonnet");

        assertTrue(message.id().startsWith("msg_"));
        assertEquals("message", message.type());
        assertEquals("assistant", message.role());
        assertEquals("claude-3-sonnet", message.model());
        assertEquals(2, message.content().size());
        assertEquals("max_tokens", message.stopReason());
        assertEquals(new MessagesResponse.Usage(7, 3, 2, 1), message.usage());
    }
}
