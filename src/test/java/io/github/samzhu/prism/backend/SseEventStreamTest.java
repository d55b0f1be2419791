package io.github.samzhu.prism.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.util.SseParser;

class SseEventStreamTest {

    private final SseParser parser = new SseParser(new ObjectMapper());
    private final AtomicInteger closes = new AtomicInteger();

    private SseEventStream stream(String body) {
        return new SseEventStream(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)),
            closes::incrementAndGet, parser);
    }

    @Test
    void shouldReadEventsSeparatedByBlankLines() {
        SseEventStream events = stream("""
            event: message_start
            data: {"type":"message_start","message":{"id":"msg_1"}}

            : keep-alive

            event: ping
            data: {"type":"ping"}

            data: {"type":"message_stop"}
            """);

        BackendEvent first = events.next();
        assertEquals("message_start", first.type());
        assertEquals("msg_1", first.payload().getMessageId());
        assertEquals("ping", events.next().type());
        BackendEvent last = events.next();
        assertEquals("message_stop", last.type());
        assertFalse(events.hasNext());
        assertThrows(NoSuchElementException.class, events::next);
    }

    @Test
    void shouldJoinMultipleDataLines() {
        SseEventStream events = stream("event: custom\ndata: line1\ndata: line2\n\n");

        BackendEvent event = events.next();
        assertEquals("custom", event.type());
        assertEquals("line1\nline2", event.data());
    }

    @Test
    void shouldEmitTrailingEventWithoutBlankLine() {
        SseEventStream events = stream("data: {\"type\":\"message_stop\"}");

        assertTrue(events.hasNext());
        assertEquals("message_stop", events.next().type());
        assertFalse(events.hasNext());
    }

    @Test
    void shouldCloseResourceOnce() {
        SseEventStream events = stream("data: {}\n\n");

        events.close();
        events.close();

        assertEquals(1, closes.get());
        assertFalse(events.hasNext());
    }

    @Test
    void shouldWrapReadFailure() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        SseEventStream events = new SseEventStream(failing, closes::incrementAndGet, parser);

        BackendException e = assertThrows(BackendException.class, events::hasNext);
        assertEquals(BackendException.Kind.IO_ERROR, e.getKind());
        assertTrue(e.isRetryable());
        assertEquals(502, e.getStatus());
    }
}
