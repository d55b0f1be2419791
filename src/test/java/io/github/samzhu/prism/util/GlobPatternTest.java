package io.github.samzhu.prism.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class GlobPatternTest {

    @Test
    void shouldMatchModelFamilies() {
        assertTrue(GlobPattern.matches("gemini-*", "gemini-3-flash"));
        assertFalse(GlobPattern.matches("gemini-*", "claude-sonnet-4-5"));
        assertTrue(GlobPattern.matches("*-thinking", "claude-opus-4-5-thinking"));
    }

    @Test
    void shouldIgnoreCase() {
        assertTrue(GlobPattern.matches("Claude-*", "claude-sonnet-4-5"));
    }

    @Test
    void shouldTreatRegexCharactersLiterally() {
        assertTrue(GlobPattern.matches("10.0.0.1", "10.0.0.1"));
        assertFalse(GlobPattern.matches("10.0.0.1", "10x0y0z1"));
        assertFalse(GlobPattern.matches("gpt-4(o)", "gpt-4o"));
    }

    @Test
    void shouldMatchWholeValue() {
        assertFalse(GlobPattern.matches("gemini", "gemini-3-flash"));
        assertTrue(GlobPattern.matches("*", ""));
    }

    @Test
    void shouldAllowEverythingWithEmptyList() {
        assertTrue(GlobPattern.matchesAny(List.of(), "anything"));
        assertTrue(GlobPattern.ipAllowed(null, "192.168.0.1"));
    }

    @Test
    void shouldNormalizeLoopbackAndMappedAddresses() {
        assertEquals("127.0.0.1", GlobPattern.normalizeIp("::1"));
        assertEquals("127.0.0.1", GlobPattern.normalizeIp("0:0:0:0:0:0:0:1"));
        assertEquals("10.1.2.3", GlobPattern.normalizeIp("::ffff:10.1.2.3"));
        assertTrue(GlobPattern.ipAllowed(List.of("::1"), "127.0.0.1"));
        assertTrue(GlobPattern.ipAllowed(List.of("192.168.*"), "::ffff:192.168.7.7"));
        assertFalse(GlobPattern.ipAllowed(List.of("192.168.*"), "10.0.0.1"));
    }
}
