package io.github.samzhu.prism.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.prism.model.ContentPart;
import io.github.samzhu.prism.model.Role;
import io.github.samzhu.prism.model.TextPart;
import io.github.samzhu.prism.model.Turn;

class TurnNormalizerTest {

    private static Turn turn(Role role, String... texts) {
        List<ContentPart> parts = new ArrayList<>();
        for (String text : texts) {
            parts.add(new TextPart(text));
        }
        return new Turn(role, parts);
    }

    @Test
    void shouldMergeConsecutiveTurnsInOrder() {
        List<Turn> turns = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            turns.add(turn(Role.USER, "u" + i));
        }

        List<Turn> normalized = TurnNormalizer.normalize(turns);

        assertEquals(1, normalized.size());
        assertEquals(5, normalized.get(0).content().size());
        assertEquals(new TextPart("u0"), normalized.get(0).content().get(0));
        assertEquals(new TextPart("u4"), normalized.get(0).content().get(4));
    }

    @Test
    void shouldKeepAlternatingTurns() {
        List<Turn> turns = List.of(
            turn(Role.USER, "a"), turn(Role.ASSISTANT, "b"), turn(Role.USER, "c"), turn(Role.ASSISTANT, "d"));

        assertEquals(turns, TurnNormalizer.normalize(turns));
    }

    @Test
    void shouldDropEmptyTurnsBeforeMerging() {
        List<Turn> normalized = TurnNormalizer.normalize(List.of(
            turn(Role.USER, "a"), turn(Role.ASSISTANT), turn(Role.USER, "b")));

        assertEquals(1, normalized.size());
        assertEquals(List.of(new TextPart("a"), new TextPart("b")), normalized.get(0).content());
        assertTrue(TurnNormalizer.normalize(List.of(turn(Role.USER))).isEmpty());
    }
}
