package io.github.samzhu.prism.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

class JsonFileAccountStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @TempDir
    Path tempDir;

    @Test
    void shouldStartEmptyWhenFileIsMissing() throws IOException {
        JsonFileAccountStore store = new JsonFileAccountStore(tempDir.resolve("accounts.json"), objectMapper);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldRoundTripSnapshotsThroughFile() throws IOException {
        Path file = tempDir.resolve("nested/accounts.json");
        JsonFileAccountStore store = new JsonFileAccountStore(file, objectMapper);
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        AccountSnapshot snapshot = new AccountSnapshot("a@example.com", "token-a", "pro", 64.5, 12.0,
            now, now, now.plusSeconds(10), true, false, null, now.minusSeconds(5));

        store.save(List.of(snapshot));

        assertTrue(Files.exists(file));
        assertEquals(List.of(snapshot), store.load());
        try (var files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldReplaceExistingContent() throws IOException {
        JsonFileAccountStore store = new JsonFileAccountStore(tempDir.resolve("accounts.json"), objectMapper);
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        store.save(List.of(
            new AccountSnapshot("a@example.com", "t", null, 70, 50, now, now, null, true, false, null, null),
            new AccountSnapshot("b@example.com", "t", null, 70, 50, now, now, null, true, false, null, null)));

        store.save(List.of(
            new AccountSnapshot("b@example.com", "t2", null, 50, 10, now, now, null, false, true, "401", null)));

        List<AccountSnapshot> loaded = store.load();
        assertEquals(1, loaded.size());
        assertEquals("b@example.com", loaded.get(0).email());
        assertEquals("401", loaded.get(0).invalidReason());
    }
}
