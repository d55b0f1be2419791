package io.github.samzhu.prism.apikey;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.prism.support.MutableClock;

class ApiKeyServiceTest {

    private MutableClock clock;
    private InMemoryApiKeyStore store;
    private SlidingWindowRateLimiter limiter;
    private ApiKeyService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        store = new InMemoryApiKeyStore();
        limiter = new SlidingWindowRateLimiter(clock);
        service = new ApiKeyService(store, limiter, Runnable::run, clock);
    }

    @Test
    void shouldIssuePrefixedKeyAndStoreOnlyHash() {
        IssuedApiKey issued = service.create(ApiKeySettings.named("ci"));

        assertTrue(issued.plaintext().matches("sk-prism-[0-9a-f]{32}"));
        assertEquals(ApiKeyService.hash(issued.plaintext()), issued.record().keyHash());
        assertEquals(issued.plaintext().substring(0, 10) + "****"
            + issued.plaintext().substring(issued.plaintext().length() - 4), issued.record().keyPrefix());
        assertFalse(issued.toString().contains(issued.plaintext()));
    }

    @Test
    void shouldRequireName() {
        assertThrows(IllegalArgumentException.class, () -> service.create(ApiKeySettings.named(" ")));
    }

    @Test
    void shouldImportConfiguredKeyOnce() {
        ApiKeyRecord first = service.importKey("sk-prism-configured-0001", ApiKeySettings.named("ops"));
        ApiKeyRecord second = service.importKey("sk-prism-configured-0001", ApiKeySettings.named("ops"));

        assertEquals(first.id(), second.id());
        assertEquals(1, service.list().size());
        assertTrue(service.hasApiKeys());
    }

    @Test
    void shouldKeepUnsetFieldsOnUpdate() {
        IssuedApiKey issued = service.create(new ApiKeySettings("ci", List.of("gemini-*"), 10, 100,
            null, null, null, "first"));

        ApiKeyRecord updated = service.update(issued.record().id(),
            new ApiKeySettings(null, null, 20, null, null, null, false, null)).orElseThrow();

        assertEquals("ci", updated.name());
        assertEquals(List.of("gemini-*"), updated.allowedModels());
        assertEquals(20, updated.rateLimitRpm());
        assertEquals(100, updated.rateLimitRph());
        assertFalse(updated.enabled());
        assertEquals("first", updated.notes());
    }

    @Test
    void shouldRegenerateSecretAndResetCounters() {
        IssuedApiKey issued = service.create(new ApiKeySettings("ci", List.of("gemini-*"), 1, null,
            null, null, null, null));
        service.recordUsage(issued.record().id());
        limiter.acquire(issued.record().id(), 1, null);

        IssuedApiKey regenerated = service.regenerate(issued.record().id()).orElseThrow();

        assertNotEquals(issued.plaintext(), regenerated.plaintext());
        assertEquals(issued.record().id(), regenerated.record().id());
        assertEquals(List.of("gemini-*"), regenerated.record().allowedModels());
        assertEquals(0, regenerated.record().requestCount());
        assertNull(regenerated.record().lastUsedAt());
        assertTrue(store.findByHash(ApiKeyService.hash(issued.plaintext())).isEmpty());
        assertTrue(limiter.check(issued.record().id(), 1, null).allowed());
    }

    @Test
    void shouldRecordUsage() {
        IssuedApiKey issued = service.create(ApiKeySettings.named("ci"));
        clock.advanceSeconds(5);

        service.recordUsage(issued.record().id());
        service.recordUsage(issued.record().id());

        ApiKeyRecord record = service.get(issued.record().id()).orElseThrow();
        assertEquals(2, record.requestCount());
        assertEquals(clock.instant(), record.lastUsedAt());
    }

    @Test
    void shouldIgnoreRejectedUsageRecording() {
        ApiKeyService rejecting = new ApiKeyService(store, limiter, task -> {
            throw new RejectedExecutionException("full");
        }, clock);
        IssuedApiKey issued = rejecting.create(ApiKeySettings.named("ci"));

        rejecting.recordUsage(issued.record().id());

        assertEquals(0, store.findById(issued.record().id()).orElseThrow().requestCount());
    }

    @Test
    void shouldDeleteKey() {
        IssuedApiKey issued = service.create(ApiKeySettings.named("ci"));

        assertTrue(service.delete(issued.record().id()));
        assertFalse(service.delete(issued.record().id()));
        assertFalse(service.hasApiKeys());
    }

    @Test
    void shouldLogFingerprintWithoutPlaintext() {
        IssuedApiKey issued = service.create(ApiKeySettings.named("ci"));
        String fingerprint = ApiKeyService.fingerprint(issued.plaintext());

        assertTrue(fingerprint.matches("[0-9a-f]{8}"));
        assertTrue(issued.record().keyHash().startsWith(fingerprint));
        assertFalse(issued.plaintext().contains(fingerprint));
    }

    @Test
    void shouldKeepConcurrentUsageAcrossUpdates() throws Exception {
        IssuedApiKey issued = service.create(ApiKeySettings.named("ci"));
        String id = issued.record().id();
        int usages = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < usages; i++) {
                int n = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    service.recordUsage(id);
                    if (n % 4 == 0) {
                        service.update(id, new ApiKeySettings(null, null, null, null, null, null, null, "note-" + n));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(usages, service.get(id).orElseThrow().requestCount());
    }
}
