package io.nosqlbench.modelstore.cache;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.modelstore.MutableClock;
import io.nosqlbench.modelstore.TestArtifacts;
import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.events.MemoryEventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CacheManagerTest {
    private static final URI SOURCE = URI.create("https://models.example.com/");

    @TempDir
    Path tempDir;

    private Path cacheDir;
    private MutableClock clock;
    private MemoryEventSink events;

    @BeforeEach
    public void setUp() {
        cacheDir = tempDir.resolve("cache");
        clock = MutableClock.startingAt("2026-01-10T08:00:00Z");
        events = new MemoryEventSink();
    }

    private CacheManager lru(long maxSize) {
        return new CacheManager(cacheDir, maxSize, Duration.ofDays(30), EvictionStrategy.LRU, events, clock);
    }

    private ArtifactDescriptor store(CacheManager cache, String name, int size) throws Exception {
        byte[] content = TestArtifacts.content(size, name.hashCode());
        ArtifactDescriptor descriptor = TestArtifacts.describe(name, SOURCE.resolve(name), content);
        Path staged = tempDir.resolve(name + ".staged");
        Files.write(staged, content);
        cache.storeModel(descriptor, staged);
        return descriptor;
    }

    @Test
    public void testStoreThenHit() throws Exception {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor descriptor = store(cache, "alpha", 1000);

        CacheLookup lookup = cache.checkCache(descriptor);

        assertTrue(lookup.hit());
        assertEquals(CacheStatus.VALID, lookup.status());
        assertEquals(cacheDir.toAbsolutePath().resolve("alpha-1.0.0.bin"), lookup.path());
        assertEquals(1, lookup.entry().loadCount());
        CacheStats stats = cache.getStats();
        assertEquals(1, stats.totalModels());
        assertEquals(1000, stats.totalSize());
        assertEquals(1.0, stats.hitRate(), 0.0001);
    }

    @Test
    public void testMissingDescriptor() {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor descriptor = TestArtifacts.describe("absent", SOURCE, TestArtifacts.content(10, 1));

        CacheLookup lookup = cache.checkCache(descriptor);

        assertFalse(lookup.hit());
        assertEquals(CacheStatus.MISSING, lookup.status());
        assertEquals(0.0, cache.getStats().hitRate(), 0.0001);
        assertEquals(1, events.eventsOf(PipelineEvent.CACHE_MISS).size());
    }

    @Test
    public void testChecksumChangeIsInvalid() throws Exception {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor stored = store(cache, "beta", 500);
        ArtifactDescriptor changed = new ArtifactDescriptor(stored.name(), stored.version(), stored.url(),
            "ffff", stored.size(), stored.format(), stored.dimensions());

        assertEquals(CacheStatus.INVALID, cache.checkCache(changed).status());
    }

    @Test
    public void testTamperedSizeIsCorrupted() throws Exception {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor stored = store(cache, "gamma", 500);
        Files.write(cache.pathFor(stored), new byte[10]);

        CacheLookup lookup = cache.checkCache(stored);

        assertFalse(lookup.hit());
        assertEquals(CacheStatus.CORRUPTED, lookup.status());
    }

    @Test
    public void testDeletedFileIsMissing() throws Exception {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor stored = store(cache, "delta", 500);
        Files.delete(cache.pathFor(stored));

        assertEquals(CacheStatus.MISSING, cache.checkCache(stored).status());
        assertTrue(cache.listEntries().isEmpty());
    }

    @Test
    public void testLruEvictsLeastRecentlyUsed() throws Exception {
        CacheManager cache = lru(2500);
        ArtifactDescriptor first = store(cache, "first", 1000);
        clock.advance(Duration.ofMinutes(1));
        ArtifactDescriptor second = store(cache, "second", 1000);
        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.checkCache(first).hit());
        clock.advance(Duration.ofMinutes(1));

        ArtifactDescriptor third = store(cache, "third", 1000);

        assertTrue(cache.checkCache(first).hit());
        assertEquals(CacheStatus.MISSING, cache.checkCache(second).status());
        assertTrue(cache.checkCache(third).hit());
        assertFalse(Files.exists(cache.pathFor(second)));
        assertThat(cache.getStats().totalSize()).isLessThanOrEqualTo(2500);
        assertEquals(1, cache.getStats().evictions());
    }

    @Test
    public void testNewEntryIsNeverEvictedByItsOwnStore() throws Exception {
        CacheManager cache = lru(1500);
        store(cache, "small", 1000);
        clock.advance(Duration.ofMinutes(1));

        ArtifactDescriptor big = store(cache, "big", 2000);

        assertTrue(cache.checkCache(big).hit());
        assertEquals(1, cache.getStats().totalModels());
    }

    @Test
    public void testAgeStrategy() throws Exception {
        CacheManager cache = new CacheManager(cacheDir, 1_000_000, Duration.ofDays(7), EvictionStrategy.AGE,
            events, clock);
        ArtifactDescriptor old = store(cache, "old", 100);
        clock.advance(Duration.ofDays(5));
        ArtifactDescriptor fresh = store(cache, "fresh", 100);
        clock.advance(Duration.ofDays(3));

        assertEquals(CacheStatus.OUTDATED, cache.checkCache(old).status());
        assertTrue(cache.checkCache(fresh).hit());

        List<String> evicted = cache.cleanup();

        assertEquals(List.of(old.id()), evicted);
        assertEquals(1, cache.getStats().totalModels());
    }

    @Test
    public void testRemoveModelByNameOrVersion() throws Exception {
        CacheManager cache = lru(1_000_000);
        byte[] one = TestArtifacts.content(100, 1);
        byte[] two = TestArtifacts.content(100, 2);
        for (var descriptor : List.of(
            TestArtifacts.describe("multi", "1.0.0", SOURCE, one, "bin"),
            TestArtifacts.describe("multi", "2.0.0", SOURCE, two, "bin"))) {
            Path staged = tempDir.resolve(descriptor.fileName() + ".staged");
            Files.write(staged, descriptor.version().equals("1.0.0") ? one : two);
            cache.storeModel(descriptor, staged);
        }
        store(cache, "other", 100);

        assertEquals(1, cache.removeModel("multi", "1.0.0"));
        assertEquals(1, cache.removeModel("multi", null));
        assertEquals(0, cache.removeModel("multi", null));
        assertEquals(1, cache.getStats().totalModels());

        cache.clear();
        assertEquals(0, cache.getStats().totalModels());
    }

    @Test
    public void testIndexSurvivesRestart() throws Exception {
        CacheManager cache = lru(10_000);
        ArtifactDescriptor descriptor = store(cache, "durable", 700);

        CacheManager reopened = lru(10_000);

        assertTrue(Files.exists(cacheDir.resolve(CacheManager.INDEX_FILE)));
        assertTrue(reopened.checkCache(descriptor).hit());
        assertTrue(reopened.contains(descriptor));
    }

    @Test
    public void testConcurrentCallersShareOneAcquisition() throws Exception {
        CacheManager cache = lru(1_000_000);
        byte[] content = TestArtifacts.content(256, 99);
        ArtifactDescriptor descriptor = TestArtifacts.describe("shared", SOURCE, content);
        AtomicInteger started = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Path> download = new CompletableFuture<>();

        CompletableFuture<Path> winner = cache.acquireOrJoin(descriptor, () -> {
            started.incrementAndGet();
            return download;
        });
        List<CompletableFuture<Path>> joiners = List.of(
            CompletableFuture.supplyAsync(() -> cache.acquireOrJoin(descriptor, () -> {
                started.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("second acquisition"));
            })).thenCompose(f -> f),
            cache.acquireOrJoin(descriptor, () -> {
                started.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("third acquisition"));
            }));
        assertTrue(cache.isInFlight(descriptor));

        Path staged = tempDir.resolve("shared.staged");
        Files.write(staged, content);
        CompletableFuture.runAsync(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            download.complete(cache.storeModel(descriptor, staged));
        });
        release.countDown();

        Path path = winner.get(5, TimeUnit.SECONDS);
        for (CompletableFuture<Path> joiner : joiners) {
            assertEquals(path, joiner.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, started.get());
        assertFalse(cache.isInFlight(descriptor));
        assertEquals(2, events.eventsOf(PipelineEvent.CACHE_JOIN).size());
    }

    @Test
    public void testLateCallerGetsCachedFileWithoutNewAcquisition() throws Exception {
        CacheManager cache = lru(1_000_000);
        ArtifactDescriptor descriptor = store(cache, "late", 300);

        Path path = cache.acquireOrJoin(descriptor,
            () -> CompletableFuture.failedFuture(new IllegalStateException("should not run"))).get();

        assertEquals(cache.pathFor(descriptor), path);
        assertEquals(0, cache.getStats().hits() + cache.getStats().misses());
    }

    @Test
    public void testFailedAcquisitionIsNotRemembered() throws Exception {
        CacheManager cache = lru(1_000_000);
        ArtifactDescriptor descriptor = TestArtifacts.describe("flaky", SOURCE, TestArtifacts.content(10, 5));

        CompletableFuture<Path> failed = cache.acquireOrJoin(descriptor,
            () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));

        assertTrue(failed.isCompletedExceptionally());
        assertFalse(cache.isInFlight(descriptor));
    }
}
