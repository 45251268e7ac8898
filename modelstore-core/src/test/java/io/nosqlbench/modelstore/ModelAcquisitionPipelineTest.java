package io.nosqlbench.modelstore;

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

import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.cache.CacheStats;
import io.nosqlbench.modelstore.cache.CacheStatus;
import io.nosqlbench.modelstore.config.PipelineConfig;
import io.nosqlbench.modelstore.errors.DiskSpaceException;
import io.nosqlbench.modelstore.errors.ErrorCategory;
import io.nosqlbench.modelstore.errors.SecurityViolationException;
import io.nosqlbench.modelstore.errors.ValidationException;
import io.nosqlbench.modelstore.events.MemoryEventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
import io.nosqlbench.modelstore.recovery.ErrorStatistics;
import io.nosqlbench.modelstore.recovery.FallbackCriteria;
import io.nosqlbench.modelstore.recovery.FallbackRegistration;
import io.nosqlbench.modelstore.testserver.JettyFileServerExtension;
import io.nosqlbench.modelstore.testserver.JettyFileServerFixture;
import io.nosqlbench.modelstore.testserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
@ExtendWith(JettyFileServerExtension.class)
public class ModelAcquisitionPipelineTest {

    @TempDir
    Path tempDir;

    private JettyFileServerFixture server;
    private MemoryEventSink events;
    private ModelAcquisitionPipeline pipeline;

    @BeforeEach
    public void setUp() {
        server = JettyFileServerExtension.getServer();
        events = new MemoryEventSink();
        pipeline = ModelAcquisitionPipeline.create(config().build(), events);
    }

    @AfterEach
    public void tearDown() {
        pipeline.close();
        server.clearFaults();
    }

    private PipelineConfig.Builder config() {
        return PipelineConfig.builder()
            .cacheDirectory(tempDir.resolve("cache"))
            .allowInsecureLoopback(true)
            .memoryThreshold(4 * PipelineConfig.GB)
            .minimumFreeSpace(0)
            .retryBaseDelay(Duration.ofMillis(10))
            .probeTimeout(Duration.ofSeconds(2));
    }

    private void reconfigure(PipelineConfig config) {
        pipeline.close();
        pipeline = ModelAcquisitionPipeline.create(config, events);
    }

    private List<RecordedRequest> gets(String path) {
        return server.requestsFor(path).stream()
            .filter(r -> r.method().equals("GET"))
            .collect(Collectors.toList());
    }

    @Test
    public void testAcquireThenServeFromCache() throws IOException {
        byte[] content = TestArtifacts.ggufContent(120_000, 1);
        URI uri = server.publish("pipeline/encoder.gguf", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("encoder", "2.0.0", uri, content, "gguf");

        Path path = pipeline.acquire(descriptor);
        assertEquals(tempDir.resolve("cache").resolve("encoder-2.0.0.gguf").toAbsolutePath(), path.toAbsolutePath());
        assertArrayEquals(content, Files.readAllBytes(path));

        assertEquals(CacheStatus.VALID, pipeline.checkCache(descriptor).status());
        assertEquals(path, pipeline.acquire(descriptor));
        assertEquals(1, gets("pipeline/encoder.gguf").size());

        CacheStats stats = pipeline.getStats();
        assertEquals(1, stats.totalModels());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0, pipeline.getErrorStatistics().total());
    }

    @Test
    public void testChecksumFailureFallsBack() throws IOException {
        byte[] primaryContent = TestArtifacts.content(80_000, 2);
        URI primaryUri = server.publish("pipeline/primary.bin", primaryContent);
        ArtifactDescriptor primary = new ArtifactDescriptor("primary", "1.0.0", primaryUri,
            "abc123", primaryContent.length, "bin", 768);
        byte[] alternativeContent = TestArtifacts.content(40_000, 3);
        URI alternativeUri = server.publish("pipeline/alternative.bin", alternativeContent);
        ArtifactDescriptor alternative = TestArtifacts.describe("alternative", alternativeUri, alternativeContent);
        pipeline.registerFallback("primary", FallbackRegistration.of(
            FallbackCriteria.maxSize(500 * PipelineConfig.MB), alternative));

        Path path = pipeline.acquire(primary);
        assertArrayEquals(alternativeContent, Files.readAllBytes(path));
        assertTrue(pipeline.checkCache(alternative).hit());
        assertFalse(pipeline.getCacheManager().contains(primary));

        assertEquals(1, pipeline.getVerifier().listQuarantined().size());
        ErrorStatistics errors = pipeline.getErrorStatistics();
        assertEquals(1, errors.total());
        assertEquals(1L, errors.byCategory().get(ErrorCategory.VALIDATION));
        assertEquals(1, events.eventsOf(PipelineEvent.FALLBACK).size());
    }

    @Test
    public void testChecksumFailureWithoutFallback() throws IOException {
        byte[] content = TestArtifacts.content(30_000, 4);
        URI uri = server.publish("pipeline/broken.bin", content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("broken", "1.0.0", uri, "abc123", content.length, "bin", 0);

        ValidationException e = assertThrows(ValidationException.class, () -> pipeline.acquire(descriptor));
        assertThat(e.getMessage()).contains("Checksum mismatch");
        assertNotNull(e.getQuarantinePath());
        assertFalse(Files.exists(tempDir.resolve("cache").resolve(descriptor.fileName())));
        assertEquals(1, pipeline.getErrorStatistics().total());
        assertEquals(1, gets("pipeline/broken.bin").size());
    }

    @Test
    public void testQuarantineCleanupUsesConfiguredRetention() throws Exception {
        byte[] content = TestArtifacts.content(20_000, 16);
        URI uri = server.publish("pipeline/expired.bin", content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("expired", "1.0.0", uri, "abc123", content.length, "bin", 0);
        assertThrows(ValidationException.class, () -> pipeline.acquire(descriptor));
        assertEquals(0, pipeline.cleanupQuarantine());
        assertEquals(1, pipeline.getVerifier().listQuarantined().size());

        reconfigure(config().quarantineRetentionDays(0).build());
        Thread.sleep(20);
        assertEquals(1, pipeline.cleanupQuarantine());
        assertTrue(pipeline.getVerifier().listQuarantined().isEmpty());
    }

    @Test
    public void testInterruptedTransferIsRetried() throws IOException {
        byte[] content = TestArtifacts.content(600_000, 5);
        URI uri = server.publish("pipeline/flaky.bin", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("flaky", uri, content);
        server.interruptOnce("pipeline/flaky.bin", 200_000);

        Path path = pipeline.acquire(descriptor);
        assertArrayEquals(content, Files.readAllBytes(path));
        assertEquals(2, gets("pipeline/flaky.bin").size());

        ErrorStatistics errors = pipeline.getErrorStatistics();
        assertEquals(1, errors.total());
        assertEquals(ErrorCategory.NETWORK, errors.recent().get(0).category());
        assertEquals(1, events.eventsOf(PipelineEvent.RECOVERY).size());
    }

    @Test
    public void testPersistentFailureStopsAfterMaxAttempts() throws IOException {
        byte[] content = TestArtifacts.content(10_000, 6);
        URI uri = server.publish("pipeline/down.bin", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("down", uri, content);
        server.forceStatus("pipeline/down.bin", 503);
        reconfigure(config().maxRetryAttempts(3).build());

        assertThrows(RuntimeException.class, () -> pipeline.acquire(descriptor));
        assertEquals(3, gets("pipeline/down.bin").size());
        // two retried failures and the final one
        assertEquals(3, pipeline.getErrorStatistics().total());
    }

    @Test
    public void testInsecureSourceIsNotRetried() throws IOException {
        byte[] content = TestArtifacts.content(10_000, 7);
        URI uri = server.publish("pipeline/insecure.bin", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("insecure", uri, content);
        reconfigure(config().allowInsecureLoopback(false).build());

        assertThrows(SecurityViolationException.class, () -> pipeline.acquire(descriptor));
        assertTrue(server.requestsFor("pipeline/insecure.bin").isEmpty());
        ErrorStatistics errors = pipeline.getErrorStatistics();
        assertEquals(1, errors.total());
        assertEquals(1L, errors.byCategory().get(ErrorCategory.SECURITY));
    }

    @Test
    public void testInsufficientDiskSpace() {
        ArtifactDescriptor huge = new ArtifactDescriptor("huge", "1.0.0", server.uriFor("pipeline/huge.bin"),
            "abc123", Long.MAX_VALUE / 4, "bin", 0);

        DiskSpaceException e = assertThrows(DiskSpaceException.class, () -> pipeline.acquire(huge));
        assertEquals(ErrorCategory.DISK_SPACE, e.getCategory());
        assertTrue(server.requestsFor("pipeline/huge.bin").isEmpty());
        assertEquals(1, pipeline.getErrorStatistics().total());
    }

    @Test
    public void testStaleEntryIsReplaced() throws IOException {
        byte[] first = TestArtifacts.content(20_000, 8);
        URI uri = server.publish("pipeline/rolling.bin", first);
        ArtifactDescriptor original = TestArtifacts.describe("rolling", uri, first);
        pipeline.acquire(original);

        byte[] second = TestArtifacts.content(25_000, 9);
        server.publish("pipeline/rolling.bin", second);
        ArtifactDescriptor republished = TestArtifacts.describe("rolling", uri, second);
        assertEquals(CacheStatus.INVALID, pipeline.checkCache(republished).status());

        Path path = pipeline.acquire(republished);
        assertArrayEquals(second, Files.readAllBytes(path));
        assertTrue(pipeline.checkCache(republished).hit());
        assertEquals(1, pipeline.getStats().totalModels());
    }

    @Test
    public void testAcquireAllKeepsOrder() throws IOException {
        List<ArtifactDescriptor> descriptors = List.of(
            TestArtifacts.describe("batch-a", server.publish("pipeline/batch-a.bin", TestArtifacts.content(15_000, 10)),
                TestArtifacts.content(15_000, 10)),
            TestArtifacts.describe("batch-b", server.publish("pipeline/batch-b.bin", TestArtifacts.content(16_000, 11)),
                TestArtifacts.content(16_000, 11)),
            TestArtifacts.describe("batch-c", server.publish("pipeline/batch-c.bin", TestArtifacts.content(17_000, 12)),
                TestArtifacts.content(17_000, 12)));

        List<Path> paths = pipeline.acquireAll(descriptors);
        assertEquals(3, paths.size());
        assertEquals(15_000, Files.size(paths.get(0)));
        assertEquals(16_000, Files.size(paths.get(1)));
        assertEquals(17_000, Files.size(paths.get(2)));
        assertEquals(3, pipeline.getStats().totalModels());
    }

    @Test
    public void testAcquireAllReportsFirstFailure() throws IOException {
        byte[] content = TestArtifacts.content(12_000, 13);
        ArtifactDescriptor good = TestArtifacts.describe("mixed-good", server.publish("pipeline/mixed-good.bin", content), content);
        ArtifactDescriptor bad = new ArtifactDescriptor("mixed-bad", "1.0.0",
            server.publish("pipeline/mixed-bad.bin", content), "abc123", content.length, "bin", 0);

        assertThrows(ValidationException.class, () -> pipeline.acquireAll(List.of(good, bad)));
        assertTrue(pipeline.checkCache(good).hit());
    }

    @Test
    public void testConcurrentCallersShareOneTransfer() throws Exception {
        reconfigure(config().maxBytesPerSecond(256 * 1024).build());
        byte[] content = TestArtifacts.content(256 * 1024, 14);
        URI uri = server.publish("pipeline/shared.bin", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("shared", uri, content);

        CountDownLatch start = new CountDownLatch(1);
        CompletableFuture<Path> first = CompletableFuture.supplyAsync(() -> {
            awaitQuietly(start);
            return pipeline.acquire(descriptor);
        });
        CompletableFuture<Path> second = CompletableFuture.supplyAsync(() -> {
            awaitQuietly(start);
            return pipeline.acquire(descriptor);
        });
        start.countDown();

        assertEquals(first.join(), second.join());
        assertEquals(1, gets("pipeline/shared.bin").size());
        assertArrayEquals(content, Files.readAllBytes(first.join()));
    }

    @Test
    public void testSharedFailureIsRecordedOnce() throws Exception {
        reconfigure(config().maxBytesPerSecond(256 * 1024).build());
        byte[] content = TestArtifacts.content(256 * 1024, 15);
        URI uri = server.publish("pipeline/shared-broken.bin", content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("shared-broken", "1.0.0", uri, "abc123",
            content.length, "bin", 0);

        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Path>> callers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            callers.add(CompletableFuture.supplyAsync(() -> {
                awaitQuietly(start);
                return pipeline.acquire(descriptor);
            }));
        }
        start.countDown();

        for (CompletableFuture<Path> caller : callers) {
            CompletionException e = assertThrows(CompletionException.class, caller::join);
            assertInstanceOf(ValidationException.class, e.getCause());
        }
        assertEquals(1, gets("pipeline/shared-broken.bin").size());
        assertEquals(1, pipeline.getVerifier().listQuarantined().size());
        assertEquals(1, pipeline.getErrorStatistics().total());
        assertEquals(1, events.eventsOf(PipelineEvent.ERROR_RECORDED).size());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
