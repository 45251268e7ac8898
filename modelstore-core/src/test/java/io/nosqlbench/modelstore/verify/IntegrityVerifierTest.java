package io.nosqlbench.modelstore.verify;

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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class IntegrityVerifierTest {
    private static final URI SOURCE = URI.create("https://models.example.com/artifact");

    @TempDir
    Path tempDir;

    private Path quarantineDir;
    private MutableClock clock;
    private MemoryEventSink events;
    private IntegrityVerifier verifier;

    @BeforeEach
    public void setUp() {
        quarantineDir = tempDir.resolve("quarantine");
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        events = new MemoryEventSink();
        verifier = new IntegrityVerifier(quarantineDir, events, clock);
    }

    private Path write(String name, byte[] content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    @Test
    public void testChecksumMismatchIsQuarantined() throws Exception {
        byte[] content = TestArtifacts.content(1000, 1);
        Path file = write("model-1.0.0.bin", content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("model", "1.0.0", SOURCE, "abc123", 1000, "bin", 0);

        VerificationResult result = verifier.verify(file, descriptor);

        assertFalse(result.valid());
        assertEquals(1, result.errors().size());
        assertThat(result.errors().get(0)).contains("Checksum mismatch").contains("abc123");
        assertEquals(QuarantineReason.CHECKSUM_MISMATCH, result.reason());
        assertFalse(Files.exists(file));
        assertNotNull(result.quarantinePath());
        assertTrue(Files.exists(result.quarantinePath()));

        List<QuarantineEntry> quarantined = verifier.listQuarantined();
        assertEquals(1, quarantined.size());
        QuarantineEntry entry = quarantined.get(0);
        assertEquals(QuarantineReason.CHECKSUM_MISMATCH, entry.reason());
        assertEquals(result.quarantinePath(), entry.path());
        assertEquals(file.toString(), entry.originalPath());
        assertEquals("abc123", entry.expectedChecksum());
        assertEquals(result.checksum(), entry.actualChecksum());
        assertEquals(clock.instant(), entry.quarantinedAt());
        assertTrue(Files.exists(quarantineDir.resolve("quarantine.json")));
        assertEquals(1, events.eventsOf(PipelineEvent.QUARANTINE).size());
    }

    @Test
    public void testValidFileIsUntouched() throws Exception {
        byte[] content = TestArtifacts.ggufContent(4096, 2);
        Path file = write("good-1.0.0.gguf", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("good", "1.0.0", SOURCE, content, "gguf");

        VerificationResult result = verifier.verify(file, descriptor);

        assertTrue(result.valid(), () -> String.join(", ", result.errors()));
        assertEquals(descriptor.sha256(), result.checksum());
        assertEquals(4096, result.actualSize());
        assertNull(result.reason());
        assertArrayEquals(content, Files.readAllBytes(file));
        assertTrue(verifier.listQuarantined().isEmpty());
        assertEquals(1, events.eventsOf(PipelineEvent.VERIFY_OK).size());
    }

    @Test
    public void testVerificationIsDeterministic() throws Exception {
        byte[] content = TestArtifacts.content(20_000, 3);
        Path file = write("same-1.0.0.bin", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("same", SOURCE, content);

        VerificationResult first = verifier.verify(file, descriptor);
        VerificationResult second = verifier.verify(file, descriptor);

        assertTrue(first.valid());
        assertEquals(first.valid(), second.valid());
        assertEquals(first.checksum(), second.checksum());
        assertEquals(first.errors(), second.errors());
    }

    @Test
    public void testSizeMismatchReason() throws Exception {
        byte[] content = TestArtifacts.content(512, 4);
        Path file = write("short-1.0.0.bin", content);
        ArtifactDescriptor base = TestArtifacts.describe("short", SOURCE, content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("short", "1.0.0", SOURCE, base.sha256(), 1024, "bin", 0);

        VerificationResult result = verifier.verify(file, descriptor);

        assertFalse(result.valid());
        assertEquals(List.of("File size mismatch: expected 1024 bytes, got 512 bytes"), result.errors());
        assertEquals(QuarantineReason.SIZE_MISMATCH, result.reason());
    }

    @Test
    public void testChecksumTakesPriorityOverSize() throws Exception {
        Path file = write("both-1.0.0.bin", TestArtifacts.content(100, 5));
        ArtifactDescriptor descriptor = new ArtifactDescriptor("both", "1.0.0", SOURCE, "00ff", 200, "bin", 0);

        VerificationResult result = verifier.verify(file, descriptor);

        assertEquals(2, result.errors().size());
        assertEquals(QuarantineReason.CHECKSUM_MISMATCH, result.reason());
    }

    @Test
    public void testCorruptedGgufHeader() throws Exception {
        byte[] content = TestArtifacts.content(4096, 6);
        content[0] = '<';
        Path file = write("broken-1.0.0.gguf", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("broken", "1.0.0", SOURCE, content, "gguf");

        VerificationResult result = verifier.verify(file, descriptor);

        assertFalse(result.valid());
        assertEquals(QuarantineReason.CORRUPTED_HEADER, result.reason());
        assertThat(result.errors().get(0)).contains("header magic");
    }

    @Test
    public void testTooSmallOnnx() throws Exception {
        byte[] content = {0x08, 0x01, 0x12, 0x04};
        Path file = write("tiny-1.0.0.onnx", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("tiny", "1.0.0", SOURCE, content, "onnx");

        VerificationResult result = verifier.verify(file, descriptor);

        assertEquals(QuarantineReason.CORRUPTED_HEADER, result.reason());
        assertThat(result.errors().get(0)).contains("too small");
    }

    @Test
    public void testSafetensorsHeader() throws Exception {
        byte[] json = "{\"__metadata__\":{}}".getBytes(StandardCharsets.US_ASCII);
        ByteBuffer buffer = ByteBuffer.allocate(8 + json.length + 64).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putLong(json.length).put(json);
        byte[] content = buffer.array();
        Path file = write("tensors-1.0.0.safetensors", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("tensors", "1.0.0", SOURCE, content, "safetensors");

        assertTrue(verifier.verify(file, descriptor).valid());
    }

    @Test
    public void testUnknownFormat() throws Exception {
        byte[] content = TestArtifacts.content(128, 7);
        Path file = write("odd-1.0.0.pt", content);
        ArtifactDescriptor descriptor = TestArtifacts.describe("odd", "1.0.0", SOURCE, content, "pt");

        VerificationResult result = verifier.verify(file, descriptor);

        assertEquals(QuarantineReason.INVALID_FORMAT, result.reason());
    }

    @Test
    public void testSkippedChecksCanPass() throws Exception {
        byte[] content = TestArtifacts.content(64, 8);
        Path file = write("loose-1.0.0.bin", content);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("loose", "1.0.0", SOURCE, "abc123", 99, "bin", 0);

        VerificationResult result = verifier.verify(file, descriptor,
            VerificationOptions.all().withoutChecksum().withoutSizeCheck());

        assertTrue(result.valid());
        assertNull(result.checksum());
        assertTrue(Files.exists(file));
    }

    @Test
    public void testMissingFileIsNotQuarantined() {
        ArtifactDescriptor descriptor = new ArtifactDescriptor("ghost", "1.0.0", SOURCE, "abc123", 10, "bin", 0);

        VerificationResult result = verifier.verify(tempDir.resolve("ghost-1.0.0.bin"), descriptor);

        assertFalse(result.valid());
        assertThat(result.errors().get(0)).contains("does not exist");
        assertTrue(verifier.listQuarantined().isEmpty());
    }

    @Test
    public void testRestoreRemovesRecord() throws Exception {
        byte[] content = TestArtifacts.content(300, 9);
        Path file = write("suspect-1.0.0.bin", content);
        Path quarantined = verifier.quarantine(file, QuarantineReason.UNKNOWN_ERROR, "operator request");

        Path restored = tempDir.resolve("restored").resolve("suspect.bin");
        verifier.restore(quarantined, restored);

        assertArrayEquals(content, Files.readAllBytes(restored));
        assertFalse(Files.exists(quarantined));
        assertTrue(verifier.listQuarantined().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> verifier.restore(quarantined, restored));
    }

    @Test
    public void testCleanupByAge() throws Exception {
        Path old = verifier.quarantine(write("old-1.0.0.bin", TestArtifacts.content(10, 10)),
            QuarantineReason.SIZE_MISMATCH, "old");
        clock.advance(Duration.ofDays(5));
        Path recent = verifier.quarantine(write("new-1.0.0.bin", TestArtifacts.content(20, 11)),
            QuarantineReason.CHECKSUM_MISMATCH, "new");
        clock.advance(Duration.ofDays(4));

        assertEquals(1, verifier.cleanup(7));

        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
        QuarantineStats stats = verifier.getQuarantineStats();
        assertEquals(1, stats.count());
        assertEquals(20, stats.totalBytes());
        assertEquals(1, stats.byReason().get(QuarantineReason.CHECKSUM_MISMATCH));
    }

    @Test
    public void testCleanupUsesConfiguredRetention() throws Exception {
        IntegrityVerifier shortLived = new IntegrityVerifier(quarantineDir, 2, events, clock);
        Path old = shortLived.quarantine(write("stale-1.0.0.bin", TestArtifacts.content(10, 13)),
            QuarantineReason.SIZE_MISMATCH, "stale");
        clock.advance(Duration.ofDays(3));
        Path recent = shortLived.quarantine(write("fresh-1.0.0.bin", TestArtifacts.content(10, 14)),
            QuarantineReason.SIZE_MISMATCH, "fresh");

        assertEquals(1, shortLived.cleanup());
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
        assertEquals(0, verifier.cleanup(), "the default retention is a week");
    }

    @Test
    public void testVerifyBatchKeepsOrderAndQuarantinesOnlyFailures() throws Exception {
        byte[] good = TestArtifacts.content(400, 15);
        byte[] bad = TestArtifacts.content(300, 16);
        Path goodFile = write("good-1.0.0.bin", good);
        Path badFile = write("bad-1.0.0.bin", bad);
        Map<Path, ArtifactDescriptor> files = new LinkedHashMap<>();
        files.put(badFile, new ArtifactDescriptor("bad", "1.0.0", SOURCE, "abc123", bad.length, "bin", 0));
        files.put(goodFile, TestArtifacts.describe("good", SOURCE, good));

        Map<Path, VerificationResult> results = verifier.verifyBatch(files, VerificationOptions.all());

        assertEquals(List.of(badFile, goodFile), List.copyOf(results.keySet()));
        assertFalse(results.get(badFile).valid());
        assertEquals(QuarantineReason.CHECKSUM_MISMATCH, results.get(badFile).reason());
        assertTrue(results.get(goodFile).valid());
        assertTrue(Files.exists(goodFile));
        assertFalse(Files.exists(badFile));
        assertEquals(1, verifier.listQuarantined().size());
    }

    @Test
    public void testQuarantineSurvivesRestart() throws Exception {
        verifier.quarantine(write("kept-1.0.0.bin", TestArtifacts.content(10, 12)),
            QuarantineReason.CORRUPTED_HEADER, "kept");

        IntegrityVerifier reopened = new IntegrityVerifier(quarantineDir, events, clock);

        assertEquals(1, reopened.listQuarantined().size());
        assertEquals(QuarantineReason.CORRUPTED_HEADER, reopened.listQuarantined().get(0).reason());
    }

    @Test
    public void testSameNameQuarantinedTwiceGetsDistinctPaths() throws Exception {
        Path first = verifier.quarantine(write("dup-1.0.0.bin", TestArtifacts.content(10, 13)),
            QuarantineReason.UNKNOWN_ERROR, "one");
        Path second = verifier.quarantine(write("dup-1.0.0.bin", TestArtifacts.content(10, 14)),
            QuarantineReason.UNKNOWN_ERROR, "two");

        assertNotEquals(first, second);
        assertEquals(2, verifier.listQuarantined().size());
    }
}
