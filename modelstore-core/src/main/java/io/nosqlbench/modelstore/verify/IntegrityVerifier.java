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

import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.artifact.ContainerFormat;
import io.nosqlbench.modelstore.config.PipelineConfig;
import io.nosqlbench.modelstore.events.EventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Verifies downloaded artifacts and quarantines the ones that fail.
///
/// Verification runs, unless skipped: a SHA-256 over the whole file compared with the
/// descriptor, a size comparison, and a container header check. The file itself is never
/// modified. If any check fails it is moved into the quarantine directory, and the first
/// failing check in the order checksum, size, format decides the recorded reason.
///
/// Verifying the same unchanged file twice gives the same result and the same checksum.
public class IntegrityVerifier {
    private static final Logger logger = LogManager.getLogger(IntegrityVerifier.class);

    public static final int DEFAULT_RETENTION_DAYS = 7;

    private final QuarantineStore quarantine;
    private final int retentionDays;
    private final EventSink events;
    private final Clock clock;

    /// Uses the configured quarantine directory and retention.
    public IntegrityVerifier(PipelineConfig config, EventSink events) {
        this(config.quarantineDirectory(), config.quarantineRetentionDays(), events, Clock.systemUTC());
    }

    /// @param quarantineDirectory where failed files are moved
    /// @param events receives verification and quarantine events
    /// @param clock time source for quarantine timestamps and cleanup
    public IntegrityVerifier(Path quarantineDirectory, EventSink events, Clock clock) {
        this(quarantineDirectory, DEFAULT_RETENTION_DAYS, events, clock);
    }

    /// @param quarantineDirectory where failed files are moved
    /// @param retentionDays age after which [#cleanup()] deletes quarantined files
    /// @param events receives verification and quarantine events
    /// @param clock time source for quarantine timestamps and cleanup
    public IntegrityVerifier(Path quarantineDirectory, int retentionDays, EventSink events, Clock clock) {
        this.quarantine = new QuarantineStore(quarantineDirectory, clock);
        this.retentionDays = retentionDays;
        this.events = events;
        this.clock = clock;
    }

    /// Verifies with every check enabled.
    public VerificationResult verify(Path file, ArtifactDescriptor descriptor) {
        return verify(file, descriptor, VerificationOptions.all());
    }

    /// Verifies a file against a descriptor, quarantining it on failure.
    ///
    /// A missing file is reported as invalid without touching quarantine.
    ///
    /// @param file the file to verify
    /// @param descriptor what the file should be
    /// @param options checks to skip
    /// @return the result; when invalid, [VerificationResult#quarantinePath()] tells where
    /// the file went
    public VerificationResult verify(Path file, ArtifactDescriptor descriptor, VerificationOptions options) {
        Instant start = clock.instant();
        if (!Files.isRegularFile(file)) {
            return new VerificationResult(false, List.of("File does not exist: " + file), null, -1L,
                QuarantineReason.UNKNOWN_ERROR, null, Duration.between(start, clock.instant()));
        }

        List<String> errors = new ArrayList<>();
        QuarantineReason reason = null;
        String checksum = null;
        long actualSize = -1L;
        try {
            actualSize = Files.size(file);
            if (!options.skipChecksum()) {
                checksum = Checksums.sha256(file);
                if (!checksum.equalsIgnoreCase(descriptor.sha256())) {
                    errors.add("Checksum mismatch: expected " + descriptor.sha256() + ", got " + checksum);
                    reason = QuarantineReason.CHECKSUM_MISMATCH;
                }
            }
            if (!options.skipSizeCheck() && actualSize != descriptor.size()) {
                errors.add("File size mismatch: expected " + descriptor.size() + " bytes, got " + actualSize + " bytes");
                reason = reason != null ? reason : QuarantineReason.SIZE_MISMATCH;
            }
            if (!options.skipFormatCheck()) {
                Optional<ContainerFormat> format = ContainerFormat.fromTag(descriptor.format());
                if (format.isEmpty()) {
                    errors.add("Unsupported container format: " + descriptor.format());
                    reason = reason != null ? reason : QuarantineReason.INVALID_FORMAT;
                } else {
                    Optional<String> problem = FormatInspector.inspect(file, format.get());
                    if (problem.isPresent()) {
                        errors.add(problem.get());
                        reason = reason != null ? reason : QuarantineReason.CORRUPTED_HEADER;
                    }
                }
            }
        } catch (IOException e) {
            errors.add("Verification failed: " + e.getMessage());
            reason = reason != null ? reason : QuarantineReason.UNKNOWN_ERROR;
        }

        Duration elapsed = Duration.between(start, clock.instant());
        if (errors.isEmpty()) {
            logger.debug("verified {} in {}", file, elapsed);
            events.log(PipelineEvent.VERIFY_OK, Map.of(
                "path", file.toString(),
                "checksum", checksum != null ? checksum : "skipped"));
            return new VerificationResult(true, errors, checksum, actualSize, null, null, elapsed);
        }

        VerificationResult result = new VerificationResult(false, errors, checksum, actualSize, reason, null, elapsed);
        events.log(PipelineEvent.VERIFY_FAIL, Map.of(
            "path", file.toString(),
            "reason", reason.name(),
            "text", String.join("; ", errors)));
        QuarantineEntry entry = quarantine.add(file, reason, String.join("; ", errors),
            descriptor.sha256(), checksum, descriptor.size(), actualSize);
        events.log(PipelineEvent.QUARANTINE, Map.of(
            "path", file.toString(),
            "quarantined", entry.quarantinePath(),
            "reason", reason.name()));
        return result.quarantinedAt(entry.path());
    }

    /// Verifies several files, keeping the iteration order of the map.
    public Map<Path, VerificationResult> verifyBatch(Map<Path, ArtifactDescriptor> files, VerificationOptions options) {
        Map<Path, VerificationResult> results = new LinkedHashMap<>();
        files.forEach((file, descriptor) -> results.put(file, verify(file, descriptor, options)));
        return results;
    }

    /// Moves a file into quarantine without verifying it.
    ///
    /// @param file the file to isolate
    /// @param reason why
    /// @param detail free text
    /// @return the file's new location
    public Path quarantine(Path file, QuarantineReason reason, String detail) {
        long size = -1L;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            logger.debug("unable to size {} before quarantine: {}", file, e.getMessage());
        }
        QuarantineEntry entry = quarantine.add(file, reason, detail, null, null, -1L, size);
        events.log(PipelineEvent.QUARANTINE, Map.of(
            "path", file.toString(),
            "quarantined", entry.quarantinePath(),
            "reason", reason.name()));
        return entry.path();
    }

    /// @return every quarantine entry, oldest first
    public List<QuarantineEntry> listQuarantined() {
        return quarantine.list();
    }

    /// Copies a quarantined file to the target path and forgets the quarantine entry.
    ///
    /// @param quarantinePath a path returned by [#quarantine] or [VerificationResult#quarantinePath()]
    /// @param targetPath where to put the file
    /// @throws IllegalArgumentException if the path is not a known quarantined file
    public void restore(Path quarantinePath, Path targetPath) {
        quarantine.restore(quarantinePath, targetPath);
        events.log(PipelineEvent.RESTORE, Map.of(
            "quarantined", quarantinePath.toString(),
            "target", targetPath.toString()));
    }

    /// Deletes quarantine entries older than the configured retention.
    ///
    /// @return the number of entries removed
    public int cleanup() {
        return cleanup(retentionDays);
    }

    /// Deletes quarantine entries older than the given age.
    ///
    /// @param maxAgeDays age threshold in days
    /// @return the number of entries removed
    public int cleanup(int maxAgeDays) {
        int removed = quarantine.cleanup(Duration.ofDays(maxAgeDays));
        events.log(PipelineEvent.QUARANTINE_PURGE, Map.of("count", (long) removed));
        return removed;
    }

    public QuarantineStats getQuarantineStats() {
        return quarantine.stats();
    }

    /// @return the quarantine directory
    public Path getQuarantineDirectory() {
        return quarantine.getDirectory();
    }
}
