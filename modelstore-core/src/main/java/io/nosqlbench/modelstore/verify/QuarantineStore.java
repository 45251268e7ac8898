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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.nosqlbench.modelstore.errors.ArtifactIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The quarantine directory and its `quarantine.json` index.
///
/// Files are stored as `<epochMillis>_<originalName>`. The index is rewritten after every change
/// and read once at construction, so entries survive restarts. All methods are synchronized.
class QuarantineStore {
    private static final Logger logger = LogManager.getLogger(QuarantineStore.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final Type ENTRY_LIST = new TypeToken<List<QuarantineEntry>>() {}.getType();

    static final String INDEX_FILE = "quarantine.json";

    private final Path directory;
    private final Clock clock;
    private final Map<String, QuarantineEntry> entries = new LinkedHashMap<>();

    QuarantineStore(Path directory, Clock clock) {
        this.directory = directory.toAbsolutePath();
        this.clock = clock;
        loadIndex();
    }

    Path getDirectory() {
        return directory;
    }

    /// Moves the file into quarantine and records it.
    synchronized QuarantineEntry add(Path file, QuarantineReason reason, String detail,
                                     String expectedChecksum, String actualChecksum,
                                     long expectedSize, long actualSize) {
        long now = clock.millis();
        try {
            Files.createDirectories(directory);
            Path target = uniqueTarget(now, file.getFileName().toString());
            moveFile(file, target);
            QuarantineEntry entry = new QuarantineEntry(target.toString(), file.toAbsolutePath().toString(), reason,
                now, expectedChecksum, actualChecksum, expectedSize, actualSize, detail);
            entries.put(entry.quarantinePath(), entry);
            saveIndex();
            logger.warn("quarantined {} as {} ({})", file, target.getFileName(), reason);
            return entry;
        } catch (IOException e) {
            throw new ArtifactIOException(null, file, "Unable to quarantine file", e);
        }
    }

    synchronized List<QuarantineEntry> list() {
        return new ArrayList<>(entries.values());
    }

    /// Copies the quarantined file to the target, then removes it and its record.
    synchronized QuarantineEntry restore(Path quarantinePath, Path targetPath) {
        QuarantineEntry entry = entries.get(quarantinePath.toAbsolutePath().toString());
        if (entry == null) {
            throw new IllegalArgumentException("Not a quarantined file: " + quarantinePath);
        }
        try {
            Path parent = targetPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(entry.path(), targetPath, StandardCopyOption.REPLACE_EXISTING);
            Files.delete(entry.path());
        } catch (IOException e) {
            throw new ArtifactIOException(null, quarantinePath, "Unable to restore quarantined file", e);
        }
        entries.remove(entry.quarantinePath());
        saveIndex();
        logger.info("restored {} to {}", quarantinePath, targetPath);
        return entry;
    }

    /// Removes entries, and their files, quarantined more than `maxAge` ago.
    synchronized int cleanup(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        int removed = 0;
        for (QuarantineEntry entry : new ArrayList<>(entries.values())) {
            if (entry.timestamp() < cutoff) {
                try {
                    Files.deleteIfExists(entry.path());
                } catch (IOException e) {
                    logger.warn("unable to delete quarantined file {}: {}", entry.path(), e.getMessage());
                    continue;
                }
                entries.remove(entry.quarantinePath());
                removed++;
            }
        }
        if (removed > 0) {
            saveIndex();
        }
        return removed;
    }

    synchronized QuarantineStats stats() {
        Map<QuarantineReason, Integer> byReason = new EnumMap<>(QuarantineReason.class);
        long totalBytes = 0;
        for (QuarantineEntry entry : entries.values()) {
            byReason.merge(entry.reason(), 1, Integer::sum);
            try {
                if (Files.exists(entry.path())) {
                    totalBytes += Files.size(entry.path());
                }
            } catch (IOException e) {
                logger.debug("unable to size {}: {}", entry.path(), e.getMessage());
            }
        }
        return new QuarantineStats(entries.size(), totalBytes, byReason);
    }

    private Path uniqueTarget(long now, String fileName) {
        Path target = directory.resolve(now + "_" + fileName);
        int n = 1;
        while (Files.exists(target) || entries.containsKey(target.toString())) {
            target = directory.resolve(now + "_" + fileName + "-" + n++);
        }
        return target;
    }

    private static void moveFile(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private void loadIndex() {
        Path index = directory.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return;
        }
        try {
            List<QuarantineEntry> loaded = gson.fromJson(Files.readString(index), ENTRY_LIST);
            if (loaded != null) {
                for (QuarantineEntry entry : loaded) {
                    entries.put(entry.quarantinePath(), entry);
                }
            }
            logger.debug("loaded {} quarantine entries from {}", entries.size(), index);
        } catch (IOException | JsonParseException e) {
            logger.warn("ignoring unreadable quarantine index {}: {}", index, e.getMessage());
        }
    }

    private void saveIndex() {
        Path index = directory.resolve(INDEX_FILE);
        Path temp = directory.resolve(INDEX_FILE + ".tmp");
        try {
            Files.createDirectories(directory);
            Files.writeString(temp, gson.toJson(new ArrayList<>(entries.values()), ENTRY_LIST));
            Files.move(temp, index, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactIOException(null, index, "Unable to write quarantine index", e);
        }
    }
}
