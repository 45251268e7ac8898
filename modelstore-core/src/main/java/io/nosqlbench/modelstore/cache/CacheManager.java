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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.config.PipelineConfig;
import io.nosqlbench.modelstore.errors.ArtifactIOException;
import io.nosqlbench.modelstore.events.EventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/// Maps artifact descriptors to verified files in the cache directory.
///
/// The index of entries is the only writer of cache metadata. Lookups, stores, removals and
/// eviction all run under the same monitor, so a lookup never sees a half-stored or
/// half-evicted entry. The index is saved to `cache-index.json` after every change.
///
/// The manager also tracks acquisitions in flight. [#acquireOrJoin] starts at most one
/// acquisition per `name@version`; later callers receive the same future.
///
/// Files handed to [#storeModel] must already have passed verification.
public class CacheManager {
    private static final Logger logger = LogManager.getLogger(CacheManager.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final Type ENTRY_LIST = new TypeToken<List<CacheEntry>>() {}.getType();

    public static final String INDEX_FILE = "cache-index.json";

    private final Path cacheDirectory;
    private final long maxCacheSize;
    private final Duration maxAge;
    private final EvictionStrategy strategy;
    private final EventSink events;
    private final Clock clock;

    private final Map<String, CacheEntry> index = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Path>> inFlight = new ConcurrentHashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    public CacheManager(PipelineConfig config, EventSink events) {
        this(config.cacheDirectory(), config.maxCacheSize(), config.maxAge(), config.evictionStrategy(),
            events, Clock.systemUTC());
    }

    /// @param cacheDirectory where cached files live
    /// @param maxCacheSize total bytes kept under LRU eviction
    /// @param maxAge entry age limit under AGE eviction
    /// @param strategy the active eviction strategy
    /// @param events receives cache events
    /// @param clock time source for access and storage times
    public CacheManager(Path cacheDirectory, long maxCacheSize, Duration maxAge, EvictionStrategy strategy,
                        EventSink events, Clock clock) {
        this.cacheDirectory = cacheDirectory.toAbsolutePath();
        this.maxCacheSize = maxCacheSize;
        this.maxAge = maxAge;
        this.strategy = strategy;
        this.events = events;
        this.clock = clock;
        try {
            Files.createDirectories(this.cacheDirectory);
        } catch (IOException e) {
            throw new ArtifactIOException(null, this.cacheDirectory, "Unable to create cache directory", e);
        }
        loadIndex();
    }

    /// @return the canonical cache location of the descriptor's file
    public Path pathFor(ArtifactDescriptor descriptor) {
        return cacheDirectory.resolve(descriptor.fileName());
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    /// Looks up a descriptor. A hit needs an entry for the same name, version and checksum
    /// whose file still exists with the recorded size. Hits update the access time and count.
    ///
    /// @param descriptor the wanted artifact
    /// @return the lookup result
    public synchronized CacheLookup checkCache(ArtifactDescriptor descriptor) {
        CacheEntry entry = index.get(descriptor.id());
        CacheLookup lookup = lookup(descriptor, entry);
        if (lookup.hit()) {
            hits++;
            CacheEntry accessed = entry.accessed(clock.millis());
            index.put(accessed.id(), accessed);
            saveIndex();
            events.log(PipelineEvent.CACHE_HIT, Map.of("id", descriptor.id()));
            return new CacheLookup(CacheStatus.VALID, lookup.path(), accessed);
        }
        misses++;
        events.log(PipelineEvent.CACHE_MISS, Map.of("id", descriptor.id(), "status", lookup.status().name()));
        return lookup;
    }

    /// @return true when a valid entry exists; unlike [#checkCache] this counts neither a hit nor a
    /// miss and leaves access times alone
    public synchronized boolean contains(ArtifactDescriptor descriptor) {
        return lookup(descriptor, index.get(descriptor.id())).hit();
    }

    private CacheLookup lookup(ArtifactDescriptor descriptor, CacheEntry entry) {
        if (entry == null) {
            return CacheLookup.miss(CacheStatus.MISSING, null);
        }
        Path file = entry.file();
        if (!Files.isRegularFile(file)) {
            index.remove(entry.id());
            saveIndex();
            return CacheLookup.miss(CacheStatus.MISSING, entry);
        }
        if (!entry.sha256().equalsIgnoreCase(descriptor.sha256())) {
            return CacheLookup.miss(CacheStatus.INVALID, entry);
        }
        try {
            if (Files.size(file) != entry.size()) {
                return CacheLookup.miss(CacheStatus.CORRUPTED, entry);
            }
        } catch (IOException e) {
            logger.warn("unable to size cached file {}: {}", file, e.getMessage());
            return CacheLookup.miss(CacheStatus.CORRUPTED, entry);
        }
        if (strategy == EvictionStrategy.AGE && isExpired(entry, clock.millis())) {
            return CacheLookup.miss(CacheStatus.OUTDATED, entry);
        }
        return new CacheLookup(CacheStatus.VALID, file, entry);
    }

    /// Records a verified file. The file is moved to its canonical cache path if it is not
    /// already there, replacing any previous entry for the same name and version. Eviction
    /// runs before returning if the cache is over its limits; the new entry is never evicted
    /// by this call.
    ///
    /// @param descriptor the artifact the file holds
    /// @param file a file which has passed verification
    /// @return the cached location
    public synchronized Path storeModel(ArtifactDescriptor descriptor, Path file) {
        Path target = pathFor(descriptor);
        long size;
        try {
            if (!file.toAbsolutePath().equals(target)) {
                moveInto(file, target);
            }
            size = Files.size(target);
        } catch (IOException e) {
            throw new ArtifactIOException(descriptor.id(), file, "Unable to store file in cache", e);
        }
        long now = clock.millis();
        CacheEntry entry = new CacheEntry(descriptor.name(), descriptor.version(), descriptor.sha256(),
            descriptor.format(), target.toString(), size, now, now, 0);
        index.put(entry.id(), entry);
        saveIndex();
        events.log(PipelineEvent.CACHE_STORE, Map.of("id", entry.id(), "size", size));
        evict(entry.id());
        return target;
    }

    /// Removes entries and their files.
    ///
    /// @param name artifact name
    /// @param version a version, or null for every version of the name
    /// @return the number of entries removed
    public synchronized int removeModel(String name, String version) {
        List<CacheEntry> doomed = new ArrayList<>();
        for (CacheEntry entry : index.values()) {
            if (entry.name().equals(name) && (version == null || entry.version().equals(version))) {
                doomed.add(entry);
            }
        }
        for (CacheEntry entry : doomed) {
            deleteEntry(entry);
        }
        if (!doomed.isEmpty()) {
            saveIndex();
        }
        return doomed.size();
    }

    /// Removes every entry and its file.
    public synchronized void clear() {
        for (CacheEntry entry : new ArrayList<>(index.values())) {
            deleteEntry(entry);
        }
        saveIndex();
    }

    /// Runs the configured eviction strategy.
    ///
    /// @return ids of the evicted entries
    public synchronized List<String> cleanup() {
        return evict(null);
    }

    private List<String> evict(String protectedId) {
        List<String> evicted = new ArrayList<>();
        long now = clock.millis();
        if (strategy == EvictionStrategy.AGE) {
            for (CacheEntry entry : new ArrayList<>(index.values())) {
                if (!entry.id().equals(protectedId) && isExpired(entry, now)) {
                    evicted.add(evictEntry(entry));
                }
            }
        } else {
            List<CacheEntry> byAccess = new ArrayList<>(index.values());
            byAccess.sort(Comparator.comparingLong(CacheEntry::lastAccess).thenComparingLong(CacheEntry::storedAt));
            long total = totalSize();
            for (CacheEntry entry : byAccess) {
                if (total <= maxCacheSize) {
                    break;
                }
                if (entry.id().equals(protectedId)) {
                    continue;
                }
                evicted.add(evictEntry(entry));
                total -= entry.size();
            }
            if (total > maxCacheSize) {
                logger.warn("cache holds {} bytes, over the {} byte limit, after evicting all other entries",
                    total, maxCacheSize);
            }
        }
        if (!evicted.isEmpty()) {
            saveIndex();
        }
        return evicted;
    }

    private String evictEntry(CacheEntry entry) {
        deleteEntry(entry);
        evictions++;
        events.log(PipelineEvent.CACHE_EVICT, Map.of("id", entry.id(), "reason", strategy.name()));
        return entry.id();
    }

    private void deleteEntry(CacheEntry entry) {
        index.remove(entry.id());
        try {
            Files.deleteIfExists(entry.file());
        } catch (IOException e) {
            throw new ArtifactIOException(entry.id(), entry.file(), "Unable to delete cached file", e);
        }
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return now - entry.storedAt() > maxAge.toMillis();
    }

    private long totalSize() {
        return index.values().stream().mapToLong(CacheEntry::size).sum();
    }

    /// @return a snapshot of cache totals and counters
    public synchronized CacheStats getStats() {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        CacheEntry oldest = index.values().stream().min(Comparator.comparingLong(CacheEntry::storedAt)).orElse(null);
        CacheEntry newest = index.values().stream().max(Comparator.comparingLong(CacheEntry::storedAt)).orElse(null);
        return new CacheStats(index.size(), totalSize(), hitRate, hits, misses, evictions,
            oldest != null ? oldest.storedInstant() : null,
            newest != null ? newest.storedInstant() : null);
    }

    /// @return a snapshot of all entries
    public synchronized List<CacheEntry> listEntries() {
        return new ArrayList<>(index.values());
    }

    /// Runs an acquisition unless one is already in flight for the same `name@version`, in
    /// which case the caller joins it. The winner re-checks the cache first, so a caller
    /// arriving just after another acquisition finished gets the stored file.
    ///
    /// @param descriptor the wanted artifact
    /// @param acquisition starts the real download, verification and storage
    /// @return a future for the cached path
    public CompletableFuture<Path> acquireOrJoin(ArtifactDescriptor descriptor,
                                                 Supplier<CompletableFuture<Path>> acquisition) {
        String id = descriptor.id();
        CompletableFuture<Path> promise = new CompletableFuture<>();
        CompletableFuture<Path> existing = inFlight.putIfAbsent(id, promise);
        if (existing != null) {
            events.log(PipelineEvent.CACHE_JOIN, Map.of("id", id));
            return existing;
        }

        CompletableFuture<Path> work;
        try {
            Path cached = recheck(descriptor);
            work = cached != null ? CompletableFuture.completedFuture(cached) : acquisition.get();
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }
        work.whenComplete((path, error) -> {
            inFlight.remove(id, promise);
            if (error != null) {
                promise.completeExceptionally(error);
            } else {
                promise.complete(path);
            }
        });
        return promise;
    }

    // lookup for the in-flight winner; does not count towards hits and misses
    private synchronized Path recheck(ArtifactDescriptor descriptor) {
        CacheEntry entry = index.get(descriptor.id());
        CacheLookup lookup = lookup(descriptor, entry);
        if (!lookup.hit()) {
            return null;
        }
        CacheEntry accessed = entry.accessed(clock.millis());
        index.put(accessed.id(), accessed);
        saveIndex();
        return lookup.path();
    }

    /// @return true while an acquisition for the descriptor is in flight
    public boolean isInFlight(ArtifactDescriptor descriptor) {
        return inFlight.containsKey(descriptor.id());
    }

    private static void moveInto(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            Files.delete(source);
        }
    }

    private void loadIndex() {
        Path indexFile = cacheDirectory.resolve(INDEX_FILE);
        if (!Files.exists(indexFile)) {
            return;
        }
        try {
            List<CacheEntry> loaded = gson.fromJson(Files.readString(indexFile), ENTRY_LIST);
            if (loaded == null) {
                return;
            }
            int dropped = 0;
            for (CacheEntry entry : loaded) {
                if (Files.isRegularFile(entry.file())) {
                    index.put(entry.id(), entry);
                } else {
                    dropped++;
                }
            }
            logger.debug("loaded {} cache entries from {}, dropped {} with missing files",
                index.size(), indexFile, dropped);
        } catch (IOException | JsonParseException e) {
            logger.warn("ignoring unreadable cache index {}: {}", indexFile, e.getMessage());
        }
    }

    private void saveIndex() {
        Path indexFile = cacheDirectory.resolve(INDEX_FILE);
        Path temp = cacheDirectory.resolve(INDEX_FILE + ".tmp");
        try {
            Files.writeString(temp, gson.toJson(new ArrayList<>(index.values()), ENTRY_LIST));
            Files.move(temp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactIOException(null, indexFile, "Unable to write cache index", e);
        }
    }
}
