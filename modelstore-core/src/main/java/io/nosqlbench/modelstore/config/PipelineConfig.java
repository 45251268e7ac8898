package io.nosqlbench.modelstore.config;

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

import io.nosqlbench.modelstore.cache.EvictionStrategy;
import io.nosqlbench.modelstore.errors.ConfigurationException;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Settings for every component of the acquisition pipeline.
///
/// Instances are immutable. Use [#builder()] for programmatic construction or
/// [PipelineConfigLoader] to read a YAML settings file.
///
/// @param cacheDirectory where verified artifacts and partial downloads live
/// @param quarantineDirectory where rejected artifacts are moved
/// @param maxCacheSize total cached bytes allowed before LRU eviction
/// @param maxAge entry age after which AGE eviction removes it
/// @param evictionStrategy the active eviction strategy
/// @param maxConcurrentDownloads transfers allowed in flight at once
/// @param maxBytesPerSecond bandwidth cap per transfer
/// @param bufferSize size of the read buffer used per transfer
/// @param highWaterMark bytes a sink may buffer before the transfer waits for it to drain
/// @param memoryThreshold heap usage above which transfers pause briefly
/// @param quarantineRetentionDays default age for quarantine cleanup
/// @param connectivityEndpoints endpoints probed to decide connectivity
/// @param probeTimeout timeout for each connectivity probe
/// @param connectivityCacheTtl how long a connectivity result is reused
/// @param diskSpaceCacheTtl how long a disk space reading is reused
/// @param minimumFreeSpace free space which must remain beyond the artifact itself
/// @param retryBaseDelay wait before the first retry, doubled on each further attempt
/// @param maxRetryAttempts attempts made for retryable failures, including the first
/// @param allowInsecureLoopback accept plain `http` sources on the loopback interface
public record PipelineConfig(
    Path cacheDirectory,
    Path quarantineDirectory,
    long maxCacheSize,
    Duration maxAge,
    EvictionStrategy evictionStrategy,
    int maxConcurrentDownloads,
    long maxBytesPerSecond,
    int bufferSize,
    int highWaterMark,
    long memoryThreshold,
    int quarantineRetentionDays,
    List<URI> connectivityEndpoints,
    Duration probeTimeout,
    Duration connectivityCacheTtl,
    Duration diskSpaceCacheTtl,
    long minimumFreeSpace,
    Duration retryBaseDelay,
    int maxRetryAttempts,
    boolean allowInsecureLoopback
) {
    public static final long KB = 1024L;
    public static final long MB = 1024L * KB;
    public static final long GB = 1024L * MB;

    public static final List<URI> DEFAULT_ENDPOINTS = List.of(
        URI.create("https://huggingface.co"),
        URI.create("https://api.github.com"),
        URI.create("https://google.com"),
        URI.create("https://1.1.1.1")
    );

    public PipelineConfig {
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(evictionStrategy, "evictionStrategy");
        Objects.requireNonNull(maxAge, "maxAge");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        Objects.requireNonNull(connectivityCacheTtl, "connectivityCacheTtl");
        Objects.requireNonNull(diskSpaceCacheTtl, "diskSpaceCacheTtl");
        Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
        if (quarantineDirectory == null) {
            quarantineDirectory = cacheDirectory.resolve(".quarantine");
        }
        connectivityEndpoints = List.copyOf(connectivityEndpoints == null ? DEFAULT_ENDPOINTS : connectivityEndpoints);
        requirePositive("max-cache-size", maxCacheSize);
        requirePositive("max-concurrent-downloads", maxConcurrentDownloads);
        requirePositive("max-speed", maxBytesPerSecond);
        requirePositive("buffer-size", bufferSize);
        requirePositive("high-water-mark", highWaterMark);
        requirePositive("memory-threshold", memoryThreshold);
        requirePositive("max-retry-attempts", maxRetryAttempts);
        if (quarantineRetentionDays < 0) {
            throw new ConfigurationException("quarantine-retention-days cannot be negative: " + quarantineRetentionDays);
        }
        if (minimumFreeSpace < 0) {
            throw new ConfigurationException("minimum-free-space cannot be negative: " + minimumFreeSpace);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, was " + value);
        }
    }

    /// @return a configuration with every default
    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder initialized from this configuration
    public Builder toBuilder() {
        return new Builder()
            .cacheDirectory(cacheDirectory)
            .quarantineDirectory(quarantineDirectory)
            .maxCacheSize(maxCacheSize)
            .maxAge(maxAge)
            .evictionStrategy(evictionStrategy)
            .maxConcurrentDownloads(maxConcurrentDownloads)
            .maxBytesPerSecond(maxBytesPerSecond)
            .bufferSize(bufferSize)
            .highWaterMark(highWaterMark)
            .memoryThreshold(memoryThreshold)
            .quarantineRetentionDays(quarantineRetentionDays)
            .connectivityEndpoints(connectivityEndpoints)
            .probeTimeout(probeTimeout)
            .connectivityCacheTtl(connectivityCacheTtl)
            .diskSpaceCacheTtl(diskSpaceCacheTtl)
            .minimumFreeSpace(minimumFreeSpace)
            .retryBaseDelay(retryBaseDelay)
            .maxRetryAttempts(maxRetryAttempts)
            .allowInsecureLoopback(allowInsecureLoopback);
    }

    /// Builder for [PipelineConfig].
    public static class Builder {
        private Path cacheDirectory = Path.of(System.getProperty("user.home"), ".cache", "nbmodelstore", "models");
        private Path quarantineDirectory;
        private long maxCacheSize = 5 * GB;
        private Duration maxAge = Duration.ofDays(30);
        private EvictionStrategy evictionStrategy = EvictionStrategy.LRU;
        private int maxConcurrentDownloads = 3;
        private long maxBytesPerSecond = 10 * MB;
        private int bufferSize = (int) (64 * KB);
        private int highWaterMark = (int) (16 * KB);
        private long memoryThreshold = 100 * MB;
        private int quarantineRetentionDays = 7;
        private List<URI> connectivityEndpoints = DEFAULT_ENDPOINTS;
        private Duration probeTimeout = Duration.ofSeconds(5);
        private Duration connectivityCacheTtl = Duration.ofSeconds(60);
        private Duration diskSpaceCacheTtl = Duration.ofSeconds(30);
        private long minimumFreeSpace = GB;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private int maxRetryAttempts = 3;
        private boolean allowInsecureLoopback = false;

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        /// Defaults to `.quarantine` inside the cache directory.
        public Builder quarantineDirectory(Path quarantineDirectory) {
            this.quarantineDirectory = quarantineDirectory;
            return this;
        }

        public Builder maxCacheSize(long maxCacheSize) {
            this.maxCacheSize = maxCacheSize;
            return this;
        }

        public Builder maxAge(Duration maxAge) {
            this.maxAge = maxAge;
            return this;
        }

        public Builder evictionStrategy(EvictionStrategy evictionStrategy) {
            this.evictionStrategy = evictionStrategy;
            return this;
        }

        public Builder maxConcurrentDownloads(int maxConcurrentDownloads) {
            this.maxConcurrentDownloads = maxConcurrentDownloads;
            return this;
        }

        public Builder maxBytesPerSecond(long maxBytesPerSecond) {
            this.maxBytesPerSecond = maxBytesPerSecond;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder highWaterMark(int highWaterMark) {
            this.highWaterMark = highWaterMark;
            return this;
        }

        public Builder memoryThreshold(long memoryThreshold) {
            this.memoryThreshold = memoryThreshold;
            return this;
        }

        public Builder quarantineRetentionDays(int quarantineRetentionDays) {
            this.quarantineRetentionDays = quarantineRetentionDays;
            return this;
        }

        public Builder connectivityEndpoints(List<URI> connectivityEndpoints) {
            this.connectivityEndpoints = connectivityEndpoints;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder connectivityCacheTtl(Duration connectivityCacheTtl) {
            this.connectivityCacheTtl = connectivityCacheTtl;
            return this;
        }

        public Builder diskSpaceCacheTtl(Duration diskSpaceCacheTtl) {
            this.diskSpaceCacheTtl = diskSpaceCacheTtl;
            return this;
        }

        public Builder minimumFreeSpace(long minimumFreeSpace) {
            this.minimumFreeSpace = minimumFreeSpace;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder allowInsecureLoopback(boolean allowInsecureLoopback) {
            this.allowInsecureLoopback = allowInsecureLoopback;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(cacheDirectory, quarantineDirectory, maxCacheSize, maxAge, evictionStrategy,
                maxConcurrentDownloads, maxBytesPerSecond, bufferSize, highWaterMark, memoryThreshold,
                quarantineRetentionDays, connectivityEndpoints, probeTimeout, connectivityCacheTtl, diskSpaceCacheTtl,
                minimumFreeSpace, retryBaseDelay, maxRetryAttempts, allowInsecureLoopback);
        }
    }
}
