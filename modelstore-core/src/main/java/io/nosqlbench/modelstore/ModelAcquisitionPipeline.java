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
import io.nosqlbench.modelstore.cache.CacheLookup;
import io.nosqlbench.modelstore.cache.CacheManager;
import io.nosqlbench.modelstore.cache.CacheStats;
import io.nosqlbench.modelstore.cache.CacheStatus;
import io.nosqlbench.modelstore.config.PipelineConfig;
import io.nosqlbench.modelstore.download.DownloadOrchestrator;
import io.nosqlbench.modelstore.errors.AcquisitionException;
import io.nosqlbench.modelstore.errors.ArtifactIOException;
import io.nosqlbench.modelstore.errors.DiskSpaceException;
import io.nosqlbench.modelstore.errors.RecoveryStrategy;
import io.nosqlbench.modelstore.errors.ValidationException;
import io.nosqlbench.modelstore.events.EventSink;
import io.nosqlbench.modelstore.events.Log4jEventSink;
import io.nosqlbench.modelstore.recovery.DiskSpaceInfo;
import io.nosqlbench.modelstore.recovery.ErrorRecord;
import io.nosqlbench.modelstore.recovery.ErrorRecoveryCoordinator;
import io.nosqlbench.modelstore.recovery.ErrorStatistics;
import io.nosqlbench.modelstore.recovery.FallbackRegistration;
import io.nosqlbench.modelstore.recovery.RecoveryContext;
import io.nosqlbench.modelstore.transport.ArtifactTransport;
import io.nosqlbench.modelstore.transport.HttpRangeTransport;
import io.nosqlbench.modelstore.verify.IntegrityVerifier;
import io.nosqlbench.modelstore.verify.VerificationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/// Entry point for acquiring model artifacts.
///
/// For each descriptor: the cache is checked first and a valid entry is returned at once.
/// Otherwise one acquisition per `name@version` runs, with concurrent callers joining it:
/// disk space is checked, the file is downloaded into the cache directory (resuming any partial
/// file), verified, and stored. Transfer failures the coordinator classifies as retryable are
/// retried with backoff up to `maxRetryAttempts`. A verification failure quarantines the file
/// and moves on to the next registered fallback that has not been tried yet.
///
/// Every failure that reaches the caller has been recorded in the error statistics exactly once.
public class ModelAcquisitionPipeline implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ModelAcquisitionPipeline.class);

    private final PipelineConfig config;
    private final ArtifactTransport transport;
    private final CacheManager cache;
    private final IntegrityVerifier verifier;
    private final DownloadOrchestrator orchestrator;
    private final ErrorRecoveryCoordinator coordinator;
    private final ExecutorService batchWorkers;
    private final Set<Throwable> recordedFailures = Collections.newSetFromMap(new WeakHashMap<>());

    public ModelAcquisitionPipeline(
        PipelineConfig config,
        ArtifactTransport transport,
        CacheManager cache,
        IntegrityVerifier verifier,
        DownloadOrchestrator orchestrator,
        ErrorRecoveryCoordinator coordinator
    ) {
        this.config = config;
        this.transport = transport;
        this.cache = cache;
        this.verifier = verifier;
        this.orchestrator = orchestrator;
        this.coordinator = coordinator;
        this.coordinator.setLocalAvailability(cache::contains);
        AtomicInteger counter = new AtomicInteger();
        this.batchWorkers = Executors.newFixedThreadPool(config.maxConcurrentDownloads(), runnable -> {
            Thread thread = new Thread(runnable, "modelstore-acquire-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /// Builds a pipeline over HTTPS with events logged through Log4j.
    public static ModelAcquisitionPipeline create(PipelineConfig config) {
        return create(config, new Log4jEventSink());
    }

    public static ModelAcquisitionPipeline create(PipelineConfig config, EventSink events) {
        HttpRangeTransport transport = HttpRangeTransport.builder()
            .connectTimeout(config.probeTimeout())
            .readTimeout(Duration.ofSeconds(60))
            .maxRequestsPerHost(Math.max(config.maxConcurrentDownloads(), config.connectivityEndpoints().size()))
            .build();
        return new ModelAcquisitionPipeline(
            config,
            transport,
            new CacheManager(config, events),
            new IntegrityVerifier(config, events),
            new DownloadOrchestrator(transport, config, events),
            new ErrorRecoveryCoordinator(transport, config, events));
    }

    /// Returns a verified local file for the descriptor, or for a registered fallback when the
    /// descriptor's own file fails verification.
    ///
    /// @throws AcquisitionException when no usable file could be obtained
    /// @throws io.nosqlbench.modelstore.errors.TransferCancelledException when the transfer was
    /// cancelled
    public Path acquire(ArtifactDescriptor descriptor) {
        CacheLookup lookup = cache.checkCache(descriptor);
        if (lookup.hit()) {
            return lookup.path();
        }
        dropStale(descriptor, lookup);

        Set<String> tried = new HashSet<>();
        ArtifactDescriptor current = descriptor;
        while (true) {
            tried.add(current.id());
            try {
                return join(current);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                ErrorRecord record = categorizeOnce(e, RecoveryContext.of("acquire", current));
                if (record.strategy() != RecoveryStrategy.FALLBACK) {
                    throw e;
                }
                Optional<ArtifactDescriptor> alternative = coordinator.selectFallback(descriptor.name(), record, tried);
                if (alternative.isEmpty()) {
                    throw e;
                }
                logger.warn("{} failed verification ({}); falling back to {}", current.id(), record.message(),
                    alternative.get().id());
                current = alternative.get();
                CacheLookup fallbackLookup = cache.checkCache(current);
                if (fallbackLookup.hit()) {
                    return fallbackLookup.path();
                }
                dropStale(current, fallbackLookup);
            }
        }
    }

    /// Acquires descriptors concurrently, up to `maxConcurrentDownloads` at once.
    ///
    /// @return files in the order of the descriptors
    /// @throws RuntimeException the first failure, in descriptor order, after all have finished
    public List<Path> acquireAll(List<ArtifactDescriptor> descriptors) {
        List<CompletableFuture<Path>> futures = new ArrayList<>(descriptors.size());
        for (ArtifactDescriptor descriptor : descriptors) {
            futures.add(CompletableFuture.supplyAsync(() -> acquire(descriptor), batchWorkers));
        }
        List<Path> paths = new ArrayList<>(descriptors.size());
        RuntimeException first = null;
        for (CompletableFuture<Path> future : futures) {
            try {
                paths.add(future.join());
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException runtime ? runtime : e;
                if (first == null) {
                    first = cause;
                } else {
                    first.addSuppressed(cause);
                }
            }
        }
        if (first != null) {
            throw first;
        }
        return paths;
    }

    /// Deletes quarantined files older than the configured retention.
    ///
    /// @return the number of files removed
    public int cleanupQuarantine() {
        return verifier.cleanup();
    }

    public CacheLookup checkCache(ArtifactDescriptor descriptor) {
        return cache.checkCache(descriptor);
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public ErrorStatistics getErrorStatistics() {
        return coordinator.getErrorStatistics();
    }

    public void registerFallback(String name, FallbackRegistration registration) {
        coordinator.registerFallback(name, registration);
    }

    public CacheManager getCacheManager() {
        return cache;
    }

    public IntegrityVerifier getVerifier() {
        return verifier;
    }

    public DownloadOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ErrorRecoveryCoordinator getCoordinator() {
        return coordinator;
    }

    @Override
    public void close() {
        batchWorkers.shutdownNow();
        orchestrator.close();
        coordinator.close();
        try {
            transport.close();
        } catch (Exception e) {
            logger.warn("Unable to close transport: {}", e.getMessage());
        }
    }

    private Path join(ArtifactDescriptor descriptor) {
        CompletableFuture<Path> shared = cache.acquireOrJoin(descriptor, () -> {
            try {
                return CompletableFuture.completedFuture(fetch(descriptor));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
        try {
            return shared.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    // callers joined to one acquisition all see the same exception instance
    private ErrorRecord categorizeOnce(RuntimeException failure, RecoveryContext<?> context) {
        boolean first;
        synchronized (recordedFailures) {
            first = recordedFailures.add(failure);
        }
        return first ? coordinator.categorize(failure, context) : coordinator.describe(failure, context);
    }

    // an entry which exists but cannot be used would otherwise shadow the fresh download
    private void dropStale(ArtifactDescriptor descriptor, CacheLookup lookup) {
        if (lookup.status() != CacheStatus.MISSING && !cache.isInFlight(descriptor)) {
            logger.info("Replacing {} cache entry for {}", lookup.status(), descriptor.id());
            cache.removeModel(descriptor.name(), descriptor.version());
        }
    }

    // runs in the thread that won the in-flight race; joiners wait on its future
    private Path fetch(ArtifactDescriptor descriptor) {
        Path cacheDir = cache.getCacheDirectory();
        ensureSpace(descriptor, cacheDir);
        Path downloaded = download(descriptor, cacheDir);

        VerificationResult result = verifier.verify(downloaded, descriptor);
        if (!result.valid()) {
            throw new ValidationException(descriptor.id(), result.errors(), result.quarantinePath());
        }
        return cache.storeModel(descriptor, downloaded);
    }

    private void ensureSpace(ArtifactDescriptor descriptor, Path cacheDir) {
        long required = Math.max(0, descriptor.size() - partialSize(descriptor, cacheDir));
        DiskSpaceInfo space = coordinator.validateDiskSpace(cacheDir, required);
        if (!space.sufficient()) {
            throw new DiskSpaceException(descriptor.id(), required + config.minimumFreeSpace(), space.usableBytes());
        }
    }

    private Path download(ArtifactDescriptor descriptor, Path cacheDir) {
        RecoveryContext<Path> context = RecoveryContext.of("download", descriptor);
        for (int attempt = 1; ; attempt++) {
            try {
                return orchestrator.acquire(descriptor, cacheDir);
            } catch (AcquisitionException e) {
                if (e.getCategory().strategy() != RecoveryStrategy.RETRY || attempt >= config.maxRetryAttempts()) {
                    throw e;
                }
                ErrorRecord record = coordinator.categorize(e, context.withAttempt(attempt));
                logger.info("Attempt {} for {} failed ({}); retrying", attempt, descriptor.id(), record.message());
                coordinator.attemptRecovery(record, context.withAttempt(attempt));
            }
        }
    }

    private static long partialSize(ArtifactDescriptor descriptor, Path cacheDir) {
        Path partial = cacheDir.resolve(descriptor.partialFileName());
        try {
            return Files.exists(partial) ? Files.size(partial) : 0L;
        } catch (IOException e) {
            throw new ArtifactIOException(descriptor.id(), partial, "Unable to read partial file size", e);
        }
    }
}
