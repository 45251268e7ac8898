package io.nosqlbench.modelstore.download;

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
import io.nosqlbench.modelstore.config.PipelineConfig;
import io.nosqlbench.modelstore.errors.AcquisitionException;
import io.nosqlbench.modelstore.errors.ArtifactIOException;
import io.nosqlbench.modelstore.errors.NetworkException;
import io.nosqlbench.modelstore.errors.TransferCancelledException;
import io.nosqlbench.modelstore.events.EventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
import io.nosqlbench.modelstore.transport.ArtifactTransport;
import io.nosqlbench.modelstore.transport.RangeRequest;
import io.nosqlbench.modelstore.transport.TransferResponse;
import io.nosqlbench.modelstore.transport.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/// Moves artifact bytes from a remote source into `<dest>/<name>-<version>.<format>`.
///
/// Bytes are streamed into `<name>-<version>.<format>.partial`, which is renamed atomically once
/// the server-reported total has arrived. A later attempt resumes from the partial file's size with
/// a `Range` request. When the server ignores the range and answers `200`, the partial file is
/// restarted from zero. A failed or cancelled transfer always leaves its partial file in place.
///
/// Each transfer runs on a bounded worker pool sized by `maxConcurrentDownloads`. Within a
/// transfer the loop suspends only at network reads, sink drains, throttle delays and memory
/// pauses. The orchestrator never retries on its own; failures are raised as
/// [NetworkException], [ArtifactIOException] or
/// [io.nosqlbench.modelstore.errors.SecurityViolationException] for the caller to route.
public class DownloadOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DownloadOrchestrator.class);

    static final int SPEED_HISTORY_LIMIT = 1000;
    static final long MEMORY_PAUSE_MILLIS = 100;
    private static final int RECENT_SPEED_SAMPLES = 10;

    private final ArtifactTransport transport;
    private final PipelineConfig config;
    private final EventSink events;
    private final UrlPolicy urlPolicy;
    private final MemoryProbe memory;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ThreadPoolExecutor executor;

    private final AtomicReference<DownloadSettings> settings;
    private final Map<String, TransferState> transfers = new ConcurrentHashMap<>();
    private final Map<String, String> validators = new ConcurrentHashMap<>();
    private final Deque<Double> speedHistory = new ArrayDeque<>();
    private final AtomicLong completedDownloads = new AtomicLong();
    private final AtomicLong failedDownloads = new AtomicLong();
    private final AtomicLong totalBytes = new AtomicLong();

    public DownloadOrchestrator(ArtifactTransport transport, PipelineConfig config, EventSink events) {
        this(transport, config, events, MemoryProbe.runtime(), Sleeper.system(), Clock.systemUTC());
    }

    DownloadOrchestrator(
        ArtifactTransport transport,
        PipelineConfig config,
        EventSink events,
        MemoryProbe memory,
        Sleeper sleeper,
        Clock clock
    ) {
        this.transport = transport;
        this.config = config;
        this.events = events;
        this.urlPolicy = new UrlPolicy(config.allowInsecureLoopback());
        this.memory = memory;
        this.sleeper = sleeper;
        this.clock = clock;
        this.settings = new AtomicReference<>(new DownloadSettings(
            config.maxConcurrentDownloads(), config.bufferSize(), config.maxBytesPerSecond()));
        int workers = config.maxConcurrentDownloads();
        this.executor = new ThreadPoolExecutor(workers, workers, 30, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(), new TransferThreadFactory());
    }

    /// Downloads one artifact and waits for it.
    ///
    /// @param descriptor what to fetch
    /// @param destinationDir where the final and partial files live
    /// @return the final file
    /// @throws AcquisitionException when the transfer fails
    /// @throws TransferCancelledException when the transfer is cancelled
    public Path acquire(ArtifactDescriptor descriptor, Path destinationDir) {
        return await(acquireAsync(descriptor, destinationDir));
    }

    /// Starts downloading one artifact on the worker pool.
    ///
    /// Only one transfer per `name@version` may be active; a second request while one is running
    /// fails with [IllegalStateException]. Callers that need to share a transfer coalesce through
    /// the cache.
    public CompletableFuture<Path> acquireAsync(ArtifactDescriptor descriptor, Path destinationDir) {
        TransferState state = new TransferState(descriptor, clock);
        if (transfers.putIfAbsent(descriptor.id(), state) != null) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Transfer already in progress: " + descriptor.id()));
        }
        try {
            return CompletableFuture.supplyAsync(() -> run(state, destinationDir), executor);
        } catch (RejectedExecutionException e) {
            transfers.remove(descriptor.id(), state);
            throw e;
        }
    }

    /// Downloads artifacts in batches of at most `maxConcurrentDownloads`.
    ///
    /// All members of a batch start together and are awaited together. When any member fails,
    /// the failed members are retried one at a time and the first failure that repeats is
    /// raised.
    ///
    /// @return final files in the order of the descriptors
    public List<Path> acquireMany(List<ArtifactDescriptor> descriptors, Path destinationDir) {
        List<Path> results = new ArrayList<>(descriptors.size());
        int batchSize = Math.max(1, settings.get().maxConcurrentDownloads());
        for (int start = 0; start < descriptors.size(); start += batchSize) {
            List<ArtifactDescriptor> batch = descriptors.subList(start, Math.min(descriptors.size(), start + batchSize));
            logger.debug("Starting batch of {} transfers at index {}", batch.size(), start);
            List<CompletableFuture<Path>> futures = new ArrayList<>(batch.size());
            for (ArtifactDescriptor descriptor : batch) {
                futures.add(acquireAsync(descriptor, destinationDir));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
                for (CompletableFuture<Path> future : futures) {
                    results.add(future.join());
                }
            } catch (CompletionException | CancellationException batchFailure) {
                logger.warn("Batch starting at index {} failed, acquiring its members sequentially: {}",
                    start, batchFailure.getMessage());
                for (int i = 0; i < batch.size(); i++) {
                    results.add(sequentialFallback(batch.get(i), futures.get(i), destinationDir));
                }
            }
        }
        return results;
    }

    private Path sequentialFallback(ArtifactDescriptor descriptor, CompletableFuture<Path> attempt, Path destinationDir) {
        try {
            return attempt.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException(descriptor.id(), 0);
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            if (cause instanceof CancellationException cancelled) {
                throw cancelled;
            }
            logger.info("Retrying {} on its own after: {}", descriptor.id(), cause.getMessage());
            return acquire(descriptor, destinationDir);
        }
    }

    /// @return true if the transfer was pending or running and is now paused
    public boolean pause(String transferId) {
        TransferState state = transfers.get(transferId);
        if (state != null && state.pause()) {
            events.log(PipelineEvent.TRANSFER_PAUSE, Map.of("id", transferId));
            return true;
        }
        return false;
    }

    /// @return true if the transfer was paused and is now running again
    public boolean resume(String transferId) {
        TransferState state = transfers.get(transferId);
        if (state != null && state.resume()) {
            events.log(PipelineEvent.TRANSFER_RESUME, Map.of("id", transferId));
            return true;
        }
        return false;
    }

    /// Stops a transfer. Its partial file is kept for a later resume and its caller receives
    /// [TransferCancelledException].
    ///
    /// @return true if an active transfer was cancelled
    public boolean cancel(String transferId) {
        TransferState state = transfers.get(transferId);
        return state != null && state.cancel();
    }

    /// @return snapshots of transfers which have not reached a terminal status
    public List<TransferSnapshot> getActiveTransfers() {
        List<TransferSnapshot> active = new ArrayList<>();
        for (TransferState state : transfers.values()) {
            TransferSnapshot snapshot = state.snapshot();
            if (!snapshot.status().isTerminal()) {
                active.add(snapshot);
            }
        }
        active.sort(Comparator.comparing(TransferSnapshot::startTime));
        return active;
    }

    public Optional<TransferSnapshot> getTransfer(String transferId) {
        return Optional.ofNullable(transfers.get(transferId)).map(TransferState::snapshot);
    }

    public DownloadSettings getSettings() {
        return settings.get();
    }

    /// Re-tunes concurrency, buffer size and bandwidth cap from available memory and recent
    /// speed samples. Running transfers pick up the new cap at their next read.
    ///
    /// @return the settings now in effect
    public DownloadSettings optimizeConfiguration() {
        long available = memory.available();
        int concurrency;
        int bufferSize;
        if (available < 512 * PipelineConfig.MB) {
            concurrency = 1;
            bufferSize = (int) (32 * PipelineConfig.KB);
        } else if (available < PipelineConfig.GB) {
            concurrency = 2;
            bufferSize = (int) (64 * PipelineConfig.KB);
        } else {
            concurrency = 3;
            bufferSize = (int) (128 * PipelineConfig.KB);
        }

        long cap = settings.get().maxBytesPerSecond();
        double recent = recentAverageSpeed();
        if (cap > 0 && recent > cap * 1.2) {
            cap = (long) (recent * 0.9);
        }

        DownloadSettings tuned = new DownloadSettings(concurrency, bufferSize, cap);
        settings.set(tuned);
        resizePool(concurrency);
        events.log(PipelineEvent.SETTINGS_TUNED, Map.of(
            "concurrency", concurrency, "buffer", bufferSize, "maxSpeed", cap));
        return tuned;
    }

    public PerformanceMetrics getPerformanceMetrics() {
        List<Double> history;
        synchronized (speedHistory) {
            history = List.copyOf(speedHistory);
        }
        double average = history.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double peak = history.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return new PerformanceMetrics(getActiveTransfers().size(), completedDownloads.get(),
            failedDownloads.get(), totalBytes.get(), average, peak, memory.heapUsed(), history);
    }

    /// Cancels every active transfer and stops the worker pool.
    @Override
    public void close() {
        for (TransferState state : transfers.values()) {
            state.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Transfer workers did not stop within 10 seconds");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private Path run(TransferState state, Path destinationDir) {
        String id = state.id();
        try {
            Path result = transfer(state, destinationDir);
            state.finish(TransferStatus.COMPLETED);
            completedDownloads.incrementAndGet();
            return result;
        } catch (TransferCancelledException e) {
            state.finish(TransferStatus.CANCELLED);
            events.log(PipelineEvent.TRANSFER_CANCEL, Map.of("id", id, "bytes", e.getBytesWritten()));
            throw e;
        } catch (RuntimeException e) {
            state.finish(TransferStatus.FAILED);
            failedDownloads.incrementAndGet();
            events.log(PipelineEvent.TRANSFER_FAIL, Map.of(
                "id", id, "offset", state.bytesTransferred(), "text", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            transfers.remove(id, state);
        }
    }

    private Path transfer(TransferState state, Path destinationDir) {
        ArtifactDescriptor descriptor = state.descriptor();
        String id = descriptor.id();
        urlPolicy.check(id, descriptor.url());

        Path target = destinationDir.resolve(descriptor.fileName());
        Path partial = destinationDir.resolve(descriptor.partialFileName());
        try {
            Files.createDirectories(destinationDir);
            if (descriptor.size() > 0 && Files.isRegularFile(target) && Files.size(target) == descriptor.size()) {
                logger.debug("{} already present at {}", id, target);
                state.begin(descriptor.size(), descriptor.size(), null);
                return target;
            }
        } catch (IOException e) {
            throw new ArtifactIOException(id, destinationDir, "Unable to prepare destination", e);
        }

        long attemptStart = System.nanoTime();
        BandwidthThrottle throttle = new BandwidthThrottle(settings.get().maxBytesPerSecond(), attemptStart);
        boolean restarted = false;
        while (true) {
            awaitUnpaused(state, partial);
            long offset = sizeOf(id, partial);
            if (descriptor.size() > 0 && offset > descriptor.size()) {
                logger.warn("Partial file for {} is larger than the artifact; restarting", id);
                delete(id, partial);
                offset = 0;
            }

            TransferResponse response;
            try {
                response = transport.open(offset > 0
                    ? RangeRequest.resumeFrom(descriptor.url(), offset)
                    : RangeRequest.get(descriptor.url()));
            } catch (TransportException e) {
                if (e.isRangeNotSatisfiable() && offset > 0) {
                    long known = e.getResourceSize() > 0 ? e.getResourceSize() : descriptor.size();
                    if (known == offset) {
                        logger.debug("Partial file for {} already holds all {} bytes", id, offset);
                        state.begin(offset, offset, new ResumeInfo(offset, partial, validators.get(id)));
                        return complete(state, partial, target, attemptStart);
                    }
                    if (!restarted) {
                        logger.info("Range not satisfiable for {} at offset {}; restarting from zero", id, offset);
                        restarted = true;
                        delete(id, partial);
                        continue;
                    }
                }
                throw new NetworkException(id, "Transfer of " + descriptor.url() + " failed: " + e.getMessage(),
                    e.getStatusCode(), e);
            } catch (IOException e) {
                if (state.isCancelled()) {
                    throw new TransferCancelledException(id, offset);
                }
                throw new NetworkException(id, "Transfer of " + descriptor.url() + " failed: " + e.getMessage(), e);
            }

            String previousValidator = validators.get(id);
            String validator = response.validator();
            if (offset > 0 && previousValidator != null && validator != null && !previousValidator.equals(validator)) {
                response.close();
                if (restarted) {
                    throw new NetworkException(id, "Source of " + id + " keeps changing during transfer", null);
                }
                logger.info("Source of {} changed since the partial file was written; restarting", id);
                restarted = true;
                delete(id, partial);
                continue;
            }
            if (validator != null) {
                validators.put(id, validator);
            }

            boolean append = offset > 0 && response.isPartial();
            if (offset > 0 && !append) {
                logger.info("Server ignored the range request for {}; restarting from zero", id);
                offset = 0;
            }
            long total = response.totalSize() > 0 ? response.totalSize() : descriptor.size();
            state.begin(offset, total, offset > 0 ? new ResumeInfo(offset, partial, previousValidator) : null);
            events.log(PipelineEvent.TRANSFER_START, Map.of(
                "id", id, "url", descriptor.url().toString(), "offset", offset));

            if (stream(state, response, partial, append, throttle)) {
                long size = sizeOf(id, partial);
                if (total > 0 && size < total) {
                    throw new NetworkException(id,
                        "Connection closed after " + size + " of " + total + " bytes for " + id, null);
                }
                return complete(state, partial, target, attemptStart);
            }
        }
    }

    /// @return true at end of body, false when paused and the request must be reissued
    private boolean stream(
        TransferState state,
        TransferResponse response,
        Path partial,
        boolean append,
        BandwidthThrottle throttle
    ) {
        String id = state.id();
        state.attach(response);
        try (response; BufferedFileSink sink = new BufferedFileSink(id, partial, append, config.highWaterMark())) {
            ReadableByteChannel body = response.channel();
            ByteBuffer buffer = ByteBuffer.allocate(settings.get().bufferSize());
            while (true) {
                if (state.isCancelled()) {
                    throw new TransferCancelledException(id, sink.position());
                }
                if (state.status() == TransferStatus.PAUSED) {
                    return false;
                }

                throttle.setMaxBytesPerSecond(settings.get().maxBytesPerSecond());
                long delay = throttle.delayMillis(System.nanoTime());
                if (delay > 0) {
                    events.log(PipelineEvent.THROTTLE, Map.of("id", id, "delay", delay, "speed", state.speed()));
                    sleeper.sleep(delay);
                }

                buffer.clear();
                int read;
                try {
                    read = body.read(buffer);
                } catch (IOException e) {
                    if (state.isCancelled()) {
                        throw new TransferCancelledException(id, sink.position());
                    }
                    throw new NetworkException(id, "Connection lost after " + sink.position() + " bytes: "
                        + e.getMessage(), e);
                }
                if (read < 0) {
                    if (state.isCancelled()) {
                        throw new TransferCancelledException(id, sink.position());
                    }
                    return true;
                }
                if (read == 0) {
                    continue;
                }

                buffer.flip();
                if (!sink.write(buffer)) {
                    events.log(PipelineEvent.BACKPRESSURE, Map.of("id", id, "buffered", sink.buffered()));
                    sink.drain();
                }

                long now = System.nanoTime();
                throttle.record(read, now);
                totalBytes.addAndGet(read);
                if (state.record(read, now)) {
                    TransferSnapshot progress = state.snapshot();
                    events.log(PipelineEvent.TRANSFER_PROG, Map.of("id", id, "bytes", progress.bytesTransferred(),
                        "total", progress.totalBytes(), "speed", progress.speed()));
                    recordSpeed(progress.speed());
                }
                checkMemory();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.cancel();
            throw new TransferCancelledException(id, state.bytesTransferred());
        } catch (IOException e) {
            throw new NetworkException(id, "Response for " + id + " has no body", e);
        } finally {
            state.detach();
        }
    }

    private Path complete(TransferState state, Path partial, Path target, long attemptStart) {
        String id = state.id();
        try {
            try {
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            }
            long size = Files.size(target);
            validators.remove(id);
            events.log(PipelineEvent.TRANSFER_DONE, Map.of("id", id, "bytes", size,
                "millis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - attemptStart)));
            return target;
        } catch (IOException e) {
            throw new ArtifactIOException(id, target, "Unable to move completed transfer into place", e);
        }
    }

    private void awaitUnpaused(TransferState state, Path partial) {
        try {
            state.awaitUnpaused();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.cancel();
        }
        if (state.isCancelled()) {
            throw new TransferCancelledException(state.id(), sizeOf(state.id(), partial));
        }
    }

    private void checkMemory() throws InterruptedException {
        long used = memory.heapUsed();
        if (used > config.memoryThreshold()) {
            events.log(PipelineEvent.MEMORY_HIGH, Map.of("used", used, "threshold", config.memoryThreshold()));
            System.gc();
            sleeper.sleep(MEMORY_PAUSE_MILLIS);
        }
    }

    void recordSpeed(double speed) {
        synchronized (speedHistory) {
            speedHistory.addLast(speed);
            while (speedHistory.size() > SPEED_HISTORY_LIMIT) {
                speedHistory.removeFirst();
            }
        }
    }

    private double recentAverageSpeed() {
        synchronized (speedHistory) {
            return speedHistory.stream()
                .skip(Math.max(0, speedHistory.size() - RECENT_SPEED_SAMPLES))
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        }
    }

    private void resizePool(int workers) {
        if (workers > executor.getMaximumPoolSize()) {
            executor.setMaximumPoolSize(workers);
            executor.setCorePoolSize(workers);
        } else {
            executor.setCorePoolSize(workers);
            executor.setMaximumPoolSize(workers);
        }
    }

    private static long sizeOf(String id, Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            throw new ArtifactIOException(id, file, "Unable to read partial file size", e);
        }
    }

    private static void delete(String id, Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new ArtifactIOException(id, file, "Unable to remove partial file", e);
        }
    }

    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static final class TransferThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "modelstore-transfer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
