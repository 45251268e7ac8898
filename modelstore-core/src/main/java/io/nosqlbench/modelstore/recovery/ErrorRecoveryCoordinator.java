package io.nosqlbench.modelstore.recovery;

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
import io.nosqlbench.modelstore.download.Sleeper;
import io.nosqlbench.modelstore.errors.AcquisitionException;
import io.nosqlbench.modelstore.errors.ErrorCategory;
import io.nosqlbench.modelstore.errors.ErrorSeverity;
import io.nosqlbench.modelstore.errors.RecoveryStrategy;
import io.nosqlbench.modelstore.events.EventSink;
import io.nosqlbench.modelstore.events.PipelineEvent;
import io.nosqlbench.modelstore.transport.ArtifactTransport;
import io.nosqlbench.modelstore.transport.RangeRequest;
import io.nosqlbench.modelstore.transport.TransferResponse;
import io.nosqlbench.modelstore.transport.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileStore;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/// Classifies failures, checks the environment, and decides how to recover.
///
/// Failures raised by pipeline stages are [AcquisitionException]s and carry their category.
/// Anything else is classified by its type, then by keywords in its message. Every classified
/// failure is kept in a bounded history for [#getErrorStatistics()].
///
/// The category decides the strategy: network, file-system and unknown failures are retried,
/// validation failures fall back to a registered alternative, disk-space and configuration
/// failures need an operator, and security failures abort.
public class ErrorRecoveryCoordinator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ErrorRecoveryCoordinator.class);

    static final int HISTORY_LIMIT = 1000;
    static final int RECENT_LIMIT = 10;
    static final long ESTIMATED_SPACE = 5L * PipelineConfig.GB;
    static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    static final String MANUAL_MESSAGE = "Manual intervention required - please check system configuration and disk space";
    static final String ABORT_MESSAGE = "Operation aborted due to security or critical error";

    private record CachedConnectivity(List<URI> endpoints, ConnectivityInfo info, long expiresAtNanos) {
    }

    private record CachedStore(long total, long free, long usable, boolean estimated, long expiresAtNanos) {
    }

    private final ArtifactTransport transport;
    private final PipelineConfig config;
    private final EventSink events;
    private final Sleeper sleeper;
    private final Clock clock;
    private final FileStoreLocator fileStores;
    private final ExecutorService probes;

    private final Deque<ErrorRecord> history = new ArrayDeque<>();
    private final Map<String, FallbackRegistration> fallbacks = new ConcurrentHashMap<>();
    private final Map<Path, CachedStore> diskCache = new ConcurrentHashMap<>();
    private volatile CachedConnectivity connectivity;
    private volatile DiskSpaceInfo lastDiskSpace;
    private volatile Predicate<ArtifactDescriptor> locallyAvailable = descriptor -> false;

    public ErrorRecoveryCoordinator(ArtifactTransport transport, PipelineConfig config, EventSink events) {
        this(transport, config, events, Sleeper.system(), Clock.systemUTC(), FileStoreLocator.system());
    }

    ErrorRecoveryCoordinator(
        ArtifactTransport transport,
        PipelineConfig config,
        EventSink events,
        Sleeper sleeper,
        Clock clock,
        FileStoreLocator fileStores
    ) {
        this.transport = transport;
        this.config = config;
        this.events = events;
        this.sleeper = sleeper;
        this.clock = clock;
        this.fileStores = fileStores;
        AtomicInteger counter = new AtomicInteger();
        this.probes = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "modelstore-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /// Sets the test for alternatives that can be used without the network, such as cached ones.
    public void setLocalAvailability(Predicate<ArtifactDescriptor> locallyAvailable) {
        this.locallyAvailable = locallyAvailable;
    }

    /// Classifies a failure and appends it to the history.
    public ErrorRecord categorize(Throwable error, RecoveryContext<?> context) {
        ErrorRecord record = describe(error, context);
        synchronized (history) {
            history.addLast(record);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
        events.log(PipelineEvent.ERROR_RECORDED, Map.of("code", record.code(), "category", record.category().name(),
            "severity", record.severity().name(), "text", record.message()));
        if (context != null) {
            logger.debug("{} failed during {} (attempt {})", record.artifactId(), context.operation(),
                context.attempt(), unwrap(error));
        }
        return record;
    }

    /// Classifies a failure without recording it, for failures already passed to [#categorize].
    public ErrorRecord describe(Throwable error, RecoveryContext<?> context) {
        Throwable cause = unwrap(error);
        ErrorCategory category = classify(cause);
        ErrorSeverity severity = cause instanceof AcquisitionException tagged && tagged.getCategory() != ErrorCategory.UNKNOWN
            ? tagged.getSeverity()
            : severityFromMessage(cause);
        String artifactId = cause instanceof AcquisitionException tagged && tagged.getArtifactId() != null
            ? tagged.getArtifactId()
            : context == null ? null : context.artifactId();
        String raw = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        Instant now = clock.instant();
        RecoveryStrategy strategy = category.strategy();
        return new ErrorRecord(
            errorCode(category, raw, now),
            category,
            severity,
            humanize(cause),
            cause.getClass().getName() + ": " + raw,
            strategy,
            recommendedAction(strategy),
            now,
            artifactId);
    }

    /// Probes the configured endpoints.
    public ConnectivityInfo validateConnectivity() {
        return validateConnectivity(config.connectivityEndpoints());
    }

    /// Probes endpoints concurrently with a `HEAD` request each. An endpoint is reachable when it
    /// answers with a status below 500 within the probe timeout. Results are reused for the
    /// connectivity cache TTL.
    public ConnectivityInfo validateConnectivity(List<URI> endpoints) {
        CachedConnectivity cached = connectivity;
        long now = System.nanoTime();
        if (cached != null && cached.endpoints().equals(endpoints) && now < cached.expiresAtNanos()) {
            return cached.info();
        }

        long timeoutMillis = config.probeTimeout().toMillis();
        List<CompletableFuture<String>> results = new ArrayList<>(endpoints.size());
        for (URI endpoint : endpoints) {
            results.add(CompletableFuture.supplyAsync(() -> probe(endpoint), probes)
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }

        int reachable = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < endpoints.size(); i++) {
            try {
                String failure = results.get(i).join();
                if (failure == null) {
                    reachable++;
                } else {
                    errors.add(endpoints.get(i) + ": " + failure);
                }
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                String reason = cause instanceof TimeoutException ? "no answer within " + timeoutMillis + "ms" : cause.getMessage();
                errors.add(endpoints.get(i) + ": " + reason);
            }
        }

        ConnectivityStatus status;
        if (endpoints.isEmpty()) {
            status = ConnectivityStatus.UNKNOWN;
        } else if (reachable == endpoints.size()) {
            status = ConnectivityStatus.ONLINE;
        } else if (reachable > 0) {
            status = ConnectivityStatus.LIMITED;
        } else {
            status = ConnectivityStatus.OFFLINE;
        }
        ConnectivityInfo info = new ConnectivityInfo(status, reachable, endpoints.size(), errors, clock.instant());
        connectivity = new CachedConnectivity(List.copyOf(endpoints), info,
            System.nanoTime() + config.connectivityCacheTtl().toNanos());
        events.log(PipelineEvent.CONNECTIVITY, Map.of("status", status.name(), "reachable", reachable,
            "total", endpoints.size()));
        return info;
    }

    // null when reachable, otherwise the reason
    private String probe(URI endpoint) {
        try (TransferResponse response = transport.open(RangeRequest.head(endpoint))) {
            return response.statusCode() < 500 ? null : "HTTP " + response.statusCode();
        } catch (IOException e) {
            return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
    }

    /// Reads free space at `path`, or at its nearest existing ancestor.
    ///
    /// Space is sufficient when the usable bytes cover `requiredBytes` plus the configured minimum
    /// free space. When the file store cannot be read, a conservative estimate is returned and
    /// flagged as such.
    public DiskSpaceInfo validateDiskSpace(Path path, long requiredBytes) {
        Path location = existingAncestor(path.toAbsolutePath());
        long now = System.nanoTime();
        CachedStore store = diskCache.get(location);
        if (store == null || now >= store.expiresAtNanos()) {
            store = readStore(location, now);
            diskCache.put(location, store);
        }
        boolean sufficient = store.usable() >= requiredBytes + config.minimumFreeSpace();
        DiskSpaceInfo info = new DiskSpaceInfo(path, store.total(), store.free(), store.usable(), requiredBytes,
            sufficient, store.estimated());
        lastDiskSpace = info;
        if (!sufficient) {
            logger.warn("Insufficient disk space at {}: {} bytes usable, {} required plus {} reserved",
                path, store.usable(), requiredBytes, config.minimumFreeSpace());
        }
        return info;
    }

    private CachedStore readStore(Path location, long now) {
        long expires = now + config.diskSpaceCacheTtl().toNanos();
        try {
            FileStore store = fileStores.locate(location);
            return new CachedStore(store.getTotalSpace(), store.getUnallocatedSpace(), store.getUsableSpace(), false,
                expires);
        } catch (IOException | UnsupportedOperationException e) {
            logger.warn("Unable to read file store for {}, assuming {} bytes free: {}", location, ESTIMATED_SPACE,
                e.getMessage());
            return new CachedStore(ESTIMATED_SPACE, ESTIMATED_SPACE, ESTIMATED_SPACE, true, expires);
        }
    }

    private static Path existingAncestor(Path path) {
        Path current = path;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current == null ? path.getRoot() : current;
    }

    /// Registers alternatives for the artifact `name`, replacing any earlier registration.
    public void registerFallback(String name, FallbackRegistration registration) {
        fallbacks.put(name, registration);
        logger.debug("Registered {} fallback(s) for {}", registration.alternatives().size(), name);
    }

    public Optional<ArtifactDescriptor> selectFallback(String name, ErrorRecord record) {
        return selectFallback(name, record, Set.of());
    }

    /// Picks the first registered alternative meeting every criterion.
    ///
    /// Alternatives in the preferred format are considered before the others; otherwise
    /// registration order is kept. Alternatives need to be locally available when the criteria
    /// demand it or when the last connectivity probe found no endpoint. An alternative larger
    /// than the usable space last measured is skipped.
    ///
    /// @param excludedIds `name@version` ids already tried
    /// @return empty unless the record's strategy is fallback and an alternative qualifies
    public Optional<ArtifactDescriptor> selectFallback(String name, ErrorRecord record, Collection<String> excludedIds) {
        if (record.strategy() != RecoveryStrategy.FALLBACK) {
            return Optional.empty();
        }
        FallbackRegistration registration = fallbacks.get(name);
        if (registration == null) {
            return Optional.empty();
        }
        FallbackCriteria criteria = registration.criteria();
        List<ArtifactDescriptor> ordered = new ArrayList<>(registration.alternatives());
        if (criteria.preferredFormat() != null) {
            ordered.sort((a, b) -> Boolean.compare(
                !a.format().equals(criteria.preferredFormat()), !b.format().equals(criteria.preferredFormat())));
        }

        CachedConnectivity probe = connectivity;
        boolean offline = probe != null && probe.info().status() == ConnectivityStatus.OFFLINE;
        DiskSpaceInfo disk = lastDiskSpace;
        for (ArtifactDescriptor candidate : ordered) {
            if (excludedIds.contains(candidate.id())) {
                continue;
            }
            if (criteria.maxSize() > 0 && candidate.size() > criteria.maxSize()) {
                continue;
            }
            if (criteria.minDimensions() > 0 && candidate.dimensions() < criteria.minDimensions()) {
                continue;
            }
            boolean local = locallyAvailable.test(candidate);
            if ((criteria.requireLocal() || offline) && !local) {
                continue;
            }
            if (!local && disk != null && candidate.size() > disk.usableBytes()) {
                continue;
            }
            events.log(PipelineEvent.FALLBACK, Map.of("primary", name, "alternative", candidate.id()));
            return Optional.of(candidate);
        }
        logger.info("No registered fallback for {} meets its criteria", name);
        return Optional.empty();
    }

    /// Applies the record's strategy once.
    ///
    /// A retry waits `retryBaseDelay * 2^(attempt-1)`, at most 30 seconds. When the context
    /// carries an action it is re-invoked and its real outcome reported; otherwise the result only
    /// recommends a retry. A fallback returns the selected alternative. Manual and abort never
    /// retry.
    public <T> RecoveryResult<T> attemptRecovery(ErrorRecord record, RecoveryContext<T> context) {
        RecoveryResult<T> result = switch (record.strategy()) {
            case RETRY -> retry(record, context);
            case FALLBACK -> fallback(record, context);
            case MANUAL -> RecoveryResult.failed(RecoveryStrategy.MANUAL, MANUAL_MESSAGE);
            case ABORT -> RecoveryResult.failed(RecoveryStrategy.ABORT, ABORT_MESSAGE);
        };
        events.log(PipelineEvent.RECOVERY, Map.of("code", record.code(), "strategy", record.strategy().name(),
            "success", result.success()));
        return result;
    }

    private <T> RecoveryResult<T> retry(ErrorRecord record, RecoveryContext<T> context) {
        Duration delay = retryDelay(context.attempt());
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new RecoveryResult<>(false, RecoveryStrategy.RETRY, "Interrupted while waiting to retry",
                null, null, false, e);
        }
        Callable<T> action = context.action();
        if (action == null) {
            return new RecoveryResult<>(true, RecoveryStrategy.RETRY,
                "Retry recommended after " + delay.toMillis() + "ms", null, null, true, null);
        }
        try {
            T value = action.call();
            return new RecoveryResult<>(true, RecoveryStrategy.RETRY,
                "Succeeded on attempt " + (context.attempt() + 1), null, value, false, null);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            boolean again = classify(cause).strategy() == RecoveryStrategy.RETRY;
            return new RecoveryResult<>(false, RecoveryStrategy.RETRY,
                "Attempt " + (context.attempt() + 1) + " failed: " + cause.getMessage(), null, null, again, cause);
        }
    }

    private <T> RecoveryResult<T> fallback(ErrorRecord record, RecoveryContext<T> context) {
        if (context.descriptor() == null) {
            return RecoveryResult.failed(RecoveryStrategy.FALLBACK, "No artifact to find a fallback for");
        }
        String name = context.descriptor().name();
        return selectFallback(name, record)
            .map(alternative -> new RecoveryResult<T>(true, RecoveryStrategy.FALLBACK,
                "Using fallback " + alternative.id() + " instead of " + context.descriptor().id(),
                alternative, null, false, null))
            .orElseGet(() -> RecoveryResult.failed(RecoveryStrategy.FALLBACK, "No suitable fallback for " + name));
    }

    /// Runs an action, retrying with exponential backoff while its failures classify as
    /// retryable, for at most `maxAttempts` attempts in total.
    ///
    /// @return the action's result
    /// @throws RuntimeException the last failure, wrapped in [AcquisitionException] when it was
    /// a checked exception
    public <T> T executeWithRecovery(Callable<T> action, RecoveryContext<T> context, int maxAttempts) {
        Throwable failure;
        try {
            return action.call();
        } catch (Exception e) {
            failure = unwrap(e);
        }
        RecoveryContext<T> attemptContext = context.withAction(action);
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            attemptContext = attemptContext.withAttempt(attempt);
            ErrorRecord record = categorize(failure, attemptContext);
            if (record.strategy() != RecoveryStrategy.RETRY) {
                break;
            }
            RecoveryResult<T> result = attemptRecovery(record, attemptContext);
            if (result.success()) {
                return result.value();
            }
            failure = result.failure();
            if (failure == null) {
                break;
            }
        }
        throw propagate(failure, context);
    }

    public ErrorStatistics getErrorStatistics() {
        List<ErrorRecord> records;
        synchronized (history) {
            records = List.copyOf(history);
        }
        Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
        Map<ErrorSeverity, Long> bySeverity = new EnumMap<>(ErrorSeverity.class);
        Instant hourAgo = clock.instant().minus(Duration.ofHours(1));
        long lastHour = 0;
        for (ErrorRecord record : records) {
            byCategory.merge(record.category(), 1L, Long::sum);
            bySeverity.merge(record.severity(), 1L, Long::sum);
            if (record.timestamp().isAfter(hourAgo)) {
                lastHour++;
            }
        }
        List<ErrorRecord> recent = records.subList(Math.max(0, records.size() - RECENT_LIMIT), records.size());
        return new ErrorStatistics(records.size(), byCategory, bySeverity, List.copyOf(recent), lastHour,
            lastHour / 60.0);
    }

    /// Forgets cached connectivity and disk-space results so the next check measures again.
    public void invalidateCaches() {
        connectivity = null;
        diskCache.clear();
    }

    @Override
    public void close() {
        probes.shutdownNow();
    }

    Duration retryDelay(int attempt) {
        long base = config.retryBaseDelay().toMillis();
        long millis = base << Math.min(Math.max(0, attempt - 1), 20);
        return Duration.ofMillis(Math.min(millis, MAX_RETRY_DELAY.toMillis()));
    }

    private RuntimeException propagate(Throwable failure, RecoveryContext<?> context) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new AcquisitionException(classify(failure), context.artifactId(),
            String.valueOf(failure.getMessage()), failure);
    }

    /// Category of a failure without recording it.
    ErrorCategory classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof AcquisitionException tagged) {
            return tagged.getCategory();
        }
        String message = cause.getMessage() == null ? "" : cause.getMessage().toLowerCase(Locale.ROOT);
        if (cause instanceof SSLException || cause instanceof GeneralSecurityException || cause instanceof SecurityException) {
            return ErrorCategory.SECURITY;
        }
        if (message.contains("no space left") || message.contains("enospc")) {
            return ErrorCategory.DISK_SPACE;
        }
        if (cause instanceof TransportException || cause instanceof UnknownHostException
            || cause instanceof ConnectException || cause instanceof SocketTimeoutException) {
            return ErrorCategory.NETWORK;
        }
        if (cause instanceof FileSystemException) {
            return ErrorCategory.FILE_SYSTEM;
        }
        return categoryFromMessage(message);
    }

    static ErrorCategory categoryFromMessage(String lowerCaseMessage) {
        String m = lowerCaseMessage;
        if (containsAny(m, "unauthorized", "forbidden", "certificate", "security")) {
            return ErrorCategory.SECURITY;
        }
        if (containsAny(m, "no space", "disk full", "quota")) {
            return ErrorCategory.DISK_SPACE;
        }
        if (containsAny(m, "network", "connection", "timeout", "timed out", "enotfound", "econnrefused",
            "econnreset", "socket", "host")) {
            return ErrorCategory.NETWORK;
        }
        if (containsAny(m, "checksum", "corrupt", "mismatch", "invalid format", "validation")) {
            return ErrorCategory.VALIDATION;
        }
        if (containsAny(m, "config", "setting", "missing property")) {
            return ErrorCategory.CONFIGURATION;
        }
        if (containsAny(m, "enoent", "eacces", "permission", "file", "directory")) {
            return ErrorCategory.FILE_SYSTEM;
        }
        return ErrorCategory.UNKNOWN;
    }

    static ErrorSeverity severityFromMessage(Throwable error) {
        String m = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (containsAny(m, "critical", "fatal", "corrupt", "security", "unauthorized")) {
            return ErrorSeverity.CRITICAL;
        }
        if (containsAny(m, "fail", "error", "invalid", "timeout", "space", "enotfound", "network", "connection")) {
            return ErrorSeverity.HIGH;
        }
        if (containsAny(m, "warning", "deprecated", "retry")) {
            return ErrorSeverity.MEDIUM;
        }
        return ErrorSeverity.LOW;
    }

    static String humanize(Throwable error) {
        String raw = error.getMessage() == null ? "" : error.getMessage();
        String m = raw.toLowerCase(Locale.ROOT);
        if (error instanceof NoSuchFileException || m.contains("no such file")) {
            return "A required file was not found: " + raw;
        }
        if (error instanceof AccessDeniedException || m.contains("permission denied") || m.contains("access denied")) {
            return "Permission denied while accessing a file: " + raw;
        }
        if (m.contains("no space left")) {
            return "The disk is full; free some space and try again";
        }
        if (error instanceof SocketTimeoutException || m.contains("timeout") || m.contains("timed out")) {
            return "The operation timed out; the server may be slow or unreachable";
        }
        if (error instanceof UnknownHostException || m.contains("enotfound")) {
            return "The server could not be found; check the network connection";
        }
        if (m.contains("connection refused")) {
            return "The server refused the connection";
        }
        if (m.contains("connection reset")) {
            return "The connection was interrupted";
        }
        return raw.isEmpty() ? error.getClass().getSimpleName() : raw;
    }

    static String recommendedAction(RecoveryStrategy strategy) {
        return switch (strategy) {
            case RETRY -> "Retry the operation; the condition is likely to clear";
            case FALLBACK -> "Use a registered alternative artifact";
            case MANUAL -> "Free disk space or correct the configuration, then try again";
            case ABORT -> "Stop and investigate; this failure is never retried";
        };
    }

    static String errorCode(ErrorCategory category, String message, Instant timestamp) {
        return (category.name() + "_" + Integer.toHexString(message.hashCode()) + "_"
            + Long.toString(timestamp.toEpochMilli(), 36)).toUpperCase(Locale.ROOT);
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
