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
import io.nosqlbench.modelstore.transport.TransferResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/// Mutable progress of one transfer. Owned by [DownloadOrchestrator]; every other reader
/// gets a [TransferSnapshot].
///
/// Speed is an exponential moving average (0.8 old, 0.2 new) over samples taken at least
/// [#SAMPLE_INTERVAL_NANOS] apart, so the time spent in throttle delays counts against it.
final class TransferState {
    static final long SAMPLE_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final ArtifactDescriptor descriptor;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition statusChanged = lock.newCondition();

    private TransferStatus status = TransferStatus.PENDING;
    private long bytesTransferred;
    private long totalBytes;
    private final Instant startTime;
    private Instant lastUpdate;
    private double speed;
    private ResumeInfo resumeInfo;

    private long sampleStartNanos = -1;
    private long sampleBytes;

    private volatile TransferResponse activeResponse;

    TransferState(ArtifactDescriptor descriptor, Clock clock) {
        this.descriptor = descriptor;
        this.clock = clock;
        this.totalBytes = descriptor.size() > 0 ? descriptor.size() : -1;
        this.startTime = clock.instant();
        this.lastUpdate = startTime;
    }

    String id() {
        return descriptor.id();
    }

    ArtifactDescriptor descriptor() {
        return descriptor;
    }

    TransferStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    double speed() {
        lock.lock();
        try {
            return speed;
        } finally {
            lock.unlock();
        }
    }

    long bytesTransferred() {
        lock.lock();
        try {
            return bytesTransferred;
        } finally {
            lock.unlock();
        }
    }

    /// Marks the start of an attempt at the given offset.
    void begin(long offset, long total, ResumeInfo resume) {
        lock.lock();
        try {
            if (status == TransferStatus.PENDING) {
                status = TransferStatus.DOWNLOADING;
            }
            bytesTransferred = offset;
            if (total > 0) {
                totalBytes = total;
            }
            resumeInfo = resume;
            sampleStartNanos = -1;
            sampleBytes = 0;
            lastUpdate = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    /// Records bytes written.
    ///
    /// @return true when a new speed sample was taken
    boolean record(long bytes, long nowNanos) {
        lock.lock();
        try {
            bytesTransferred += bytes;
            lastUpdate = clock.instant();
            if (sampleStartNanos < 0) {
                sampleStartNanos = nowNanos;
                sampleBytes = bytes;
                return false;
            }
            sampleBytes += bytes;
            long elapsed = nowNanos - sampleStartNanos;
            if (elapsed < SAMPLE_INTERVAL_NANOS) {
                return false;
            }
            double instant = sampleBytes * 1_000_000_000.0 / elapsed;
            speed = speed == 0.0 ? instant : speed * 0.8 + instant * 0.2;
            sampleStartNanos = nowNanos;
            sampleBytes = 0;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// @return true if the transfer was running or pending and is now paused
    boolean pause() {
        lock.lock();
        try {
            if (status != TransferStatus.DOWNLOADING && status != TransferStatus.PENDING) {
                return false;
            }
            status = TransferStatus.PAUSED;
            statusChanged.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// @return true if the transfer was paused and is now running
    boolean resume() {
        lock.lock();
        try {
            if (status != TransferStatus.PAUSED) {
                return false;
            }
            status = TransferStatus.DOWNLOADING;
            statusChanged.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Cancels the transfer and aborts any read blocked on the open response.
    ///
    /// @return true if the transfer was not already finished
    boolean cancel() {
        TransferResponse response;
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            status = TransferStatus.CANCELLED;
            statusChanged.signalAll();
            response = activeResponse;
        } finally {
            lock.unlock();
        }
        if (response != null) {
            response.close();
        }
        return true;
    }

    boolean isCancelled() {
        return status() == TransferStatus.CANCELLED;
    }

    /// Blocks while the transfer is paused.
    ///
    /// @return true if the caller had to wait, meaning the open response should be replaced
    boolean awaitUnpaused() throws InterruptedException {
        lock.lock();
        try {
            boolean waited = false;
            while (status == TransferStatus.PAUSED) {
                waited = true;
                statusChanged.await();
            }
            return waited;
        } finally {
            lock.unlock();
        }
    }

    /// Moves the transfer to a terminal status unless it was already cancelled.
    void finish(TransferStatus terminal) {
        lock.lock();
        try {
            if (status != TransferStatus.CANCELLED) {
                status = terminal;
            }
            lastUpdate = clock.instant();
            statusChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void attach(TransferResponse response) {
        this.activeResponse = response;
        if (isCancelled() && response != null) {
            response.close();
        }
    }

    void detach() {
        this.activeResponse = null;
    }

    TransferSnapshot snapshot() {
        lock.lock();
        try {
            Duration eta = null;
            if (speed > 0 && totalBytes > 0) {
                long remaining = Math.max(0, totalBytes - bytesTransferred);
                eta = Duration.ofMillis((long) (remaining * 1000.0 / speed));
            }
            return new TransferSnapshot(descriptor.id(), status, bytesTransferred, totalBytes,
                startTime, lastUpdate, speed, eta, resumeInfo);
        } finally {
            lock.unlock();
        }
    }
}
