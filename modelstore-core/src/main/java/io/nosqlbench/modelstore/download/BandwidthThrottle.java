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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/// Per-transfer bandwidth limiter.
///
/// Each recorded read is charged against the cap starting from the later of the previous read and
/// the moment the bytes already charged are paid for. The read must not be followed by another
/// until its charge is paid, so any interval of length `t` carries at most `cap * t` bytes plus
/// one read. A source slower than the cap is never delayed, and a single decision never waits
/// longer than one second. The bytes of the last second are also kept for reporting the current
/// rate. A cap of zero or less disables throttling.
///
/// Not thread safe; one instance belongs to one transfer loop.
public final class BandwidthThrottle {
    static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);
    static final long MAX_DELAY_MILLIS = 1000;

    private record Sample(long nanos, long bytes) {
    }

    private final long startNanos;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private long windowBytes;
    private long lastRecordNanos;
    private double releaseNanos;
    private volatile long maxBytesPerSecond;

    public BandwidthThrottle(long maxBytesPerSecond, long startNanos) {
        this.maxBytesPerSecond = maxBytesPerSecond;
        this.startNanos = startNanos;
        this.lastRecordNanos = startNanos;
        this.releaseNanos = startNanos;
    }

    /// Changes the cap. Bytes charged but not yet paid for are rescaled to the new cap.
    public void setMaxBytesPerSecond(long maxBytesPerSecond) {
        long previous = this.maxBytesPerSecond;
        if (previous == maxBytesPerSecond) {
            return;
        }
        if (previous > 0 && maxBytesPerSecond > 0 && releaseNanos > lastRecordNanos) {
            releaseNanos = lastRecordNanos + (releaseNanos - lastRecordNanos) * previous / maxBytesPerSecond;
        } else {
            releaseNanos = lastRecordNanos;
        }
        this.maxBytesPerSecond = maxBytesPerSecond;
    }

    public long getMaxBytesPerSecond() {
        return maxBytesPerSecond;
    }

    public void record(long bytes, long nowNanos) {
        long cap = maxBytesPerSecond;
        if (cap > 0) {
            double from = Math.max(releaseNanos, lastRecordNanos);
            releaseNanos = from + bytes * 1_000_000_000.0 / cap;
        }
        lastRecordNanos = nowNanos;
        samples.addLast(new Sample(nowNanos, bytes));
        windowBytes += bytes;
        expire(nowNanos);
    }

    /// @return the rate over the last second in bytes per second
    public double windowRate(long nowNanos) {
        expire(nowNanos);
        long span = nowNanos - Math.max(startNanos, nowNanos - WINDOW_NANOS);
        if (span <= 0) {
            return windowBytes > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return windowBytes * 1_000_000_000.0 / span;
    }

    /// @return milliseconds to wait before the next read
    public long delayMillis(long nowNanos) {
        if (maxBytesPerSecond <= 0) {
            return 0;
        }
        double owedNanos = releaseNanos - nowNanos;
        if (owedNanos <= 0) {
            return 0;
        }
        long millis = (long) Math.ceil(owedNanos / 1_000_000.0);
        return Math.min(MAX_DELAY_MILLIS, millis);
    }

    private void expire(long nowNanos) {
        long cutoff = nowNanos - WINDOW_NANOS;
        while (!samples.isEmpty() && samples.peekFirst().nanos() <= cutoff) {
            windowBytes -= samples.removeFirst().bytes();
        }
    }
}
