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

import java.time.Duration;
import java.time.Instant;

/// Point-in-time view of a transfer, safe to hand to any thread.
///
/// @param id `name@version`
/// @param status current status
/// @param bytesTransferred bytes held in the partial file, including resumed bytes
/// @param totalBytes expected final size, -1 when unknown
/// @param startTime when the transfer was created
/// @param lastUpdate when progress was last recorded
/// @param speed moving-average speed in bytes per second
/// @param eta estimated time remaining, null when it cannot be estimated
/// @param resumeInfo resume point, null when the transfer started from zero
public record TransferSnapshot(
    String id,
    TransferStatus status,
    long bytesTransferred,
    long totalBytes,
    Instant startTime,
    Instant lastUpdate,
    double speed,
    Duration eta,
    ResumeInfo resumeInfo
) {
    /// @return completion in percent, 0 when the total is unknown
    public double percentage() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return Math.min(100.0, 100.0 * bytesTransferred / totalBytes);
    }
}
