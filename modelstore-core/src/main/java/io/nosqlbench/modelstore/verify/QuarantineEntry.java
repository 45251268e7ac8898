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

import java.nio.file.Path;
import java.time.Instant;

/// One quarantined file, as recorded in `quarantine.json`.
///
/// @param quarantinePath absolute location of the file inside the quarantine directory
/// @param originalPath where the file was before it was quarantined
/// @param reason why it was quarantined
/// @param timestamp when it was quarantined, epoch milliseconds
/// @param expectedChecksum the checksum the descriptor promised, if known
/// @param actualChecksum the checksum computed, if known
/// @param expectedSize the size the descriptor promised, or -1
/// @param actualSize the size found, or -1
/// @param detail free text explaining the failure
public record QuarantineEntry(
    String quarantinePath,
    String originalPath,
    QuarantineReason reason,
    long timestamp,
    String expectedChecksum,
    String actualChecksum,
    long expectedSize,
    long actualSize,
    String detail
) {
    public Path path() {
        return Path.of(quarantinePath);
    }

    public Instant quarantinedAt() {
        return Instant.ofEpochMilli(timestamp);
    }
}
