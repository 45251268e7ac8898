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
import java.time.Duration;
import java.util.List;

/// Outcome of verifying one file.
///
/// @param valid true when every check that ran passed
/// @param errors the failing checks, in the order they ran
/// @param checksum the computed SHA-256, or null when hashing was skipped or impossible
/// @param actualSize the file size in bytes, or -1 when the file could not be read
/// @param reason the quarantine reason when invalid, otherwise null
/// @param quarantinePath where the file was moved when invalid, otherwise null
/// @param elapsed time spent verifying
public record VerificationResult(
    boolean valid,
    List<String> errors,
    String checksum,
    long actualSize,
    QuarantineReason reason,
    Path quarantinePath,
    Duration elapsed
) {
    public VerificationResult {
        errors = List.copyOf(errors);
    }

    /// @return a copy of this result recording where the file was quarantined
    VerificationResult quarantinedAt(Path path) {
        return new VerificationResult(valid, errors, checksum, actualSize, reason, path, elapsed);
    }
}
