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

/// Checks which [IntegrityVerifier#verify] may skip.
///
/// @param skipChecksum do not hash the file
/// @param skipSizeCheck do not compare the file size
/// @param skipFormatCheck do not inspect the container header
public record VerificationOptions(boolean skipChecksum, boolean skipSizeCheck, boolean skipFormatCheck) {

    /// @return options which run every check
    public static VerificationOptions all() {
        return new VerificationOptions(false, false, false);
    }

    public VerificationOptions withoutChecksum() {
        return new VerificationOptions(true, skipSizeCheck, skipFormatCheck);
    }

    public VerificationOptions withoutSizeCheck() {
        return new VerificationOptions(skipChecksum, true, skipFormatCheck);
    }

    public VerificationOptions withoutFormatCheck() {
        return new VerificationOptions(skipChecksum, skipSizeCheck, true);
    }
}
