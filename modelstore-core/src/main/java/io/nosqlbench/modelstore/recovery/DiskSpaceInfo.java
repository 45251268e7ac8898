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

import java.nio.file.Path;

/// Free space at a location, measured against a requirement.
///
/// @param path the location asked about
/// @param totalBytes size of the file store
/// @param freeBytes unallocated bytes
/// @param usableBytes bytes this process may use
/// @param requiredBytes bytes the caller needs, not counting the reserved minimum
/// @param sufficient whether usable space covers the requirement plus the reserved minimum
/// @param estimated true when the file store could not be read and the figures are a
/// conservative guess
public record DiskSpaceInfo(
    Path path,
    long totalBytes,
    long freeBytes,
    long usableBytes,
    long requiredBytes,
    boolean sufficient,
    boolean estimated
) {
}
