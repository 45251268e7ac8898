package io.nosqlbench.modelstore.cache;

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

/// State of a cache lookup. Only [#VALID] is a hit.
public enum CacheStatus {
    /// No entry, or its file has disappeared.
    MISSING,
    /// Entry present, file matches the recorded size, checksum matches the descriptor.
    VALID,
    /// Entry present for the name and version, but recorded with a different checksum.
    INVALID,
    /// The file on disk no longer has the recorded size.
    CORRUPTED,
    /// Entry older than the maximum age under age-based eviction.
    OUTDATED
}
