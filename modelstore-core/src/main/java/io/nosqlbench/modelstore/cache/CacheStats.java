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

import java.time.Instant;

/// Cache totals and counters since construction.
///
/// @param totalModels entries held
/// @param totalSize bytes held
/// @param hitRate hits divided by lookups, 0 before the first lookup
/// @param hits lookups answered with a valid entry
/// @param misses lookups which were not
/// @param evictions entries removed by eviction
/// @param oldestEntry storage time of the oldest entry, null when empty
/// @param newestEntry storage time of the newest entry, null when empty
public record CacheStats(
    int totalModels,
    long totalSize,
    double hitRate,
    long hits,
    long misses,
    long evictions,
    Instant oldestEntry,
    Instant newestEntry
) {
}
