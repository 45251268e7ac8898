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

import java.nio.file.Path;

/// Result of [CacheManager#checkCache].
///
/// @param status the lookup state
/// @param path the cached file on a hit, otherwise null
/// @param entry the entry consulted, or null when there was none
public record CacheLookup(CacheStatus status, Path path, CacheEntry entry) {

    /// @return true only for [CacheStatus#VALID]
    public boolean hit() {
        return status == CacheStatus.VALID;
    }

    static CacheLookup miss(CacheStatus status, CacheEntry entry) {
        return new CacheLookup(status, null, entry);
    }
}
