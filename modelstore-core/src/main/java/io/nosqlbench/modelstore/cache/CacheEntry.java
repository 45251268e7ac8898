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
import java.time.Instant;

/// A verified artifact held in the cache, as recorded in `cache-index.json`.
///
/// @param name artifact name
/// @param version artifact version
/// @param sha256 checksum the file was verified against
/// @param format container format tag
/// @param path absolute location of the file
/// @param size stored size in bytes
/// @param storedAt epoch milliseconds when stored
/// @param lastAccess epoch milliseconds of the last hit, or of storage
/// @param loadCount number of hits served
public record CacheEntry(
    String name,
    String version,
    String sha256,
    String format,
    String path,
    long size,
    long storedAt,
    long lastAccess,
    int loadCount
) {
    /// @return `name@version`
    public String id() {
        return name + "@" + version;
    }

    public Path file() {
        return Path.of(path);
    }

    public Instant storedInstant() {
        return Instant.ofEpochMilli(storedAt);
    }

    public Instant lastAccessInstant() {
        return Instant.ofEpochMilli(lastAccess);
    }

    CacheEntry accessed(long now) {
        return new CacheEntry(name, version, sha256, format, path, size, storedAt, now, loadCount + 1);
    }
}
