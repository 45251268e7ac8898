package io.nosqlbench.modelstore.artifact;

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

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/// Immutable description of one versioned model artifact, as supplied by a registry.
///
/// @param name unique artifact name; used in file names, so it may not contain path separators
/// @param version semantic version string
/// @param url the source location
/// @param sha256 expected SHA-256 checksum in hex
/// @param size expected size in bytes
/// @param format container format tag, e.g. `onnx`
/// @param dimensions embedding dimension hint, 0 when unknown
public record ArtifactDescriptor(
    String name,
    String version,
    URI url,
    String sha256,
    long size,
    String format,
    int dimensions
) {
    public ArtifactDescriptor {
        requireSafeSegment(name, "name");
        requireSafeSegment(version, "version");
        requireSafeSegment(format, "format");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(sha256, "sha256");
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        if (dimensions < 0) {
            throw new IllegalArgumentException("dimensions cannot be negative: " + dimensions);
        }
        sha256 = sha256.trim().toLowerCase(Locale.ROOT);
        format = format.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireSafeSegment(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
        if (value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException(field + " cannot contain path elements: " + value);
        }
    }

    /// @return the transfer and cache key, `name@version`
    public String id() {
        return name + "@" + version;
    }

    /// @return `<name>-<version>.<format>`
    public String fileName() {
        return name + "-" + version + "." + format;
    }

    /// @return `<name>-<version>.<format>.partial`
    public String partialFileName() {
        return fileName() + ".partial";
    }

    /// @return true if this and the other descriptor name the same bytes
    public boolean sameArtifact(ArtifactDescriptor other) {
        return other != null
            && name.equals(other.name)
            && version.equals(other.version)
            && sha256.equals(other.sha256);
    }

    @Override
    public String toString() {
        return id() + " (" + format + ", " + size + " bytes)";
    }
}
