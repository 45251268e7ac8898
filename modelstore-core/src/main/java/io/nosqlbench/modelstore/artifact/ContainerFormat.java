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

import java.util.Locale;
import java.util.Optional;

/// Container formats the pipeline knows how to sanity-check.
///
/// Each format has a recognized leading byte sequence and a minimum plausible file size. A
/// file which does not begin with the magic bytes, or is smaller than the minimum, is reported
/// as having a corrupted header.
public enum ContainerFormat {
    /// Leading protobuf tags of an ONNX `ModelProto`: ir_version varint, then a
    /// length-delimited field.
    ONNX("onnx", new byte[]{0x08, 0x01, 0x12}, 32),
    /// `GGUF` in ASCII followed by version and tensor counts.
    GGUF("gguf", new byte[]{'G', 'G', 'U', 'F'}, 24),
    /// An 8-byte little-endian header length, then a JSON header starting with `{`.
    SAFETENSORS("safetensors", new byte[0], 10),
    /// Opaque binary, only required to be non-empty.
    BIN("bin", new byte[0], 1);

    private final String tag;
    private final byte[] magic;
    private final long minimumSize;

    ContainerFormat(String tag, byte[] magic, long minimumSize) {
        this.tag = tag;
        this.magic = magic;
        this.minimumSize = minimumSize;
    }

    /// @return the lower-case tag, also used as file extension
    public String tag() {
        return tag;
    }

    /// @return a copy of the leading magic bytes, empty when the format has none
    public byte[] magic() {
        return magic.clone();
    }

    /// @return the smallest size a well-formed file of this format can have
    public long minimumSize() {
        return minimumSize;
    }

    /// @param tag a format tag as supplied by a descriptor, any case
    /// @return the matching format, or empty if the tag is not recognized
    public static Optional<ContainerFormat> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ContainerFormat format : values()) {
            if (format.tag.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
