package io.nosqlbench.modelstore;

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

import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.verify.Checksums;

import java.net.URI;
import java.util.Random;

/// Synthetic artifact content and descriptors for tests.
public final class TestArtifacts {

    private TestArtifacts() {
    }

    /// @return deterministic pseudo-random bytes
    public static byte[] content(int size, long seed) {
        byte[] data = new byte[size];
        new Random(seed).nextBytes(data);
        return data;
    }

    /// @return bytes which pass the gguf header check
    public static byte[] ggufContent(int size, long seed) {
        byte[] data = content(size, seed);
        data[0] = 'G';
        data[1] = 'G';
        data[2] = 'U';
        data[3] = 'F';
        return data;
    }

    /// @return a descriptor matching the content exactly
    public static ArtifactDescriptor describe(String name, String version, URI url, byte[] content, String format) {
        return new ArtifactDescriptor(name, version, url, Checksums.sha256(content), content.length, format, 384);
    }

    public static ArtifactDescriptor describe(String name, URI url, byte[] content) {
        return describe(name, "1.0.0", url, content, "bin");
    }
}
