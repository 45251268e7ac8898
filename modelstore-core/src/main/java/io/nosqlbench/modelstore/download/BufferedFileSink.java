package io.nosqlbench.modelstore.download;

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

import io.nosqlbench.modelstore.errors.ArtifactIOException;
import io.nosqlbench.modelstore.errors.DiskSpaceException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Buffered writer for a partial file.
///
/// [#write] always accepts the chunk, then reports whether the buffered bytes are still below the
/// high-water mark. When it returns false the producer must call [#drain] before reading more.
/// No chunk is ever dropped.
///
/// Filesystem failures surface as [ArtifactIOException], or [DiskSpaceException] when the device
/// is full, so they are never confused with network failures.
final class BufferedFileSink implements AutoCloseable {
    private final String artifactId;
    private final Path file;
    private final FileChannel channel;
    private final int highWaterMark;
    private ByteBuffer pending;
    private long position;

    /// @param append keep existing content and write after it; otherwise truncate
    BufferedFileSink(String artifactId, Path file, boolean append, int highWaterMark) {
        this.artifactId = artifactId;
        this.file = file;
        this.highWaterMark = highWaterMark;
        this.pending = ByteBuffer.allocate(Math.max(highWaterMark, 1024));
        try {
            this.channel = append
                ? FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)
                : FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            this.position = channel.size();
        } catch (IOException e) {
            throw new ArtifactIOException(artifactId, file, "Unable to open partial file", e);
        }
    }

    /// @return true while more chunks may be written without draining
    boolean write(ByteBuffer chunk) {
        int length = chunk.remaining();
        if (pending.remaining() < length) {
            ByteBuffer larger = ByteBuffer.allocate(Math.max(pending.capacity() * 2, pending.position() + length));
            pending.flip();
            larger.put(pending);
            pending = larger;
        }
        pending.put(chunk);
        return pending.position() < highWaterMark;
    }

    /// @return bytes accepted but not yet written to the file
    long buffered() {
        return pending.position();
    }

    /// @return bytes in the file plus bytes still buffered
    long position() {
        return position + pending.position();
    }

    void drain() {
        pending.flip();
        try {
            while (pending.hasRemaining()) {
                position += channel.write(pending);
            }
        } catch (IOException e) {
            throw translate(e);
        } finally {
            pending.compact();
        }
    }

    @Override
    public void close() {
        try (FileChannel ignored = channel) {
            drain();
            channel.force(false);
        } catch (IOException e) {
            throw translate(e);
        }
    }

    private RuntimeException translate(IOException e) {
        String message = e.getMessage();
        if (message != null && message.contains("No space left on device")) {
            long usable = -1;
            try {
                usable = Files.getFileStore(file.getParent()).getUsableSpace();
            } catch (IOException storeError) {
                e.addSuppressed(storeError);
            }
            DiskSpaceException full = new DiskSpaceException(artifactId, pending.remaining(), usable);
            full.initCause(e);
            return full;
        }
        return new ArtifactIOException(artifactId, file, "Unable to write partial file", e);
    }
}
