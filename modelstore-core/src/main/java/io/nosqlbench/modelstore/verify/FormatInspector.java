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

import io.nosqlbench.modelstore.artifact.ContainerFormat;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/// Checks that a file plausibly holds the container format it claims.
///
/// Only the leading bytes are read. The check catches truncated downloads and error pages
/// saved under a model name; it does not parse the model.
final class FormatInspector {
    private static final int HEADER_PROBE = 64;

    private FormatInspector() {
    }

    /// @param file the file to inspect
    /// @param format the expected format
    /// @return a description of the problem, or empty if the header looks right
    /// @throws IOException if the file cannot be read
    static Optional<String> inspect(Path file, ContainerFormat format) throws IOException {
        byte[] header;
        long size;
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            size = channel.size();
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(HEADER_PROBE, size));
            int read;
            do {
                read = channel.read(buffer);
            } while (read >= 0 && buffer.hasRemaining());
            header = Arrays.copyOf(buffer.array(), buffer.position());
        }

        if (size < format.minimumSize()) {
            return Optional.of("File too small to be a valid " + format.tag() + " model: " + size
                + " bytes, minimum " + format.minimumSize());
        }
        byte[] magic = format.magic();
        if (magic.length > 0 && !startsWith(header, magic)) {
            return Optional.of("File does not contain valid " + format.tag() + " header magic bytes");
        }
        switch (format) {
            case ONNX -> {
                byte[] onnxHeader = Arrays.copyOf(header, (int) Math.min(header.length, ContainerFormat.ONNX.minimumSize()));
                if (countProtobufFields(onnxHeader) < 2) {
                    return Optional.of("File header does not match onnx protobuf structure");
                }
            }
            case SAFETENSORS -> {
                long headerLength = ByteBuffer.wrap(header, 0, 8).order(ByteOrder.LITTLE_ENDIAN).getLong();
                if (headerLength <= 0 || headerLength > size - 8) {
                    return Optional.of("Invalid safetensors header length: " + headerLength);
                }
                if (header[8] != '{') {
                    return Optional.of("File does not contain a safetensors JSON header");
                }
            }
            default -> {
            }
        }
        return Optional.empty();
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /// Walks leading protobuf field tags, stopping at the first invalid tag or after 5 fields.
    static int countProtobufFields(byte[] buffer) {
        int offset = 0;
        int fieldCount = 0;
        while (offset < buffer.length - 1 && fieldCount < 5) {
            int tag = buffer[offset] & 0xff;
            int wireType = tag & 0x07;
            int fieldNumber = tag >> 3;
            if (wireType > 5 || fieldNumber == 0) {
                break;
            }
            fieldCount++;
            switch (wireType) {
                case 0 -> {
                    offset++;
                    while (offset < buffer.length && (buffer[offset] & 0x80) != 0) {
                        offset++;
                    }
                    offset++;
                }
                case 1 -> offset += 9;
                case 2 -> {
                    offset++;
                    if (offset < buffer.length) {
                        offset += 1 + (buffer[offset] & 0xff);
                    }
                }
                case 5 -> offset += 5;
                default -> offset++;
            }
        }
        return fieldCount;
    }
}
