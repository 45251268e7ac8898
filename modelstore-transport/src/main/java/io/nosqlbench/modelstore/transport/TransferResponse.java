package io.nosqlbench.modelstore.transport;

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

import java.io.IOException;
import java.nio.channels.ReadableByteChannel;

/// An open response to a [RangeRequest].
///
/// The body is consumed through [#channel()]. The response must be closed when the caller is
/// done with it, whether or not the body was fully read.
public interface TransferResponse extends AutoCloseable {

    /// @return the request this response answers
    RangeRequest request();

    /// @return the HTTP status
    int statusCode();

    /// @return the byte offset of the first body byte within the resource; 0 when the server
    /// ignored a requested range and sent everything
    long startOffset();

    /// @return the number of body bytes to expect, or -1 if unknown
    long contentLength();

    /// @return the full size of the resource, or -1 if unknown
    long totalSize();

    /// @return the `Last-Modified` or `ETag` validator, or null if neither was sent
    String validator();

    /// @return true when the server honored the requested range
    default boolean isPartial() {
        return statusCode() == 206;
    }

    /// @return the body as a channel
    /// @throws IOException if the response has no body
    ReadableByteChannel channel() throws IOException;

    @Override
    void close();
}
