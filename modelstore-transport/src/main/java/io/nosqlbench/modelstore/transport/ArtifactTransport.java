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

/// A source of artifact bytes that understands [RangeRequest]s.
///
/// Implementations must be safe for concurrent use by several transfers.
public interface ArtifactTransport extends AutoCloseable {

    /// Issues the request and returns the open response.
    ///
    /// For GET requests, only `200 OK` and `206 Partial Content` are returned; any other status
    /// raises a [TransportException]. HEAD requests return whatever status the server sent.
    ///
    /// @param request the request to send
    /// @return the open response, which the caller must close
    /// @throws IOException on connection failures or unusable statuses
    TransferResponse open(RangeRequest request) throws IOException;

    @Override
    void close();
}
