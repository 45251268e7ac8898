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
import java.net.URI;

/// Signals that a transfer request was answered with a status the transport cannot use.
public class TransportException extends IOException {
    private final URI uri;
    private final int statusCode;
    private final long resourceSize;

    /// @param message the error message
    /// @param uri the requested resource
    /// @param statusCode the HTTP status returned
    /// @param resourceSize the full size of the resource when the server reported it, otherwise -1
    public TransportException(String message, URI uri, int statusCode, long resourceSize) {
        super(message);
        this.uri = uri;
        this.statusCode = statusCode;
        this.resourceSize = resourceSize;
    }

    public TransportException(String message, URI uri, int statusCode) {
        this(message, uri, statusCode, -1L);
    }

    public URI getUri() {
        return uri;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /// @return the full resource size reported with the error, or -1 if unknown
    public long getResourceSize() {
        return resourceSize;
    }

    /// @return true for `416 Range Not Satisfiable`
    public boolean isRangeNotSatisfiable() {
        return statusCode == 416;
    }

    /// @return true for 5xx statuses, which may succeed if repeated
    public boolean isServerError() {
        return statusCode >= 500;
    }
}
