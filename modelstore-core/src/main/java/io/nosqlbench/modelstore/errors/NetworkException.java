package io.nosqlbench.modelstore.errors;

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

/// A transfer failed in transit: unreachable host, dropped connection, or an unusable status.
public class NetworkException extends AcquisitionException {
    private final int statusCode;

    public NetworkException(String artifactId, String message, Throwable cause) {
        this(artifactId, message, -1, cause);
    }

    /// @param statusCode the HTTP status, or -1 when no response was received
    public NetworkException(String artifactId, String message, int statusCode, Throwable cause) {
        super(ErrorCategory.NETWORK, artifactId, message, cause);
        this.statusCode = statusCode;
    }

    /// @return the HTTP status, or -1 when no response was received
    public int getStatusCode() {
        return statusCode;
    }
}
