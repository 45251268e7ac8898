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

/// Not enough usable space for an artifact.
public class DiskSpaceException extends AcquisitionException {
    private final long requiredBytes;
    private final long availableBytes;

    public DiskSpaceException(String artifactId, long requiredBytes, long availableBytes) {
        super(ErrorCategory.DISK_SPACE, artifactId,
            "Insufficient disk space: required " + requiredBytes + " bytes, available " + availableBytes + " bytes");
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
