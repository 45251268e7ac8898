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

import java.util.concurrent.CancellationException;

/// Raised to callers of a transfer that was cancelled. The partial file is kept for a later
/// resume.
public class TransferCancelledException extends CancellationException {
    private final String transferId;
    private final long bytesWritten;

    public TransferCancelledException(String transferId, long bytesWritten) {
        super("Transfer " + transferId + " cancelled after " + bytesWritten + " bytes");
        this.transferId = transferId;
        this.bytesWritten = bytesWritten;
    }

    public String getTransferId() {
        return transferId;
    }

    /// @return bytes durably held in the partial file when the transfer stopped
    public long getBytesWritten() {
        return bytesWritten;
    }
}
