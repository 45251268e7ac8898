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

/// Why a file was moved into quarantine. When several checks fail, the reason is the first
/// failing check in declaration order.
public enum QuarantineReason {
    CHECKSUM_MISMATCH,
    SIZE_MISMATCH,
    CORRUPTED_HEADER,
    INVALID_FORMAT,
    UNKNOWN_ERROR
}
