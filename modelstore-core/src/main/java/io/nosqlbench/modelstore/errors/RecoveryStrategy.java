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

/// What a caller should do about a classified failure.
public enum RecoveryStrategy {
    /// Repeat the failed operation after a bounded wait.
    RETRY,
    /// Acquire a registered alternative artifact instead.
    FALLBACK,
    /// Stop and let an operator fix the environment.
    MANUAL,
    /// Stop; the failure must not be retried or downgraded.
    ABORT
}
